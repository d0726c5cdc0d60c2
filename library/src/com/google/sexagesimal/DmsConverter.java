/*
 * Copyright 2025 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.sexagesimal;

import static com.google.sexagesimal.AngleUnits.MINUTES_PER_DEGREE;
import static com.google.sexagesimal.AngleUnits.SECONDS_PER_DEGREE;
import static com.google.sexagesimal.AngleUnits.SECONDS_PER_MINUTE;
import static java.lang.Math.abs;

import com.google.common.base.Preconditions;

/**
 * Converts between decimal degrees and degree/minute/second triples.
 *
 * <p>{@link #decompose} and {@link #recompose} are inverses up to floating point rounding. Neither
 * one validates the range of minutes or seconds; that is left to {@link AngleParser}.
 */
public final class DmsConverter {

  private DmsConverter() {}

  /**
   * Splits {@code decimalDegrees} into whole degrees, whole minutes and fractional seconds. The
   * sign, if any, is placed on the degrees if they are non-zero, otherwise on the minutes if they
   * are non-zero, otherwise on the seconds.
   *
   * @throws IllegalArgumentException if the value is not finite or its whole degrees do not fit in
   *     a long, i.e. its magnitude is 2<sup>63</sup> or more
   */
  public static DmsTriple decompose(double decimalDegrees) {
    Preconditions.checkArgument(
        canDecompose(decimalDegrees), "Cannot decompose %s degrees", decimalDegrees);
    boolean negative = decimalDegrees < 0;
    double magnitude = abs(decimalDegrees);

    long degrees = (long) magnitude;
    double remainder = (magnitude - degrees) * MINUTES_PER_DEGREE;
    int minutes = (int) remainder;
    double seconds = (remainder - minutes) * SECONDS_PER_MINUTE;

    if (negative) {
      if (degrees != 0) {
        degrees = -degrees;
      } else if (minutes != 0) {
        minutes = -minutes;
      } else {
        seconds = -seconds;
      }
    }
    return new DmsTriple(degrees, minutes, seconds, negative && degrees == 0);
  }

  /** Returns true if the given value is finite and its whole degrees fit in a long. */
  static boolean canDecompose(double decimalDegrees) {
    // (double) Long.MAX_VALUE is 2^63, the first magnitude that does not fit.
    return Double.isFinite(decimalDegrees) && abs(decimalDegrees) < (double) Long.MAX_VALUE;
  }

  /**
   * Returns the decimal degrees of the given components. The result is negative if the degrees are
   * negative, or the degrees are zero and the minutes negative, or both are zero and the seconds
   * negative; the signs of less significant components are ignored. Minutes and seconds of 60 or
   * more are accepted as they are.
   */
  public static double recompose(long degrees, int minutes, double seconds) {
    boolean negative =
        degrees < 0
            || (degrees == 0 && minutes < 0)
            || (degrees == 0 && minutes == 0 && seconds < 0);
    double result =
        abs((double) degrees) + abs((double) minutes) / MINUTES_PER_DEGREE
            + abs(seconds) / SECONDS_PER_DEGREE;
    return negative ? -result : result;
  }
}
