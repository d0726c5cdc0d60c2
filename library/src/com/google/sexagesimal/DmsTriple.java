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

import com.google.common.primitives.Longs;
import com.google.errorprone.annotations.Immutable;
import jsinterop.annotations.JsType;

/**
 * An angle split into whole degrees, whole minutes of arc and seconds of arc, as produced by
 * {@link DmsConverter#decompose(double)}.
 *
 * <p>The sign of a negative angle is carried by exactly one component: the most significant one
 * that is non-zero. The other components are non-negative. Because a long cannot hold -0, a
 * negative angle smaller than one degree has {@code degrees() == 0} and {@link #negativeAtZero()}
 * set, and its sign is found on the minutes, or on the seconds when the minutes are also zero.
 */
@Immutable
@JsType
public final class DmsTriple {
  private final long degrees;
  private final int minutes;
  private final double seconds;
  private final boolean negativeAtZero;

  DmsTriple(long degrees, int minutes, double seconds, boolean negativeAtZero) {
    this.degrees = degrees;
    this.minutes = minutes;
    this.seconds = seconds;
    this.negativeAtZero = negativeAtZero;
  }

  /** Returns the whole degrees, negative if this angle is negative and at least one degree. */
  public long degrees() {
    return degrees;
  }

  /** Returns the whole minutes of arc, in [-59, 59]. */
  public int minutes() {
    return minutes;
  }

  /** Returns the seconds of arc, with magnitude in [0, 60). */
  public double seconds() {
    return seconds;
  }

  /** Returns true if the angle is negative but its whole degrees are zero. */
  public boolean negativeAtZero() {
    return negativeAtZero;
  }

  /** Returns true if the decomposed angle was negative. */
  public boolean isNegative() {
    return degrees < 0 || negativeAtZero;
  }

  /** Returns the decimal degrees this triple was decomposed from, up to rounding. */
  public double toDegrees() {
    double value = DmsConverter.recompose(degrees, minutes, seconds);
    return negativeAtZero ? -Math.abs(value) : value;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof DmsTriple)) {
      return false;
    }
    DmsTriple o = (DmsTriple) that;
    return degrees == o.degrees
        && minutes == o.minutes
        && Double.doubleToLongBits(seconds) == Double.doubleToLongBits(o.seconds)
        && negativeAtZero == o.negativeAtZero;
  }

  @Override
  public int hashCode() {
    long value = Double.doubleToLongBits(seconds);
    int result = 31 * Longs.hashCode(degrees) + minutes;
    result = 31 * result + (int) (value ^ (value >>> 32));
    return 31 * result + (negativeAtZero ? 1 : 0);
  }

  @Override
  public String toString() {
    return "(" + degrees + ", " + minutes + ", " + seconds + (negativeAtZero ? ", -0)" : ")");
  }
}
