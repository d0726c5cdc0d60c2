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

import static java.lang.Math.PI;
import static java.lang.Math.floor;

/**
 * Conversions between angle units. These are the only angle helpers shared with the numeric
 * formulas that work on plain doubles; they do not use {@link Angle}.
 */
public final class AngleUnits {
  /** Minutes of arc in one degree. */
  public static final double MINUTES_PER_DEGREE = 60.0;

  /** Seconds of arc in one minute of arc. */
  public static final double SECONDS_PER_MINUTE = 60.0;

  /** Seconds of arc in one degree. */
  public static final double SECONDS_PER_DEGREE = 3600.0;

  /** Degrees in a full turn. */
  public static final double DEGREES_PER_TURN = 360.0;

  private static final double RADIANS_PER_DEGREE = PI / 180;
  private static final double DEGREES_PER_RADIAN = 180 / PI;

  private AngleUnits() {}

  /** Converts degrees to radians. */
  public static double degreesToRadians(double degrees) {
    return degrees * RADIANS_PER_DEGREE;
  }

  /** Converts radians to degrees. */
  public static double radiansToDegrees(double radians) {
    return radians * DEGREES_PER_RADIAN;
  }

  /** Returns {@code degrees} reduced to the range [0, 360). */
  public static double normalizeDegrees(double degrees) {
    return degrees - DEGREES_PER_TURN * floor(degrees / DEGREES_PER_TURN);
  }
}
