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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An angle in decimal degrees, tagged with the {@link AngleFormat} it is displayed in.
 *
 * <p>The degrees are not restricted to any range; use {@link #normalize()} to reduce them to [0,
 * 360). Changing the format never changes the degrees. Angles are equal if they have the same
 * degrees and the same format.
 */
@Immutable
@JsType
public final class Angle implements Serializable {

  /** A zero angle in decimal format. */
  public static final Angle ZERO = new Angle(0, AngleFormat.DECIMAL);

  private final double degrees;
  private final AngleFormat format;

  private Angle(double degrees, AngleFormat format) {
    this.degrees = degrees;
    this.format = Preconditions.checkNotNull(format);
  }

  /** Returns a new Angle of the given decimal degrees, in {@link AngleFormat#DECIMAL}. */
  public static Angle degrees(double degrees) {
    return new Angle(degrees, AngleFormat.DECIMAL);
  }

  /** Returns a new Angle of the given decimal degrees and display format. */
  public static Angle of(double degrees, AngleFormat format) {
    return new Angle(degrees, format);
  }

  /**
   * Returns a new Angle from degrees, minutes and seconds, in {@link
   * AngleFormat#DEG_MIN_SEC_FRAC}. See {@link DmsConverter#recompose(long, int, double)} for how
   * signs are interpreted.
   */
  public static Angle fromDms(long degrees, int minutes, double seconds) {
    return new Angle(
        DmsConverter.recompose(degrees, minutes, seconds), AngleFormat.DEG_MIN_SEC_FRAC);
  }

  /**
   * Parses an angle from text, inferring its format.
   *
   * @throws AngleParseException on unparsable input
   * @see AngleParser#parseOrDie(String)
   */
  public static Angle parse(String text) {
    return AngleParser.parseOrDie(text);
  }

  /** Returns the angle in decimal degrees. */
  public double degrees() {
    return degrees;
  }

  /** Returns the angle in radians. */
  public double radians() {
    return AngleUnits.degreesToRadians(degrees);
  }

  /** Returns the format this angle is displayed in. */
  public AngleFormat format() {
    return format;
  }

  /** Returns an angle with the same degrees, displayed in the given format. */
  @CheckReturnValue
  public Angle withFormat(AngleFormat format) {
    return format == this.format ? this : new Angle(degrees, format);
  }

  /** Returns this angle reduced to [0, 360) degrees, in the same format. */
  @CheckReturnValue
  public Angle normalize() {
    if (degrees >= 0 && degrees < AngleUnits.DEGREES_PER_TURN) {
      return this;
    }
    return new Angle(AngleUnits.normalizeDegrees(degrees), format);
  }

  /**
   * Returns the degree/minute/second decomposition of this angle.
   *
   * @throws IllegalArgumentException if the degrees are not finite or too large for a long
   */
  public DmsTriple toDms() {
    return DmsConverter.decompose(degrees);
  }

  /**
   * Formats this angle in its own format, space separated, with {@code precision} fractional
   * digits and padded on the right to {@code width} characters.
   */
  @JsIgnore
  public String format(int precision, int width) {
    return AngleFormatter.format(degrees, format, precision, width);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof Angle) {
      Angle o = (Angle) that;
      return Double.doubleToLongBits(degrees) == Double.doubleToLongBits(o.degrees)
          && format == o.format;
    }
    return false;
  }

  @Override
  public int hashCode() {
    long value = Double.doubleToLongBits(degrees);
    return 31 * (int) (value ^ (value >>> 32)) + format.hashCode();
  }

  /**
   * Writes the angle in its format with degree, minute and second symbols, e.g. "15.50000°",
   * "-8°09'" or "0°-20'44.160\"". Decimal degrees have 5 fractional digits and fractional minutes
   * or seconds have 3. Angles that cannot be decomposed, such as infinity, are always written in
   * decimal degrees.
   */
  @Override
  public String toString() {
    AngleFormat shown = DmsConverter.canDecompose(degrees) ? format : AngleFormat.DECIMAL;
    return AngleFormatter.formatWithSymbols(degrees, shown);
  }
}
