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

import static com.google.sexagesimal.AngleUnits.SECONDS_PER_MINUTE;
import static java.lang.Math.abs;
import static java.lang.Math.max;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.math.BigDecimal;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * Renders decimal degrees as text in one of the {@link AngleFormat}s. An AngleFormatter is an
 * immutable bundle of format, precision and field width; the {@code with} methods return modified
 * copies, so settings may be applied in any order:
 *
 * <pre>{@code
 * String s = AngleFormatter.DEFAULT.withFormat(AngleFormat.DEG_MIN_SEC_FRAC).withPrecision(2)
 *     .format(12.3456);  // "12 20 44.16"
 * }</pre>
 *
 * <p>Components are separated by single spaces. A negative sign is written on the first component
 * that is not zero, so -0.3456 in {@link AngleFormat#DEG_MIN} is "0 -20". When the sign belongs
 * to seconds that a format truncates away, it is dropped. When a fractional component rounds up to
 * 60 at the requested precision, it is written as zero and the next larger component is
 * incremented, so the output always parses with {@link AngleParser}.
 *
 * <p>{@link Angle#toString()} uses the same rules with degree, minute and second symbols and a
 * fixed precision, e.g. "-8°09'10.008\"".
 */
@Immutable
@JsType
public final class AngleFormatter {
  /** The number of fractional digits used when none is specified. */
  public static final int DEFAULT_PRECISION = 2;

  /** Decimal degrees with {@link #DEFAULT_PRECISION} digits and no padding. */
  public static final AngleFormatter DEFAULT =
      new AngleFormatter(AngleFormat.DECIMAL, DEFAULT_PRECISION, 0);

  /** Fractional digits of decimal degrees in the symbol rendering. */
  static final int SYMBOL_DECIMAL_PRECISION = 5;

  /** Fractional digits of minutes or seconds in the symbol rendering. */
  static final int SYMBOL_FRACTION_PRECISION = 3;

  private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

  /** The two ways components are decorated. */
  private enum Style {
    PLAIN(" ", "", "", ""),
    SYMBOLS("", "°", "'", "\"");

    private final String separator;
    private final String[] suffixes;

    private Style(String separator, String... suffixes) {
      this.separator = separator;
      this.suffixes = suffixes;
    }
  }

  private final AngleFormat format;
  private final int precision;
  private final int width;

  private AngleFormatter(AngleFormat format, int precision, int width) {
    this.format = Preconditions.checkNotNull(format);
    this.precision = max(precision, 0);
    this.width = max(width, 0);
  }

  /**
   * Returns a formatter with the given settings. A negative precision is treated as 0, and a
   * negative width as no padding.
   */
  public static AngleFormatter of(AngleFormat format, int precision, int width) {
    return new AngleFormatter(format, precision, width);
  }

  /** Returns a copy of this formatter that writes the given format. */
  @CheckReturnValue
  public AngleFormatter withFormat(AngleFormat format) {
    return new AngleFormatter(format, precision, width);
  }

  /**
   * Returns a copy of this formatter that writes {@code precision} fractional digits. Only {@link
   * AngleFormat#DECIMAL}, {@link AngleFormat#DEG_MIN_FRAC} and {@link
   * AngleFormat#DEG_MIN_SEC_FRAC} have a fraction; a negative precision is treated as 0.
   *
   * <p>At precision 0 the fractional minutes or seconds are written without a decimal point, so
   * {@link AngleParser} reads the text back as {@link AngleFormat#DEG_MIN} or {@link
   * AngleFormat#DEG_MIN_SEC}: "11 0 0" rather than "11 0 0.". The value is unaffected.
   */
  @CheckReturnValue
  public AngleFormatter withPrecision(int precision) {
    return new AngleFormatter(format, precision, width);
  }

  /**
   * Returns a copy of this formatter that pads its output on the right with spaces to at least
   * {@code width} characters. Longer output is never truncated.
   */
  @CheckReturnValue
  public AngleFormatter withWidth(int width) {
    return new AngleFormatter(format, precision, width);
  }

  /** Returns the format this formatter writes. */
  public AngleFormat angleFormat() {
    return format;
  }

  /** Returns the number of fractional digits this formatter writes. */
  public int precision() {
    return precision;
  }

  /** Returns the minimum length of the output. */
  public int width() {
    return width;
  }

  /**
   * Formats the given decimal degrees with this formatter's settings.
   *
   * @throws IllegalArgumentException if a sexagesimal format is requested for a value that
   *     {@link DmsConverter#decompose(double)} rejects
   */
  public String format(double degrees) {
    return format(degrees, format, precision, width);
  }

  /**
   * Formats the given angle with this formatter's settings; the angle's own format is ignored. Use
   * {@link Angle#format(int, int)} to keep it.
   */
  @JsIgnore
  public String format(Angle angle) {
    return format(angle.degrees());
  }

  /**
   * Formats {@code degrees} in the given format, with {@code precision} fractional digits, padded
   * on the right to {@code width} characters.
   */
  @JsIgnore
  public static String format(double degrees, AngleFormat format, int precision, int width) {
    String result = render(degrees, format, max(precision, 0), Style.PLAIN);
    return Strings.padEnd(result, max(width, 0), ' ');
  }

  /** Formats {@code degrees} with the degree, minute and second symbols, for debugging. */
  static String formatWithSymbols(double degrees, AngleFormat format) {
    int digits =
        format == AngleFormat.DECIMAL ? SYMBOL_DECIMAL_PRECISION : SYMBOL_FRACTION_PRECISION;
    return render(degrees, format, digits, Style.SYMBOLS);
  }

  private static String render(double degrees, AngleFormat format, int precision, Style style) {
    if (format == AngleFormat.DECIMAL) {
      return Platform.formatFixed(degrees, precision) + style.suffixes[0];
    }

    DmsTriple dms = DmsConverter.decompose(degrees);
    long wholeDegrees = abs(dms.degrees());
    int minutes = abs(dms.minutes());
    double seconds = abs(dms.seconds());

    // Magnitudes of the components, most significant first.
    String[] texts;
    boolean[] nonZero;
    switch (format) {
      case DEG_MIN:
        texts = new String[] {Long.toString(wholeDegrees), Integer.toString(minutes)};
        nonZero = new boolean[] {wholeDegrees != 0, minutes != 0};
        break;
      case DEG_MIN_SEC:
        {
          int wholeSeconds = (int) seconds;
          texts =
              new String[] {
                Long.toString(wholeDegrees),
                Integer.toString(minutes),
                Integer.toString(wholeSeconds)
              };
          nonZero = new boolean[] {wholeDegrees != 0, minutes != 0, wholeSeconds != 0};
          break;
        }
      case DEG_MIN_FRAC:
        {
          BigDecimal fractionalMinutes =
              Platform.roundFixed(minutes + seconds / SECONDS_PER_MINUTE, precision);
          if (fractionalMinutes.compareTo(SIXTY) >= 0) {
            fractionalMinutes = fractionalMinutes.subtract(SIXTY);
            wholeDegrees++;
          }
          texts = new String[] {Long.toString(wholeDegrees), fractionalMinutes.toPlainString()};
          nonZero = new boolean[] {wholeDegrees != 0, fractionalMinutes.signum() != 0};
          break;
        }
      case DEG_MIN_SEC_FRAC:
        {
          BigDecimal fractionalSeconds = Platform.roundFixed(seconds, precision);
          if (fractionalSeconds.compareTo(SIXTY) >= 0) {
            fractionalSeconds = fractionalSeconds.subtract(SIXTY);
            if (++minutes == 60) {
              minutes = 0;
              wholeDegrees++;
            }
          }
          texts =
              new String[] {
                Long.toString(wholeDegrees),
                Integer.toString(minutes),
                fractionalSeconds.toPlainString()
              };
          nonZero =
              new boolean[] {wholeDegrees != 0, minutes != 0, fractionalSeconds.signum() != 0};
          break;
        }
      default:
        throw new IllegalArgumentException("Unknown format: " + format);
    }

    int signIndex = signIndex(dms, format, nonZero);
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < texts.length; i++) {
      if (i > 0) {
        out.append(style.separator);
      }
      boolean fractional = format.isFractional() && i == texts.length - 1;
      if (i == signIndex) {
        out.append('-').append(texts[i]);
      } else if (style == Style.SYMBOLS && i > 0 && !fractional) {
        out.append(Strings.padStart(texts[i], 2, '0'));
      } else {
        out.append(texts[i]);
      }
      out.append(style.suffixes[i]);
    }
    return out.toString();
  }

  /**
   * Returns the index of the component that carries the minus sign, or -1 if none does. The sign
   * goes on the degrees unless they are zero, in which case {@code negativeAtZero} moves it to the
   * first non-zero component after them. If every component after the degrees is zero, a fractional
   * last component still carries the sign ("-0.00") and a truncated one does not.
   */
  private static int signIndex(DmsTriple dms, AngleFormat format, boolean[] nonZero) {
    if (!dms.isNegative()) {
      return -1;
    }
    if (!dms.negativeAtZero() || nonZero[0]) {
      return 0;
    }
    for (int i = 1; i < nonZero.length; i++) {
      if (nonZero[i]) {
        return i;
      }
    }
    return format.isFractional() ? nonZero.length - 1 : -1;
  }
}
