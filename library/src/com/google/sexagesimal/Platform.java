/*
 * Copyright 2013 Google Inc.
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

import com.google.common.annotations.GwtCompatible;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Contains utility methods which require different GWT client and server implementations. This
 * contains the server side implementations.
 */
@GwtCompatible(emulated = true)
final class Platform {

  private Platform() {}

  /**
   * Returns the {@link Logger} for the class.
   *
   * @see Logger#getLogger(String)
   */
  static Logger getLoggerForClass(Class<?> clazz) {
    return Logger.getLogger(clazz.getCanonicalName());
  }

  /**
   * Returns {@code String.format} with the arguments, always using {@link Locale#US} so that the
   * decimal separator is a period regardless of the default locale.
   */
  static String formatString(String format, Object... params) {
    return String.format(Locale.US, format, params);
  }

  /**
   * Formats {@code d} with exactly {@code digits} digits after the decimal point, rounding as
   * {@link #roundFixed} does, so 2.675 is written "2.67". Negative values that round to zero keep
   * their sign ("-0.00"); NaN and infinities are written as by {@link String#format}.
   */
  static String formatFixed(double d, int digits) {
    if (!Double.isFinite(d)) {
      return formatString("%." + digits + "f", d);
    }
    String result = roundFixed(d, digits).toPlainString();
    if (Math.copySign(1.0, d) < 0 && !result.startsWith("-")) {
      result = "-" + result;
    }
    return result;
  }

  /**
   * Rounds a finite value to {@code digits} fractional digits. Rounding is done on the exact
   * binary value of the double, half even, so 0.125 rounds to 0.12 and 2.675, which is stored as
   * 2.67499999..., also rounds down.
   */
  static BigDecimal roundFixed(double d, int digits) {
    return new BigDecimal(d).setScale(digits, RoundingMode.HALF_EVEN);
  }
}
