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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;
import com.google.sexagesimal.AngleParseError.Code;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Parses the text written by {@link AngleFormatter} back into an {@link Angle}.
 *
 * <p>The input holds one to three components separated by spaces or tabs, and its format is
 * inferred from their number alone:
 *
 * <ul>
 *   <li>"12.35" is {@link AngleFormat#DECIMAL},
 *   <li>"12 20" is {@link AngleFormat#DEG_MIN} and "12 20.74" {@link AngleFormat#DEG_MIN_FRAC},
 *   <li>"12 20 44" is {@link AngleFormat#DEG_MIN_SEC} and "12 20 44.16" {@link
 *       AngleFormat#DEG_MIN_SEC_FRAC}.
 * </ul>
 *
 * <p>A single component is a decimal number, but with two or three components the degrees must be
 * an integer, and so must every component before the last. Minutes and seconds must be less than
 * 60 in magnitude. The sign of the result is that of the first non-zero component, as written by
 * the formatter ("0 -20" is -20 minutes), except that degrees written as "-0" make the whole
 * angle negative ("-0 20" is also -20 minutes).
 *
 * <p>Letters are accepted by the character check only so that "inf" and "nan" can be reported as
 * {@link Code#NON_FINITE_VALUE} rather than as unknown characters.
 */
public final class AngleParser {
  private static final Logger log = Platform.getLoggerForClass(AngleParser.class);

  /** Minutes must be strictly less than this in magnitude. */
  public static final int MAX_MINUTES = 60;

  /** Seconds must be strictly less than this in magnitude. */
  public static final int MAX_SECONDS = 60;

  private static final CharMatcher SEPARATORS = CharMatcher.anyOf(" \t");
  private static final CharMatcher SIGNS = CharMatcher.anyOf("+-");
  private static final CharMatcher VALID_CHARACTERS =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'z'))
          .or(CharMatcher.inRange('A', 'Z'))
          .or(SIGNS)
          .or(SEPARATORS)
          .or(CharMatcher.is('.'))
          .precomputed();

  private static final Splitter COMPONENT_SPLITTER = Splitter.on(SEPARATORS).omitEmptyStrings();

  // Exponents cannot be signed: a sign after the first character is rejected before conversion.
  private static final Pattern DECIMAL_LITERAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE]\\d+)?");
  private static final Pattern NON_FINITE_LITERAL =
      Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

  private static final ImmutableList<String> COMPONENT_NAMES =
      ImmutableList.of("degrees", "minutes", "seconds");

  private AngleParser() {}

  /**
   * Parses the given string, which may have leading and trailing whitespace.
   *
   * @throws AngleParseException on unparsable input
   */
  public static Angle parseOrDie(String input) throws AngleParseException {
    AngleParseError error = new AngleParseError();
    Angle angle = parse(input, error);
    if (angle == null) {
      throw new AngleParseException(error);
    }
    return angle;
  }

  /**
   * As {@link #parseOrDie(String)}, but does not throw on invalid input. Returns null and sets
   * {@code error} if the input cannot be parsed; otherwise clears {@code error}.
   */
  public static @Nullable Angle parse(String input, AngleParseError error) {
    Preconditions.checkNotNull(input);
    error.clear();
    Angle angle = parseString(input, error);
    if (angle == null) {
      log.fine("Rejected angle: " + error);
    }
    return angle;
  }

  /**
   * Parses components that have already been separated, e.g. the contents of separate degree,
   * minute and second fields. Each field may have surrounding whitespace but must not be blank.
   * The format is inferred from the number of fields exactly as for a whitespace-separated string.
   * Returns null and sets {@code error} if the fields cannot be parsed.
   */
  public static @Nullable Angle parseFields(List<String> fields, AngleParseError error) {
    Preconditions.checkNotNull(fields);
    error.clear();
    Angle angle = parseFieldList(fields, error);
    if (angle == null) {
      log.fine("Rejected angle fields: " + error);
    }
    return angle;
  }

  private static @Nullable Angle parseString(String input, AngleParseError error) {
    if (input.isEmpty()) {
      error.init(Code.EMPTY_INPUT, input, null, "empty input string");
      return null;
    }
    String trimmed = CharMatcher.whitespace().trimFrom(input);
    if (trimmed.isEmpty()) {
      error.init(Code.WHITESPACE_ONLY, input, null, "input contains only whitespace");
      return null;
    }
    if (!checkCharacters(trimmed, input, error)) {
      return null;
    }
    return parseComponents(COMPONENT_SPLITTER.splitToList(trimmed), input, error);
  }

  private static @Nullable Angle parseFieldList(List<String> fields, AngleParseError error) {
    String input = Joiner.on(' ').useForNull("").join(fields);
    if (fields.isEmpty()) {
      error.init(Code.EMPTY_INPUT, input, null, "no fields in input");
      return null;
    }
    if (!checkComponentCount(fields.size(), input, error)) {
      return null;
    }
    ImmutableList.Builder<String> components = ImmutableList.builder();
    for (int i = 0; i < fields.size(); i++) {
      String field = fields.get(i) == null ? "" : CharMatcher.whitespace().trimFrom(fields.get(i));
      if (field.isEmpty()) {
        error.init(
            Code.EMPTY_COMPONENT,
            input,
            componentName(fields.size(), i),
            "component %d is empty in input '%s'",
            i + 1,
            input);
        error.setValue(i + 1);
        return null;
      }
      if (!checkCharacters(field, input, error)) {
        return null;
      }
      components.add(field);
    }
    return parseComponents(components.build(), input, error);
  }

  private static boolean checkCharacters(String text, String input, AngleParseError error) {
    int index = VALID_CHARACTERS.negate().indexIn(text);
    if (index < 0) {
      return true;
    }
    String character = new String(Character.toChars(text.codePointAt(index)));
    error.init(
        Code.INVALID_CHARACTER,
        input,
        character,
        "invalid character '%s' in input '%s'",
        character,
        input);
    return false;
  }

  private static boolean checkComponentCount(int count, String input, AngleParseError error) {
    if (count <= 3) {
      return true;
    }
    error.init(
        Code.TOO_MANY_COMPONENTS,
        input,
        null,
        "invalid format: expected 1-3 space-separated components, got %d in input '%s'",
        count,
        input);
    error.setValue(count);
    return false;
  }

  private static @Nullable Angle parseComponents(
      List<String> components, String input, AngleParseError error) {
    int count = components.size();
    if (!checkComponentCount(count, input, error)) {
      return null;
    }
    String last = components.get(count - 1);
    AngleFormat format = AngleFormat.infer(count, last.indexOf('.') >= 0);
    if (format == AngleFormat.DECIMAL) {
      Double value = parseFloat(last, "decimal degrees", input, error);
      return value == null ? null : Angle.of(value, format);
    }

    String degreesText = components.get(0);
    Long degrees = parseWhole(degreesText, "degrees", input, error);
    if (degrees == null) {
      return null;
    }
    int minutes;
    double seconds;
    if (format == AngleFormat.DEG_MIN_FRAC) {
      Double fractionalMinutes = parseFloat(components.get(1), "minutes", input, error);
      if (fractionalMinutes == null
          || !checkRange(fractionalMinutes, MAX_MINUTES, "minutes", input, error)) {
        return null;
      }
      minutes = fractionalMinutes.intValue();
      seconds = (fractionalMinutes - minutes) * SECONDS_PER_MINUTE;
    } else {
      Long wholeMinutes = parseWhole(components.get(1), "minutes", input, error);
      if (wholeMinutes == null || !checkRange(wholeMinutes, MAX_MINUTES, "minutes", input, error)) {
        return null;
      }
      minutes = wholeMinutes.intValue();
      if (format == AngleFormat.DEG_MIN) {
        seconds = 0;
      } else {
        Number parsedSeconds;
        if (format == AngleFormat.DEG_MIN_SEC) {
          parsedSeconds = parseWhole(components.get(2), "seconds", input, error);
        } else {
          parsedSeconds = parseFloat(components.get(2), "seconds", input, error);
        }
        if (parsedSeconds == null
            || !checkRange(parsedSeconds, MAX_SECONDS, "seconds", input, error)) {
          return null;
        }
        seconds = parsedSeconds.doubleValue();
      }
    }

    double value = DmsConverter.recompose(degrees, minutes, seconds);
    // "-0" degrees carry the sign of an angle smaller than one degree.
    if (degrees == 0 && degreesText.startsWith("-")) {
      value = -abs(value);
    }
    return Angle.of(value, format);
  }

  /** Checks that a component has at most one sign, and only in the first position. */
  private static boolean checkSigns(
      String token, String component, String input, AngleParseError error) {
    int signs = SIGNS.countIn(token);
    if (signs > 1) {
      error.init(
          Code.MULTIPLE_SIGNS,
          input,
          component,
          "invalid %s: multiple signs in '%s'",
          component,
          input);
      return false;
    }
    if (signs == 1 && SIGNS.indexIn(token) > 0) {
      error.init(
          Code.MISPLACED_SIGN,
          input,
          component,
          "invalid %s: sign must be at beginning in '%s'",
          component,
          input);
      return false;
    }
    return true;
  }

  private static @Nullable Long parseWhole(
      String token, String component, String input, AngleParseError error) {
    if (!checkSigns(token, component, input, error)) {
      return null;
    }
    if (token.indexOf('.') >= 0) {
      error.init(
          Code.UNEXPECTED_DECIMAL_POINT,
          input,
          component,
          "invalid %s: unexpected decimal point in integer value '%s'",
          component,
          input);
      return null;
    }
    // Longs.tryParse does not accept a leading '+'.
    Long value = Longs.tryParse(token.startsWith("+") ? token.substring(1) : token);
    if (value == null) {
      error.init(
          Code.INVALID_COMPONENT,
          input,
          component,
          "invalid %s value '%s' in '%s'",
          component,
          token,
          input);
    }
    return value;
  }

  private static @Nullable Double parseFloat(
      String token, String component, String input, AngleParseError error) {
    if (!checkSigns(token, component, input, error)) {
      return null;
    }
    if (CharMatcher.is('.').countIn(token) > 1) {
      error.init(
          Code.MULTIPLE_DECIMAL_POINTS,
          input,
          component,
          "invalid %s: multiple decimal points in '%s'",
          component,
          input);
      return null;
    }
    Double value = toDouble(token);
    if (value == null) {
      error.init(
          Code.INVALID_COMPONENT,
          input,
          component,
          "invalid %s value '%s' in '%s'",
          component,
          token,
          input);
      return null;
    }
    if (!Double.isFinite(value)) {
      error.init(
          Code.NON_FINITE_VALUE,
          input,
          component,
          "invalid %s: value is infinite or NaN in '%s'",
          component,
          input);
      return null;
    }
    return value;
  }

  /**
   * Converts a decimal literal, or one of the words "inf", "infinity" and "nan" in any case, to a
   * double. Returns null for anything else.
   */
  private static @Nullable Double toDouble(String token) {
    if (DECIMAL_LITERAL.matcher(token).matches()) {
      return Double.parseDouble(token);
    }
    Matcher matcher = NON_FINITE_LITERAL.matcher(token);
    if (!matcher.matches()) {
      return null;
    }
    if (matcher.group(2).equalsIgnoreCase("nan")) {
      return Double.NaN;
    }
    return matcher.group(1).equals("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
  }

  private static boolean checkRange(
      Number value, int limit, String component, String input, AngleParseError error) {
    if (abs(value.doubleValue()) < limit) {
      return true;
    }
    String actual =
        value instanceof Long ? value.toString() : Platform.formatString("%.2f", value);
    error.init(
        Code.OUT_OF_RANGE,
        input,
        component,
        "invalid %s value: must be less than %d, got %s in '%s'",
        component,
        limit,
        actual,
        input);
    error.setValue(value);
    error.setLimit(limit);
    return false;
  }

  private static String componentName(int count, int index) {
    return count == 1 ? "decimal degrees" : COMPONENT_NAMES.get(index);
  }
}
