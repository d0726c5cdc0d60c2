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

import com.google.common.base.Strings;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * An error code and text string describing why {@link AngleParser} rejected an input string.
 * Callers allocate one instance and pass it to {@link AngleParser#parse(String, AngleParseError)};
 * it may be reused after {@link #clear()}.
 *
 * <p>The text always echoes the original input and names the offending component or character, so
 * it can be shown directly to whoever typed the string.
 */
@JsType
public class AngleParseError {
  /** The reasons a string can fail to parse as an angle. */
  @JsType
  public enum Code {
    /** No problems detected. */
    NO_ERROR,
    /** The input string is empty. */
    EMPTY_INPUT,
    /** The input string contains only whitespace. */
    WHITESPACE_ONLY,
    /** The input contains a character that cannot appear in an angle. */
    INVALID_CHARACTER,
    /** The input has more than three components. */
    TOO_MANY_COMPONENTS,
    /** A component is empty. */
    EMPTY_COMPONENT,
    /** A component that must be an integer contains a decimal point. */
    UNEXPECTED_DECIMAL_POINT,
    /** A component has more than one sign character. */
    MULTIPLE_SIGNS,
    /** A sign character appears after the first position of a component. */
    MISPLACED_SIGN,
    /** A component has more than one decimal point. */
    MULTIPLE_DECIMAL_POINTS,
    /** A component is not a number. */
    INVALID_COMPONENT,
    /** A component is infinite or NaN. */
    NON_FINITE_VALUE,
    /** Minutes or seconds are 60 or more in magnitude. */
    OUT_OF_RANGE
  }

  private Code code = Code.NO_ERROR;
  private String text = "";
  private String input = "";
  private @Nullable String component = null;
  private @Nullable Number value = null;
  private @Nullable Integer limit = null;

  /** Prepares an AngleParseError instance for reuse by resetting it to its original state. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
    input = "";
    component = null;
    value = null;
    limit = null;
  }

  /**
   * Sets the error code, the rejected input, the offending component and the text description.
   * The description is formatted according to the rules of {@link Strings#lenientFormat(String,
   * Object...)}, except that '%d' positional arguments are also handled.
   *
   * @param component the name of the offending component ("degrees", "minutes", "seconds" or
   *     "decimal degrees"), the offending character, or null if the error concerns the input as a
   *     whole
   */
  public void init(
      Code code, String input, @Nullable String component, String format, Object... args) {
    this.code = code;
    this.input = input;
    this.component = component;
    this.text = Strings.lenientFormat(format.replace("%d", "%s"), args);
    this.value = null;
    this.limit = null;
  }

  /**
   * Records the number this error is about: the component count for {@code TOO_MANY_COMPONENTS},
   * the 1-based position of the blank field for {@code EMPTY_COMPONENT}, or the rejected minutes
   * or seconds for {@code OUT_OF_RANGE}. Must be called after {@link #init}, which resets it.
   */
  public void setValue(@Nullable Number value) {
    this.value = value;
  }

  /** Records the bound that {@link #value()} exceeded. Must be called after {@link #init}. */
  public void setLimit(@Nullable Integer limit) {
    this.limit = limit;
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns true if this error's code is NO_ERROR. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  /** Returns the input string that was rejected, exactly as it was passed in. */
  public String input() {
    return input;
  }

  /** Returns the offending component or character, or null if there is none. */
  public @Nullable String component() {
    return component;
  }

  /**
   * Returns the number this error is about, or null if the error has none. Whole values are
   * {@link Long}s or {@link Integer}s, fractional ones {@link Double}s.
   */
  public @Nullable Number value() {
    return value;
  }

  /** Returns the limit exceeded by an {@code OUT_OF_RANGE} error, or null. */
  public @Nullable Integer limit() {
    return limit;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "OK";
    }
    return Strings.lenientFormat("%s: %s", code, text);
  }
}
