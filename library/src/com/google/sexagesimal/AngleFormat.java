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

import jsinterop.annotations.JsType;

/**
 * The ways an {@link Angle} can be written as text. The ordinal order is only significant for
 * display; formats are never compared.
 */
@JsType
public enum AngleFormat {
  /** Decimal degrees, e.g. "12.35". */
  DECIMAL("Dd", 1, true),
  /** Degrees and whole minutes of arc, e.g. "12 20". */
  DEG_MIN("DMM", 2, false),
  /** Degrees and minutes of arc with a fraction, e.g. "12 20.74". */
  DEG_MIN_FRAC("DMMm", 2, true),
  /** Degrees, minutes and whole seconds of arc, e.g. "12 20 44". */
  DEG_MIN_SEC("DMMSS", 3, false),
  /** Degrees, minutes and seconds of arc with a fraction, e.g. "12 20 44.16". */
  DEG_MIN_SEC_FRAC("DMMSSs", 3, true);

  private final String shortName;
  private final int componentCount;
  private final boolean fractional;

  private AngleFormat(String shortName, int componentCount, boolean fractional) {
    this.shortName = shortName;
    this.componentCount = componentCount;
    this.fractional = fractional;
  }

  /** Returns the conventional abbreviation of this format, e.g. "DMMSSs". */
  public String shortName() {
    return shortName;
  }

  /** Returns the number of whitespace-separated components in this format. */
  public int componentCount() {
    return componentCount;
  }

  /** Returns true if the last component of this format carries a fractional part. */
  public boolean isFractional() {
    return fractional;
  }

  /**
   * Returns the format of a string with {@code componentCount} components, where {@code
   * lastHasDecimalPoint} tells whether the last component contains a '.'. A single component is
   * always {@link #DECIMAL}.
   *
   * @throws IllegalArgumentException if componentCount is not 1, 2 or 3
   */
  public static AngleFormat infer(int componentCount, boolean lastHasDecimalPoint) {
    switch (componentCount) {
      case 1:
        return DECIMAL;
      case 2:
        return lastHasDecimalPoint ? DEG_MIN_FRAC : DEG_MIN;
      case 3:
        return lastHasDecimalPoint ? DEG_MIN_SEC_FRAC : DEG_MIN_SEC;
      default:
        throw new IllegalArgumentException("Invalid component count: " + componentCount);
    }
  }
}
