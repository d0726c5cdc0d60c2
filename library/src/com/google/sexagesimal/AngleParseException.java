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

/**
 * An unchecked exception thrown by {@link AngleParser#parseOrDie(String)}. It wraps the {@link
 * AngleParseError} that {@link AngleParser#parse(String, AngleParseError)} would have reported.
 */
public class AngleParseException extends IllegalArgumentException {

  private final AngleParseError error;

  /** Creates a new AngleParseException wrapping the given error. */
  public AngleParseException(AngleParseError error) {
    this.error = error;
  }

  /** Returns the code of the error wrapped by this exception. */
  public AngleParseError.Code code() {
    return error.code();
  }

  /** Returns the error wrapped by this exception. */
  public AngleParseError error() {
    return error;
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
