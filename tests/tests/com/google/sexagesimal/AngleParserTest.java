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

import static com.google.sexagesimal.AngleFormat.DECIMAL;
import static com.google.sexagesimal.AngleFormat.DEG_MIN;
import static com.google.sexagesimal.AngleFormat.DEG_MIN_FRAC;
import static com.google.sexagesimal.AngleFormat.DEG_MIN_SEC;
import static com.google.sexagesimal.AngleFormat.DEG_MIN_SEC_FRAC;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.sexagesimal.AngleParseError.Code;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AngleParser}. */
@RunWith(JUnit4.class)
public class AngleParserTest extends AngleTestCase {

  @Test
  public void testFormatInference() {
    assertParses("12.35", 12.35, DECIMAL);
    assertParses("12", 12, DECIMAL);
    assertParses("12 20", 12 + 20 / 60.0, DEG_MIN);
    assertParses("12 20.74", 12 + 20.74 / 60, DEG_MIN_FRAC);
    assertParses("12 20 44", 12 + 20 / 60.0 + 44 / 3600.0, DEG_MIN_SEC);
    assertParses("12 20 44.16", 12.3456, DEG_MIN_SEC_FRAC);
  }

  @Test
  public void testDecimalLiterals() {
    assertParses("12.", 12, DECIMAL);
    assertParses(".5", 0.5, DECIMAL);
    assertParses("+12.5", 12.5, DECIMAL);
    assertParses("-12.5", -12.5, DECIMAL);
    assertParses("1e2", 100, DECIMAL);
    assertParses("1.5E1", 15, DECIMAL);
    assertParses("12 20.", 12 + 20 / 60.0, DEG_MIN_FRAC);
  }

  @Test
  public void testDecimalPointOnlyAllowedInLastComponent() {
    // A lone component is decimal degrees, but the degrees of a sexagesimal angle are whole.
    assertParses("12.35", 12.35, DECIMAL);
    assertRejected("12.35 20", Code.UNEXPECTED_DECIMAL_POINT, "invalid degrees");
    assertRejected("12 20.5 30", Code.UNEXPECTED_DECIMAL_POINT, "invalid minutes");
    assertRejected(
        "12.5 20 30",
        Code.UNEXPECTED_DECIMAL_POINT,
        "unexpected decimal point in integer value '12.5 20 30'");
  }

  @Test
  public void testNegativeAngles() {
    assertParses("-12 20", -(12 + 20 / 60.0), DEG_MIN);
    assertParses("-12 20 44.16", -12.3456, DEG_MIN_SEC_FRAC);
    assertParses("-8 9 10", -(8 + 9 / 60.0 + 10 / 3600.0), DEG_MIN_SEC);
    assertParses("0 -20", -20 / 60.0, DEG_MIN);
    assertParses("0 -20 44", -(20 / 60.0 + 44 / 3600.0), DEG_MIN_SEC);
    assertParses("0 0 -30", -30 / 3600.0, DEG_MIN_SEC);
    assertParses("0 -0.5", -0.5 / 60, DEG_MIN_FRAC);
  }

  @Test
  public void testNegativeZeroDegrees() {
    assertParses("-0 20", -20 / 60.0, DEG_MIN);
    assertParses("-0 -20", -20 / 60.0, DEG_MIN);
    assertParses("-0 20 30", -(20 / 60.0 + 30 / 3600.0), DEG_MIN_SEC);
    assertParses("-0 0 30", -30 / 3600.0, DEG_MIN_SEC);
    assertParses("+0 20", 20 / 60.0, DEG_MIN);
    assertParses("0 20", 20 / 60.0, DEG_MIN);
    assertIdentical(-0.0, assertParses("-0 0 0", 0, DEG_MIN_SEC).degrees());
    assertIdentical(0.0, assertParses("0 0 0", 0, DEG_MIN_SEC).degrees());
    assertIdentical(-0.0, assertParses("-0 0", 0, DEG_MIN).degrees());
  }

  @Test
  public void testOnlyMostSignificantSignCounts() {
    assertParses("12 -20", 12 + 20 / 60.0, DEG_MIN);
    assertParses("-12 -20", -(12 + 20 / 60.0), DEG_MIN);
    assertParses("+12 +20", 12 + 20 / 60.0, DEG_MIN);
    assertParses("0 20 -30", 20 / 60.0 + 30 / 3600.0, DEG_MIN_SEC);
  }

  @Test
  public void testWhitespace() {
    assertParses("  12.5  ", 12.5, DECIMAL);
    assertParses("12   20", 12 + 20 / 60.0, DEG_MIN);
    assertParses("12\t20\t30", 12 + 20 / 60.0 + 30 / 3600.0, DEG_MIN_SEC);
    assertParses("\t12 \t 20.5\n", 12 + 20.5 / 60, DEG_MIN_FRAC);
  }

  @Test
  public void testEmptyInput() {
    assertRejected("", Code.EMPTY_INPUT, "empty input string");
    assertRejected("   ", Code.WHITESPACE_ONLY, "only whitespace");
    assertRejected("\t\n", Code.WHITESPACE_ONLY, "only whitespace");
  }

  @Test
  public void testInvalidCharacters() {
    AngleParseError error =
        assertRejected("12°20'", Code.INVALID_CHARACTER, "invalid character '°' in input '12°20''");
    assertEquals("°", error.component());
    assertRejected("12,5", Code.INVALID_CHARACTER, "invalid character ','");
    assertRejected("12 20\n30", Code.INVALID_CHARACTER, "invalid character");
  }

  @Test
  public void testTooManyComponents() {
    AngleParseError error =
        assertRejected(
            "1 2 3 4",
            Code.TOO_MANY_COMPONENTS,
            "expected 1-3 space-separated components, got 4 in input '1 2 3 4'");
    assertNull(error.component());
    assertEquals(Integer.valueOf(4), error.value());
    assertNull(error.limit());
  }

  @Test
  public void testSigns() {
    assertRejected("--12", Code.MULTIPLE_SIGNS, "invalid decimal degrees: multiple signs");
    assertRejected("12 +-20", Code.MULTIPLE_SIGNS, "invalid minutes: multiple signs in '12 +-20'");
    assertRejected("12-5", Code.MISPLACED_SIGN, "sign must be at beginning in '12-5'");
    assertRejected("12.-34", Code.MISPLACED_SIGN, "invalid decimal degrees");
    assertRejected("12 20 3-0", Code.MISPLACED_SIGN, "invalid seconds");
    // Exponents cannot be signed.
    assertRejected("1e-5", Code.MISPLACED_SIGN, "sign must be at beginning");
  }

  @Test
  public void testMalformedNumbers() {
    assertRejected("1.2.3", Code.MULTIPLE_DECIMAL_POINTS, "multiple decimal points in '1.2.3'");
    assertRejected("12 1.2.3", Code.MULTIPLE_DECIMAL_POINTS, "invalid minutes");
    AngleParseError error =
        assertRejected("abc", Code.INVALID_COMPONENT, "invalid decimal degrees value 'abc'");
    assertEquals("decimal degrees", error.component());
    assertNull(error.value());
    assertRejected("-", Code.INVALID_COMPONENT, "invalid decimal degrees value '-' in '-'");
    assertRejected("12 2x", Code.INVALID_COMPONENT, "invalid minutes value '2x' in '12 2x'");
    assertRejected("x 20", Code.INVALID_COMPONENT, "invalid degrees value 'x'");
    assertRejected("0x1A", Code.INVALID_COMPONENT, "invalid decimal degrees");
    assertRejected("12 inf", Code.INVALID_COMPONENT, "invalid minutes");
    assertRejected("99999999999999999999 0", Code.INVALID_COMPONENT, "invalid degrees");
  }

  @Test
  public void testNonFiniteValues() {
    assertRejected("inf", Code.NON_FINITE_VALUE, "value is infinite or NaN");
    assertRejected("-Infinity", Code.NON_FINITE_VALUE, "value is infinite or NaN");
    assertRejected("NaN", Code.NON_FINITE_VALUE, "invalid decimal degrees");
    assertRejected("12 20 1.e999", Code.NON_FINITE_VALUE, "invalid seconds");
    // "nan." is not a number at all.
    assertRejected("12 20 nan.", Code.INVALID_COMPONENT, "invalid seconds");
    // Too large for a double.
    assertRejected("1e999", Code.NON_FINITE_VALUE, "value is infinite or NaN in '1e999'");
  }

  @Test
  public void testRange() {
    assertParses("12 59", 12 + 59 / 60.0, DEG_MIN);
    assertParses("12 59.999", 12 + 59.999 / 60, DEG_MIN_FRAC);
    assertParses("12 20 59.999", 12 + 20 / 60.0 + 59.999 / 3600, DEG_MIN_SEC_FRAC);
    assertParses("400 0", 400, DEG_MIN);
    assertParses("-400.5", -400.5, DECIMAL);

    AngleParseError error =
        assertRejected(
            "12 60", Code.OUT_OF_RANGE, "invalid minutes value: must be less than 60, got 60 in");
    assertEquals("minutes", error.component());
    assertEquals(Long.valueOf(60), error.value());
    assertEquals(Integer.valueOf(AngleParser.MAX_MINUTES), error.limit());

    error = assertRejected("12 -60", Code.OUT_OF_RANGE, "got -60");
    assertEquals(Long.valueOf(-60), error.value());

    error = assertRejected("12 60.0", Code.OUT_OF_RANGE, "got 60.00 in '12 60.0'");
    assertEquals(Double.valueOf(60.0), error.value());

    error = assertRejected("12 20 60", Code.OUT_OF_RANGE, "invalid seconds value");
    assertEquals("seconds", error.component());
    assertEquals(Long.valueOf(60), error.value());
    assertEquals(Integer.valueOf(AngleParser.MAX_SECONDS), error.limit());

    error = assertRejected("12 20 60.5", Code.OUT_OF_RANGE, "got 60.50");
    assertEquals(Double.valueOf(60.5), error.value());

    // Too large for an int, but still just out of range.
    error = assertRejected("12 3000000000", Code.OUT_OF_RANGE, "got 3000000000 in");
    assertEquals(Long.valueOf(3000000000L), error.value());
  }

  @Test
  public void testLargeDegrees() {
    assertParses("3000000000 0", 3e9, DEG_MIN);
    assertParses("-3000000000 30", -3e9 - 0.5, DEG_MIN);
    assertParses("3000000000 0 0.5", 3e9 + 0.5 / 3600, DEG_MIN_SEC_FRAC);
    assertParses("-3e9", -3e9, DECIMAL);
    assertParses(AngleFormatter.format(-3e9 - 0.5, DEG_MIN, 0, 0), -3e9 - 0.5, DEG_MIN);
  }

  @Test
  public void testInputIsEchoedVerbatim() {
    AngleParseError error = assertRejected("  12 60  ", Code.OUT_OF_RANGE, "'  12 60  '");
    assertEquals("minutes", error.component());
  }

  @Test
  public void testErrorIsReused() {
    AngleParseError error = new AngleParseError();
    assertNull(AngleParser.parse("12 60", error));
    assertEquals(Code.OUT_OF_RANGE, error.code());

    assertNull(AngleParser.parse("", error));
    assertEquals(Code.EMPTY_INPUT, error.code());
    assertNull(error.component());
    // The numbers recorded for the earlier error are reset too.
    assertNull(error.value());
    assertNull(error.limit());

    Angle angle = AngleParser.parse("12 30", error);
    assertDoubleNear(12.5, angle.degrees());
    assertTrue(error.ok());
    assertEquals("", error.text());
    assertEquals("", error.input());
  }

  @Test
  public void testParseOrDie() {
    assertEquals(Angle.of(12.5, DEG_MIN_FRAC), AngleParser.parseOrDie("12 30.0"));
    AngleParseException e =
        assertThrows(AngleParseException.class, () -> AngleParser.parseOrDie("12 60"));
    assertEquals(Code.OUT_OF_RANGE, e.code());
    assertEquals(e.error().text(), e.getMessage());
    assertTrue(e.getMessage().contains("must be less than 60"));
    // Callers that only know about IllegalArgumentException still catch it.
    assertThrows(IllegalArgumentException.class, () -> AngleParser.parseOrDie("x"));
    assertThrows(NullPointerException.class, () -> AngleParser.parseOrDie(null));
  }

  @Test
  public void testParseFields() {
    AngleParseError error = new AngleParseError();
    Angle angle = AngleParser.parseFields(ImmutableList.of("12", " 20 ", "30.5"), error);
    assertTrue(error.toString(), error.ok());
    assertDoubleNear(12 + 20 / 60.0 + 30.5 / 3600, angle.degrees());
    assertEquals(DEG_MIN_SEC_FRAC, angle.format());

    angle = AngleParser.parseFields(ImmutableList.of("-0", "20"), error);
    assertDoubleNear(-20 / 60.0, angle.degrees());
    assertEquals(DEG_MIN, angle.format());

    angle = AngleParser.parseFields(ImmutableList.of("-12.25"), error);
    assertExactly(-12.25, angle.degrees());
    assertEquals(DECIMAL, angle.format());
  }

  @Test
  public void testParseFieldsRejections() {
    AngleParseError error = new AngleParseError();
    assertNull(AngleParser.parseFields(ImmutableList.<String>of(), error));
    assertEquals(Code.EMPTY_INPUT, error.code());
    assertEquals("no fields in input", error.text());

    assertNull(AngleParser.parseFields(ImmutableList.of("12", "  "), error));
    assertEquals(Code.EMPTY_COMPONENT, error.code());
    assertEquals("minutes", error.component());
    assertEquals("component 2 is empty in input '12   '", error.text());
    assertEquals(Integer.valueOf(2), error.value());

    assertNull(AngleParser.parseFields(Arrays.asList("12", null, "30"), error));
    assertEquals(Code.EMPTY_COMPONENT, error.code());
    assertEquals("12  30", error.input());
    assertEquals(Integer.valueOf(2), error.value());

    assertNull(AngleParser.parseFields(ImmutableList.of("1", "2", "3", "4"), error));
    assertEquals(Code.TOO_MANY_COMPONENTS, error.code());
    assertEquals(Integer.valueOf(4), error.value());

    // A field is one component, even if it contains spaces.
    assertNull(AngleParser.parseFields(ImmutableList.of("12 20"), error));
    assertEquals(Code.INVALID_COMPONENT, error.code());

    assertNull(AngleParser.parseFields(ImmutableList.of("12", "20'"), error));
    assertEquals(Code.INVALID_CHARACTER, error.code());

    assertNull(AngleParser.parseFields(ImmutableList.of("12", "60"), error));
    assertEquals(Code.OUT_OF_RANGE, error.code());
  }

  @Test
  public void testFormatThenParse() {
    for (int iter = 0; iter < 2000; ++iter) {
      double degrees = randomDouble(-1000, 1000);
      checkFormatThenParse(degrees, DECIMAL, 6, 1e-6);
      checkFormatThenParse(degrees, DEG_MIN_FRAC, 6, 1e-6);
      checkFormatThenParse(degrees, DEG_MIN_SEC_FRAC, 6, 1e-6);
      checkFormatThenParse(degrees, DEG_MIN, 0, 1 / 60.0 + 1e-9);
      checkFormatThenParse(degrees, DEG_MIN_SEC, 0, 1 / 3600.0 + 1e-9);
    }
  }

  @Test
  public void testFormatThenParseBelowOneDegree() {
    for (int iter = 0; iter < 2000; ++iter) {
      double degrees = randomDouble(-1, 1);
      checkFormatThenParse(degrees, DEG_MIN_FRAC, 6, 1e-6);
      checkFormatThenParse(degrees, DEG_MIN_SEC_FRAC, 6, 1e-6);
      checkFormatThenParse(degrees, DEG_MIN_SEC, 0, 1 / 3600.0 + 1e-9);
    }
  }

  @Test
  public void testParsedFormatIsKeptByAngle() {
    Angle angle = assertParses("-8 9 10.5", -(8 + 9 / 60.0 + 10.5 / 3600), DEG_MIN_SEC_FRAC);
    assertEquals("-8 9 10.5", angle.format(1, 0));
    assertSame(DEG_MIN_SEC_FRAC, angle.format());
  }

  private static void checkFormatThenParse(
      double degrees, AngleFormat format, int precision, double maxError) {
    String text = AngleFormatter.format(degrees, format, precision, 0);
    AngleParseError error = new AngleParseError();
    Angle angle = AngleParser.parse(text, error);
    assertTrue(text + ": " + error, error.ok());
    assertDoubleNear(text, degrees, angle.degrees(), maxError);
    assertEquals(text, format, angle.format());
    assertFalse(text, Double.isNaN(angle.degrees()));
  }
}
