/*
 * Copyright 2026 The Ledger Authors
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

package org.ledgerlang.types;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.Literal;
import org.ledgerlang.util.Precision;
import org.ledgerlang.util.Rational;

/** A static-only class that provides shared type instances and the types of literals. */
public final class TypeProvider {

  private TypeProvider() {}

  /** The unsigned integer types, indexed by {@code bits / 8 - 1}. */
  private static final ImmutableList<IntegerType> UNSIGNED = integerTypes(false);

  /** The signed integer types, indexed by {@code bits / 8 - 1}. */
  private static final ImmutableList<IntegerType> SIGNED = integerTypes(true);

  private static final double LOG2_OF_10 = Math.log(10) / Math.log(2);

  private static final CharMatcher DECIMAL_DIGITS = CharMatcher.inRange('0', '9');

  private static final CharMatcher HEX_DIGITS =
      DECIMAL_DIGITS.or(CharMatcher.inRange('a', 'f')).or(CharMatcher.inRange('A', 'F'));

  private static ImmutableList<IntegerType> integerTypes(boolean signed) {
    return IntStream.rangeClosed(1, 32)
        .mapToObj(i -> new IntegerType(i * 8, signed))
        .collect(ImmutableList.toImmutableList());
  }

  public static IntegerType integer(int bits, boolean signed) {
    Preconditions.checkArgument(bits >= 8 && bits <= 256 && bits % 8 == 0, "bad width %s", bits);
    return (signed ? SIGNED : UNSIGNED).get(bits / 8 - 1);
  }

  public static IntegerType uint256() {
    return integer(256, false);
  }

  public static BoolType bool() {
    return BoolType.INSTANCE;
  }

  public static RationalNumberType rationalNumber(Rational value) {
    return new RationalNumberType(value);
  }

  /**
   * Returns the type of the given literal: a {@link RationalNumberType} for a valid number
   * literal, {@link BoolType} for {@code true} and {@code false}, or null if the literal has no
   * type that we can represent (a string, or a malformed or overly large number).
   */
  public static @Nullable Type forLiteral(Literal literal) {
    switch (literal.kind()) {
      case BOOL:
        return bool();
      case NUMBER:
        Rational value = parseNumber(literal.value());
        if (value == null) {
          return null;
        }
        Literal.SubDenomination unit = literal.subDenomination();
        if (unit != null) {
          value = value.multiply(Rational.of(unit.multiplier));
        }
        return rationalNumber(value);
      default:
        return null;
    }
  }

  /**
   * Parses a number literal: hexadecimal ({@code 0x1f}), decimal ({@code 12}, {@code 1.5}, {@code
   * .5}) or scientific ({@code 2e10}, {@code 1.5e-3}), with optional single {@code _} separators
   * between digits. Returns null if the text is malformed or its value would be too large to
   * represent exactly.
   */
  static @Nullable Rational parseNumber(String text) {
    boolean isHex = text.startsWith("0x") || text.startsWith("0X");
    if (!separatorsValid(text, isHex ? HEX_DIGITS : DECIMAL_DIGITS)) {
      return null;
    }
    text = CharMatcher.is('_').removeFrom(text);
    if (isHex) {
      String digits = text.substring(2);
      if (digits.isEmpty() || !HEX_DIGITS.matchesAllOf(digits)) {
        return null;
      }
      return Rational.of(new BigInteger(digits, 16));
    }
    int ePos = CharMatcher.anyOf("eE").indexIn(text);
    String mantissaText = (ePos < 0) ? text : text.substring(0, ePos);
    Rational mantissa = parseDecimal(mantissaText);
    if (mantissa == null) {
      return null;
    } else if (ePos < 0) {
      return mantissa;
    }
    String expText = text.substring(ePos + 1);
    boolean negativeExp = expText.startsWith("-");
    if (negativeExp) {
      expText = expText.substring(1);
    }
    if (expText.isEmpty() || !DECIMAL_DIGITS.matchesAllOf(expText)) {
      return null;
    }
    BigInteger exp = new BigInteger(expText);
    if (mantissa.isZero()) {
      return mantissa;
    } else if (exp.compareTo(BigInteger.valueOf(Precision.UINT32_MAX)) > 0) {
      return null;
    }
    long expValue = exp.longValueExact();
    // Scaling up grows the numerator, scaling down grows the denominator.
    BigInteger grows = negativeExp ? mantissa.denominator() : mantissa.numerator().abs();
    if (!Precision.fitsPrecisionBaseX(grows, LOG2_OF_10, expValue)) {
      return null;
    }
    Rational scale = Rational.of(BigInteger.TEN.pow((int) expValue));
    return negativeExp ? mantissa.divide(scale) : mantissa.multiply(scale);
  }

  /** Parses {@code digits[.digits]}; either side of the point may be empty, but not both. */
  private static @Nullable Rational parseDecimal(String text) {
    int dot = text.indexOf('.');
    String whole = (dot < 0) ? text : text.substring(0, dot);
    String fraction = (dot < 0) ? "" : text.substring(dot + 1);
    if ((whole.isEmpty() && fraction.isEmpty())
        || !DECIMAL_DIGITS.matchesAllOf(whole)
        || !DECIMAL_DIGITS.matchesAllOf(fraction)) {
      return null;
    }
    BigInteger numerator = new BigInteger(whole + fraction);
    return Rational.of(numerator, BigInteger.TEN.pow(fraction.length()));
  }

  /** Separators may only appear singly, between two digits. */
  private static boolean separatorsValid(String text, CharMatcher digits) {
    for (int i = text.indexOf('_'); i >= 0; i = text.indexOf('_', i + 1)) {
      if (i == 0
          || i == text.length() - 1
          || !digits.matches(text.charAt(i - 1))
          || !digits.matches(text.charAt(i + 1))) {
        return false;
      }
    }
    return true;
  }
}
