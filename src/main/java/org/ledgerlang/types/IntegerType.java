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

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.Token;
import org.ledgerlang.util.Rational;

/**
 * A signed or unsigned integer type with a width of 8 to 256 bits (in steps of 8), i.e. {@code
 * int8} ... {@code int256} and {@code uint8} ... {@code uint256}. Values range over the inclusive
 * interval {@code [minValue(), maxValue()]}.
 */
public final class IntegerType extends Type {
  private final int bits;
  private final boolean isSigned;
  private final Rational minValue;
  private final Rational maxValue;

  IntegerType(int bits, boolean isSigned) {
    Preconditions.checkArgument(bits >= 8 && bits <= 256 && bits % 8 == 0, "bad width %s", bits);
    this.bits = bits;
    this.isSigned = isSigned;
    if (isSigned) {
      BigInteger half = BigInteger.ONE.shiftLeft(bits - 1);
      this.minValue = Rational.of(half.negate());
      this.maxValue = Rational.of(half.subtract(BigInteger.ONE));
    } else {
      this.minValue = Rational.ZERO;
      this.maxValue = Rational.of(BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE));
    }
  }

  public int bits() {
    return bits;
  }

  public boolean isSigned() {
    return isSigned;
  }

  public Rational minValue() {
    return minValue;
  }

  public Rational maxValue() {
    return maxValue;
  }

  /** True if {@code value} lies within {@code [minValue(), maxValue()]}. */
  public boolean contains(Rational value) {
    return value.compareTo(minValue) >= 0 && value.compareTo(maxValue) <= 0;
  }

  @Override
  public Category category() {
    return Category.INTEGER;
  }

  @Override
  public boolean isImplicitlyConvertibleTo(Type other) {
    if (!(other instanceof IntegerType target)) {
      return false;
    } else if (isSigned == target.isSigned) {
      return target.bits >= bits;
    } else {
      // An unsigned value fits in a strictly wider signed type; a signed one never fits.
      return !isSigned && target.bits > bits;
    }
  }

  @Override
  public @Nullable Type binaryOperatorResult(Token operator, Type other) {
    if (operator.isShiftOp() || operator == Token.EXP) {
      return isUnsignedAmount(other) ? this : null;
    } else if (operator.isBooleanOp()) {
      return null;
    }
    Type common = commonType(other);
    if (common == null) {
      return null;
    }
    return operator.isCompareOp() ? TypeProvider.bool() : common;
  }

  /**
   * Returns the narrowest of {@code this} and {@code other} to which the other can be implicitly
   * converted, or null if neither converts to the other.
   */
  private @Nullable Type commonType(Type other) {
    if (other.isImplicitlyConvertibleTo(this)) {
      return this;
    } else if (other instanceof IntegerType && isImplicitlyConvertibleTo(other)) {
      return other;
    }
    return null;
  }

  /** Shift amounts and exponents must be unsigned integers or non-negative integral constants. */
  private static boolean isUnsignedAmount(Type amount) {
    if (amount instanceof IntegerType intType) {
      return !intType.isSigned;
    } else if (amount instanceof RationalNumberType rational) {
      return rational.value().isIntegral() && rational.value().signum() >= 0;
    }
    return false;
  }

  @Override
  public @Nullable Type unaryOperatorResult(Token operator) {
    return switch (operator) {
      case SUB -> isSigned ? this : null;
      case BIT_NOT, INC, DEC -> this;
      default -> null;
    };
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof IntegerType other && bits == other.bits && isSigned == other.isSigned;
  }

  @Override
  public int hashCode() {
    return isSigned ? -bits : bits;
  }

  @Override
  public String toString() {
    return (isSigned ? "int" : "uint") + bits;
  }
}
