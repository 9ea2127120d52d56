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

import java.math.BigInteger;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.Token;
import org.ledgerlang.util.Rational;

/**
 * The type of a compile-time constant number; each instance carries the exact value it denotes.
 * These are the types of number literals and of constant expressions built from them.
 */
public final class RationalNumberType extends Type {
  private final Rational value;

  RationalNumberType(Rational value) {
    this.value = value;
  }

  public Rational value() {
    return value;
  }

  public boolean isFractional() {
    return !value.isIntegral();
  }

  @Override
  public Category category() {
    return Category.RATIONAL_NUMBER;
  }

  @Override
  public boolean isImplicitlyConvertibleTo(Type other) {
    if (other instanceof RationalNumberType) {
      return true;
    } else if (other instanceof IntegerType intType) {
      return !isFractional() && intType.contains(value);
    }
    return false;
  }

  /**
   * Returns the smallest integer type that can hold this value (unsigned if the value is
   * non-negative), or null if the value is fractional or needs more than 256 bits.
   */
  @Override
  public @Nullable IntegerType mobileType() {
    if (isFractional()) {
      return null;
    }
    BigInteger n = value.numerator();
    boolean signed = n.signum() < 0;
    // A negative value v needs as many magnitude bits as -(v + 1).
    int magnitudeBits = signed ? n.add(BigInteger.ONE).negate().bitLength() : n.bitLength();
    int bits = magnitudeBits + (signed ? 1 : 0);
    bits = Math.max(8, (bits + 7) / 8 * 8);
    return (bits > 256) ? null : TypeProvider.integer(bits, signed);
  }

  /**
   * Operations between two constants stay constant (the evaluator supplies the resulting value);
   * mixing a constant with an integer uses the constant's {@link #mobileType}.
   */
  @Override
  public @Nullable Type binaryOperatorResult(Token operator, Type other) {
    if (other instanceof RationalNumberType) {
      if (operator.isCompareOp()) {
        return TypeProvider.bool();
      }
      return operator.isBooleanOp() ? null : this;
    } else if (other instanceof IntegerType) {
      IntegerType mobile = mobileType();
      return (mobile == null) ? null : mobile.binaryOperatorResult(operator, other);
    }
    return null;
  }

  @Override
  public @Nullable Type unaryOperatorResult(Token operator) {
    return switch (operator) {
      case SUB -> this;
      case BIT_NOT -> isFractional() ? null : this;
      default -> null;
    };
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RationalNumberType other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    if (isFractional()) {
      return "rational_const " + value.numerator() + " / " + value.denominator();
    }
    return "int_const " + value;
  }
}
