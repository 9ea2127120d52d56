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

package org.ledgerlang.util;

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * An exact fraction of two arbitrary-precision integers. Rationals are immutable and always kept
 * in lowest terms with a positive denominator, so equal values have identical numerators and
 * denominators.
 */
public final class Rational implements Comparable<Rational> {
  public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
  public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

  private final BigInteger numerator;
  private final BigInteger denominator;

  /** Callers are responsible for passing a reduced fraction with a positive denominator. */
  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Rational of(long value) {
    return of(BigInteger.valueOf(value));
  }

  public static Rational of(BigInteger value) {
    if (value.signum() == 0) {
      return ZERO;
    }
    return new Rational(value, BigInteger.ONE);
  }

  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  /** Returns {@code numerator / denominator}, reduced; the denominator must be non-zero. */
  public static Rational of(BigInteger numerator, BigInteger denominator) {
    Preconditions.checkArgument(denominator.signum() != 0, "zero denominator");
    if (numerator.signum() == 0) {
      return ZERO;
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Rational(numerator, denominator);
  }

  public BigInteger numerator() {
    return numerator;
  }

  /** Always positive. */
  public BigInteger denominator() {
    return denominator;
  }

  /** True if this value has no fractional part. */
  public boolean isIntegral() {
    return denominator.equals(BigInteger.ONE);
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public int signum() {
    return numerator.signum();
  }

  public Rational add(Rational other) {
    if (isIntegral() && other.isIntegral()) {
      return of(numerator.add(other.numerator));
    }
    return of(
        numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public Rational subtract(Rational other) {
    return add(other.negate());
  }

  public Rational multiply(Rational other) {
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  /** Returns {@code this / other}, or null if {@code other} is zero. */
  public @Nullable Rational divide(Rational other) {
    if (other.isZero()) {
      return null;
    }
    return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
  }

  /**
   * Returns {@code this - trunc(this / other) * other}, i.e. the remainder of a division whose
   * quotient is rounded toward zero, or null if {@code other} is zero. The result has the sign of
   * {@code this}.
   */
  public @Nullable Rational remainder(Rational other) {
    if (other.isZero()) {
      return null;
    }
    if (isIntegral() && other.isIntegral()) {
      return of(numerator.remainder(other.numerator));
    }
    Rational quotient = divide(other);
    return subtract(of(quotient.truncate()).multiply(other));
  }

  public Rational negate() {
    return isZero() ? this : new Rational(numerator.negate(), denominator);
  }

  /**
   * Returns {@code this} raised to {@code exponent}. A negative exponent inverts the result, so
   * zero raised to a negative exponent has no value.
   */
  public @Nullable Rational pow(int exponent) {
    if (exponent == 0) {
      return ONE;
    }
    int absExp = Math.abs(exponent);
    BigInteger n = numerator.pow(absExp);
    BigInteger d = denominator.pow(absExp);
    if (exponent > 0) {
      return new Rational(n, d);
    } else if (n.signum() == 0) {
      return null;
    }
    return of(d, n);
  }

  /** Returns {@code this * 2^shift}; {@code shift} must be non-negative. */
  public Rational shiftLeft(int shift) {
    Preconditions.checkArgument(shift >= 0);
    if (isZero() || shift == 0) {
      return this;
    }
    return of(numerator.shiftLeft(shift), denominator);
  }

  /**
   * Returns {@code floor(this / 2^shift)} for an integral value; {@code shift} must be
   * non-negative. Once every significant bit has been shifted out the result is 0 for a positive
   * value and -1 for a negative one.
   */
  public Rational shiftRight(long shift) {
    Preconditions.checkArgument(shift >= 0 && isIntegral());
    if (isZero()) {
      return this;
    }
    if (shift > Precision.msb(numerator.abs())) {
      return numerator.signum() < 0 ? MINUS_ONE : ZERO;
    }
    BigInteger divisor = BigInteger.ONE.shiftLeft((int) shift);
    if (numerator.signum() < 0) {
      // Truncating division rounds toward zero; offsetting by one before and after makes it
      // round toward negative infinity.
      return of(numerator.add(BigInteger.ONE).divide(divisor).subtract(BigInteger.ONE));
    }
    return of(numerator.divide(divisor));
  }

  /** Returns the integer part of this value, rounding toward zero. */
  public BigInteger truncate() {
    return isIntegral() ? numerator : numerator.divide(denominator);
  }

  @Override
  public int compareTo(Rational other) {
    if (denominator.equals(other.denominator)) {
      return numerator.compareTo(other.numerator);
    }
    return numerator
        .multiply(other.denominator)
        .compareTo(other.numerator.multiply(denominator));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Rational other
        && numerator.equals(other.numerator)
        && denominator.equals(other.denominator);
  }

  @Override
  public int hashCode() {
    return numerator.hashCode() * 31 + denominator.hashCode();
  }

  @Override
  public String toString() {
    return isIntegral() ? numerator.toString() : numerator + "/" + denominator;
  }
}
