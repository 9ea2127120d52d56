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

/**
 * Static-only class with cheap, conservative estimates of whether an exact computation stays
 * within {@link #MAX_BITS} bits. The estimates never claim that a result fits when it does not,
 * but may reject some results that would have fit.
 */
public final class Precision {

  /** Constant values requiring more bits than this are not computed. */
  public static final int MAX_BITS = 4096;

  /** The largest exponent or shift amount that is considered at all. */
  public static final long UINT32_MAX = 0xFFFF_FFFFL;

  private static final BigInteger BIG_MAX_BITS = BigInteger.valueOf(MAX_BITS);

  private Precision() {}

  /** Returns the index of the most significant set bit of a positive value (0 for 1). */
  public static int msb(BigInteger value) {
    Preconditions.checkArgument(value.signum() > 0);
    return value.bitLength() - 1;
  }

  /**
   * Returns true if {@code base ** exp} can be computed within {@link #MAX_BITS} bits; {@code
   * base} must not be negative.
   */
  public static boolean fitsPrecisionExp(BigInteger base, BigInteger exp) {
    if (base.signum() == 0) {
      return true;
    }
    Preconditions.checkArgument(base.signum() > 0, "negative base %s", base);
    int mostSignificantBaseBit = msb(base);
    if (mostSignificantBaseBit == 0) {
      // base == 1
      return true;
    } else if (mostSignificantBaseBit > MAX_BITS) {
      return false;
    }
    BigInteger bitsNeeded = exp.multiply(BigInteger.valueOf(mostSignificantBaseBit + 1L));
    return bitsNeeded.compareTo(BIG_MAX_BITS) <= 0;
  }

  /** Returns true if {@code mantissa * 2 ** expBase2} fits in {@link #MAX_BITS} bits. */
  public static boolean fitsPrecisionBase2(BigInteger mantissa, long expBase2) {
    return fitsPrecisionBaseX(mantissa, 1.0, expBase2);
  }

  /**
   * Returns true if {@code mantissa * base ** exp} fits in {@link #MAX_BITS} bits, where {@code
   * log2OfBase} is the base-2 logarithm of {@code base}; {@code mantissa} must not be negative.
   */
  public static boolean fitsPrecisionBaseX(BigInteger mantissa, double log2OfBase, long exp) {
    if (mantissa.signum() == 0) {
      return true;
    }
    Preconditions.checkArgument(mantissa.signum() > 0, "negative mantissa %s", mantissa);
    int mostSignificantMantissaBit = msb(mantissa);
    if (mostSignificantMantissaBit > MAX_BITS) {
      return false;
    }
    double scaleBits = Math.floor(exp * log2OfBase);
    if (scaleBits > MAX_BITS) {
      return false;
    }
    long bitsNeeded = mostSignificantMantissaBit + (long) scaleBits + 1;
    return bitsNeeded <= MAX_BITS;
  }
}
