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

package org.ledgerlang.analysis;

import org.ledgerlang.types.Type;
import org.ledgerlang.util.Rational;

/**
 * A compile-time constant value together with its type. If the type is an {@link
 * org.ledgerlang.types.IntegerType} the value has been truncated to an integer within the type's
 * bounds.
 */
public final class TypedRational {
  public final Type type;
  public final Rational value;

  public TypedRational(Type type, Rational value) {
    this.type = type;
    this.value = value;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TypedRational other
        && type.equals(other.type)
        && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return type.hashCode() * 31 + value.hashCode();
  }

  @Override
  public String toString() {
    return value + " : " + type;
  }
}
