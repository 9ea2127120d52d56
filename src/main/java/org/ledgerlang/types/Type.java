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

import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.Token;

/**
 * A semantic type. Types are immutable; instances of the common ones are shared through {@link
 * TypeProvider}.
 *
 * <p>The default implementations describe a type that supports no operators and is not stored in
 * any data location; subclasses override what they support.
 */
public abstract class Type {

  public enum Category {
    /** A compile-time number with a known exact value. */
    RATIONAL_NUMBER,
    INTEGER,
    BOOL,
    REFERENCE
  }

  Type() {}

  public abstract Category category();

  /**
   * Returns the type of {@code this op other}, or null if the operator cannot be applied to these
   * operand types. Comparison operators produce {@link BoolType}.
   */
  public @Nullable Type binaryOperatorResult(Token operator, Type other) {
    return null;
  }

  /** Returns the type of {@code op this}, or null if the operator cannot be applied. */
  public @Nullable Type unaryOperatorResult(Token operator) {
    return null;
  }

  /** True if values of this type are references into the given data location. */
  public boolean dataStoredIn(DataLocation location) {
    return false;
  }

  public boolean isImplicitlyConvertibleTo(Type other) {
    return equals(other);
  }

  /**
   * Returns the type a value of this type gets when it has to be stored somewhere, or null if
   * there is none. Most types are their own mobile type.
   */
  public @Nullable Type mobileType() {
    return this;
  }
}
