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

/** The bool type. There is a single instance, {@link TypeProvider#bool}. */
public final class BoolType extends Type {
  static final BoolType INSTANCE = new BoolType();

  private BoolType() {}

  @Override
  public Category category() {
    return Category.BOOL;
  }

  @Override
  public @Nullable Type binaryOperatorResult(Token operator, Type other) {
    if (other != this) {
      return null;
    }
    return switch (operator) {
      case AND, OR, EQUAL, NOT_EQUAL -> this;
      default -> null;
    };
  }

  @Override
  public @Nullable Type unaryOperatorResult(Token operator) {
    return (operator == Token.NOT) ? this : null;
  }

  @Override
  public String toString() {
    return "bool";
  }
}
