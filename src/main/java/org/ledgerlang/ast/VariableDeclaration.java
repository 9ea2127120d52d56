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

package org.ledgerlang.ast;

import org.jspecify.annotations.Nullable;
import org.ledgerlang.types.Type;

/**
 * A variable declaration: a state variable, constant, local, parameter or return variable. Return
 * variables may be unnamed, in which case {@link #name} is empty.
 */
public final class VariableDeclaration extends AstNode {
  private final String name;
  private final boolean isConstant;
  private final @Nullable Type type;
  private final @Nullable Expression value;

  public VariableDeclaration(
      SourceLocation location,
      String name,
      boolean isConstant,
      @Nullable Type type,
      @Nullable Expression value) {
    super(location);
    this.name = name;
    this.isConstant = isConstant;
    this.type = type;
    this.value = value;
  }

  /** Returns a declaration for a constant with the given type and initializer. */
  public static VariableDeclaration constant(
      SourceLocation location, String name, @Nullable Type type, @Nullable Expression value) {
    return new VariableDeclaration(location, name, true, type, value);
  }

  /** Returns a declaration for a non-constant variable without an initializer. */
  public static VariableDeclaration variable(SourceLocation location, String name, Type type) {
    return new VariableDeclaration(location, name, false, type, null);
  }

  /** Empty for unnamed return variables. */
  public String name() {
    return name;
  }

  public boolean isConstant() {
    return isConstant;
  }

  /** The declared type, or null if it has not been resolved. */
  public @Nullable Type type() {
    return type;
  }

  /** The initializer, if any. */
  public @Nullable Expression value() {
    return value;
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitVariableDeclaration(this, arg);
  }

  @Override
  public String toString() {
    return name.isEmpty() ? "(unnamed)" : name;
  }
}
