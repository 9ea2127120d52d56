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

/**
 * A function, identified by its name and the contract that defines it. The statements of its body
 * are represented by the function's control-flow graph; here we only record whether there is a
 * body and whether it has any statements.
 */
public final class FunctionDefinition extends AstNode {

  public enum Body {
    /** The function is declared without a body. */
    NONE,
    /** The body is {@code {}}. */
    EMPTY,
    /** The body has at least one statement. */
    STATEMENTS
  }

  private final String name;
  private final @Nullable ContractDefinition contract;
  private final Body body;

  public FunctionDefinition(
      SourceLocation location, String name, @Nullable ContractDefinition contract, Body body) {
    super(location);
    this.name = name;
    this.contract = contract;
    this.body = body;
  }

  public String name() {
    return name;
  }

  /** The contract in which this function is defined; null for free functions. */
  public @Nullable ContractDefinition contract() {
    return contract;
  }

  public boolean isImplemented() {
    return body != Body.NONE;
  }

  public boolean hasEmptyBody() {
    return body != Body.STATEMENTS;
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitFunction(this, arg);
  }

  @Override
  public String toString() {
    return (contract == null) ? name : contract.name() + "." + name;
  }
}
