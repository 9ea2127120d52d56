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

/** A contract. Only its name matters to the analyses in this project. */
public final class ContractDefinition extends AstNode {
  private final String name;

  public ContractDefinition(SourceLocation location, String name) {
    super(location);
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitContract(this, arg);
  }

  @Override
  public String toString() {
    return name;
  }
}
