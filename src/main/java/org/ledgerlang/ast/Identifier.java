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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A reference to a named declaration. The referenced declaration is filled in by name resolution
 * after the node is created, which is what allows constants to refer to each other (even
 * cyclically).
 */
public final class Identifier extends Expression {
  private final String name;
  private @Nullable AstNode referencedDeclaration;

  public Identifier(SourceLocation location, String name) {
    super(location);
    this.name = name;
  }

  public String name() {
    return name;
  }

  /** Null until {@link #resolve} has been called. */
  public @Nullable AstNode referencedDeclaration() {
    return referencedDeclaration;
  }

  /** Records the declaration this identifier refers to; may only be called once. */
  public void resolve(AstNode declaration) {
    Preconditions.checkState(referencedDeclaration == null, "%s already resolved", name);
    referencedDeclaration = Preconditions.checkNotNull(declaration);
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitIdentifier(this, arg);
  }

  @Override
  public String toString() {
    return name;
  }
}
