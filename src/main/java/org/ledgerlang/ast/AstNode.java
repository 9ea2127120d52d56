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

/**
 * The root of the closed set of AST node classes. Every node has a source location, and nodes are
 * discriminated by {@link #accept}ing an {@link AstVisitor} rather than by runtime type tests.
 *
 * <p>AST nodes have identity semantics: two distinct nodes are never equal, even if they have the
 * same contents, so they can be used as keys in per-analysis caches.
 */
public abstract class AstNode {
  private final SourceLocation location;

  AstNode(SourceLocation location) {
    this.location = location;
  }

  public SourceLocation location() {
    return location;
  }

  /** Calls the {@code visitor} method corresponding to this node's class. */
  public abstract <A, R> R accept(AstVisitor<A, R> visitor, A arg);
}
