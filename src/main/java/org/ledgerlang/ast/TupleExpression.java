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

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;

/**
 * A parenthesized list of expressions {@code (a, b, ...)}, or an inline array {@code [a, b, ...]}.
 * A parenthesized single expression is a tuple with one component.
 */
public final class TupleExpression extends Expression {
  private final ImmutableList<Expression> components;
  private final boolean isInlineArray;

  public TupleExpression(
      SourceLocation location, ImmutableList<Expression> components, boolean isInlineArray) {
    super(location);
    this.components = components;
    this.isInlineArray = isInlineArray;
  }

  /** Returns a parenthesized expression. */
  public static TupleExpression paren(SourceLocation location, Expression inner) {
    return new TupleExpression(location, ImmutableList.of(inner), false);
  }

  public ImmutableList<Expression> components() {
    return components;
  }

  public boolean isInlineArray() {
    return isInlineArray;
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitTuple(this, arg);
  }

  @Override
  public String toString() {
    String inner = components.stream().map(Object::toString).collect(Collectors.joining(", "));
    return isInlineArray ? "[" + inner + "]" : "(" + inner + ")";
  }
}
