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

/** An expression of the form {@code op subExpression}. */
public final class UnaryOperation extends Expression {
  private final Token operator;
  private final Expression subExpression;

  public UnaryOperation(SourceLocation location, Token operator, Expression subExpression) {
    super(location);
    this.operator = operator;
    this.subExpression = subExpression;
  }

  public Token operator() {
    return operator;
  }

  public Expression subExpression() {
    return subExpression;
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitUnaryOperation(this, arg);
  }

  @Override
  public String toString() {
    return operator + "" + subExpression;
  }
}
