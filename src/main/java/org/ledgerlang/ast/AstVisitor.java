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
 * A visitor with one method for each concrete AST node class. Each method is passed an additional
 * argument of type {@code A}, which lets callers thread state (such as a recursion depth) through
 * a traversal without storing it in the visitor.
 */
public interface AstVisitor<A, R> {
  R visitContract(ContractDefinition contract, A arg);

  R visitFunction(FunctionDefinition function, A arg);

  R visitVariableDeclaration(VariableDeclaration declaration, A arg);

  R visitBinaryOperation(BinaryOperation operation, A arg);

  R visitUnaryOperation(UnaryOperation operation, A arg);

  R visitLiteral(Literal literal, A arg);

  R visitIdentifier(Identifier identifier, A arg);

  R visitTuple(TupleExpression tuple, A arg);
}
