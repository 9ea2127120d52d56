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

/** Operator tokens that may appear in binary and unary operations. */
public enum Token {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  EXP("**"),
  BIT_OR("|"),
  BIT_XOR("^"),
  BIT_AND("&"),
  SHL("<<"),
  SAR(">>"),
  SHR(">>>"),
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS_THAN("<"),
  GREATER_THAN(">"),
  LESS_THAN_OR_EQUAL("<="),
  GREATER_THAN_OR_EQUAL(">="),
  AND("&&"),
  OR("||"),
  NOT("!"),
  BIT_NOT("~"),
  INC("++"),
  DEC("--");

  private final String symbol;

  Token(String symbol) {
    this.symbol = symbol;
  }

  /** True for the six comparison operators, which always produce a bool. */
  public boolean isCompareOp() {
    return ordinal() >= EQUAL.ordinal() && ordinal() <= GREATER_THAN_OR_EQUAL.ordinal();
  }

  public boolean isShiftOp() {
    return this == SHL || this == SAR || this == SHR;
  }

  public boolean isBooleanOp() {
    return this == AND || this == OR || this == NOT;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
