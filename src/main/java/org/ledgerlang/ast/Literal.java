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

import com.google.common.base.Ascii;
import org.jspecify.annotations.Nullable;

/**
 * A literal as written in the source. Number literals keep their original text (including any
 * {@code _} separators) and an optional sub-denomination such as {@code ether} or {@code days}.
 */
public final class Literal extends Expression {

  public enum Kind {
    NUMBER,
    BOOL,
    STRING
  }

  /** Units that may follow a number literal; each scales the literal's value. */
  public enum SubDenomination {
    WEI(1),
    GWEI(1_000_000_000L),
    ETHER(1_000_000_000_000_000_000L),
    SECONDS(1),
    MINUTES(60),
    HOURS(60 * 60),
    DAYS(24 * 60 * 60),
    WEEKS(7 * 24 * 60 * 60);

    public final long multiplier;

    SubDenomination(long multiplier) {
      this.multiplier = multiplier;
    }

    @Override
    public String toString() {
      return Ascii.toLowerCase(name());
    }
  }

  private final Kind kind;
  private final String value;
  private final @Nullable SubDenomination subDenomination;

  public Literal(
      SourceLocation location, Kind kind, String value, @Nullable SubDenomination subDenomination) {
    super(location);
    this.kind = kind;
    this.value = value;
    this.subDenomination = subDenomination;
  }

  public static Literal number(SourceLocation location, String value) {
    return new Literal(location, Kind.NUMBER, value, null);
  }

  public static Literal bool(SourceLocation location, boolean value) {
    return new Literal(location, Kind.BOOL, String.valueOf(value), null);
  }

  public Kind kind() {
    return kind;
  }

  /** The literal's source text, without quotes or sub-denomination. */
  public String value() {
    return value;
  }

  public @Nullable SubDenomination subDenomination() {
    return subDenomination;
  }

  @Override
  public <A, R> R accept(AstVisitor<A, R> visitor, A arg) {
    return visitor.visitLiteral(this, arg);
  }

  @Override
  public String toString() {
    String s = (kind == Kind.STRING) ? "\"" + value + "\"" : value;
    return (subDenomination == null) ? s : s + " " + subDenomination;
  }
}
