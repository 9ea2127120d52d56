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

package org.ledgerlang.cfg;

import java.util.Comparator;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.ast.VariableDeclaration;

/**
 * One event involving a variable within a CFG node: its declaration, an assignment to it, a read,
 * its use as a returned value, or a use from inline assembly. The order of occurrences within a
 * node is program order.
 */
public final class VariableOccurrence implements Comparable<VariableOccurrence> {

  public enum Kind {
    DECLARATION,
    ASSIGNMENT,
    ACCESS,
    RETURN,
    /** Any use inside an inline assembly block; we can't tell reads from writes there. */
    INLINE_ASSEMBLY
  }

  /**
   * Occurrences without a location sort first; the rest are ordered by location, with ties broken
   * by the declaration's location and then the kind.
   */
  private static final Comparator<VariableOccurrence> ORDER =
      Comparator.comparing(
              (VariableOccurrence o) -> o.occurrence,
              Comparator.nullsFirst(Comparator.<SourceLocation>naturalOrder()))
          .thenComparing(o -> o.declaration.location())
          .thenComparing(o -> o.kind);

  private final VariableDeclaration declaration;
  private final Kind kind;
  private final @Nullable SourceLocation occurrence;

  public VariableOccurrence(
      VariableDeclaration declaration, Kind kind, @Nullable SourceLocation occurrence) {
    this.declaration = declaration;
    this.kind = kind;
    this.occurrence = occurrence;
  }

  public VariableDeclaration declaration() {
    return declaration;
  }

  public Kind kind() {
    return kind;
  }

  /** The location of the occurrence itself, if known. */
  public @Nullable SourceLocation occurrence() {
    return occurrence;
  }

  @Override
  public int compareTo(VariableOccurrence other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    String s = kind + "(" + declaration + ")";
    return (occurrence == null) ? s : s + "@" + occurrence;
  }
}
