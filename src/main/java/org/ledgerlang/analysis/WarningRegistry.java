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

package org.ledgerlang.analysis;

import com.google.common.collect.Sets;
import java.util.HashSet;
import java.util.Set;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.ast.VariableDeclaration;

/**
 * Remembers which warnings have already been issued during a compilation run.
 *
 * <p>A function inherited by several contracts is analyzed once per contract, and would otherwise
 * be warned about once per contract. Create one registry per run and share it between all the
 * {@link ControlFlowAnalyzer}s of that run.
 */
public final class WarningRegistry {
  private final Set<SourceLocation> unreachableLocations = new HashSet<>();
  private final Set<VariableDeclaration> unassignedReturns = Sets.newIdentityHashSet();

  /**
   * Records an unreachable-code warning for {@code location}; returns false if one was already
   * recorded.
   */
  public boolean markUnreachable(SourceLocation location) {
    return unreachableLocations.add(location);
  }

  /**
   * Records an unassigned-return warning for {@code variable}; returns false if one was already
   * recorded.
   */
  public boolean markUnassignedReturn(VariableDeclaration variable) {
    return unassignedReturns.add(variable);
  }
}
