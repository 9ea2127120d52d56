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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import org.ledgerlang.ast.SourceLocation;

/**
 * A basic block in a {@link FunctionFlow}. Nodes refer to their predecessors ({@link #entries})
 * and successors ({@link #exits}) by index into the owning flow, so a graph with loops has no
 * cyclic object references.
 */
public final class CfgNode {
  /** This node's position in {@link FunctionFlow#nodes}. */
  public final int index;

  private final SourceLocation location;
  private final ImmutableList<VariableOccurrence> occurrences;
  private final ImmutableIntArray entries;
  private final ImmutableIntArray exits;

  CfgNode(
      int index,
      SourceLocation location,
      ImmutableList<VariableOccurrence> occurrences,
      ImmutableIntArray entries,
      ImmutableIntArray exits) {
    this.index = index;
    this.location = location;
    this.occurrences = occurrences;
    this.entries = entries;
    this.exits = exits;
  }

  /** The source range covered by this block; {@link SourceLocation#NONE} for synthetic nodes. */
  public SourceLocation location() {
    return location;
  }

  /** The variable occurrences in this block, in program order. */
  public ImmutableList<VariableOccurrence> occurrences() {
    return occurrences;
  }

  /** The indices of the nodes with an edge to this one. */
  public ImmutableIntArray entries() {
    return entries;
  }

  /** The indices of the nodes this one has an edge to. */
  public ImmutableIntArray exits() {
    return exits;
  }

  @Override
  public String toString() {
    return "n" + index + " -> " + exits;
  }
}
