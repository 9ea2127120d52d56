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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.LinkedHashSet;
import java.util.Set;
import org.ledgerlang.ast.VariableDeclaration;
import org.ledgerlang.cfg.CfgNode;
import org.ledgerlang.cfg.FunctionFlow;
import org.ledgerlang.cfg.VariableOccurrence;

/**
 * Finds uses of variables that may not have been assigned.
 *
 * <p>A variable is unassigned from its declaration until an assignment to it; since the sets are
 * merged by union at control-flow joins, a variable is unassigned at a point if it is unassigned
 * along <i>any</i> path reaching that point. A read, return, or inline assembly use of an
 * unassigned variable is flagged, and flagged occurrences are carried forward along every path
 * from the node that contains them.
 */
public final class UninitializedAccessAnalysis
    implements ForwardAnalysis<UninitializedAccessAnalysis.NodeInfo> {

  /**
   * The variables that may be unassigned at some point, and the flagged occurrences on paths to
   * that point. Both sets compare elements by identity.
   */
  public static final class NodeInfo {
    static final NodeInfo EMPTY = new NodeInfo(ImmutableSet.of(), ImmutableSet.of());

    final ImmutableSet<VariableDeclaration> unassigned;
    final ImmutableSet<VariableOccurrence> uninitializedAccesses;

    NodeInfo(
        ImmutableSet<VariableDeclaration> unassigned,
        ImmutableSet<VariableOccurrence> uninitializedAccesses) {
      this.unassigned = unassigned;
      this.uninitializedAccesses = uninitializedAccesses;
    }

    public ImmutableSet<VariableDeclaration> unassigned() {
      return unassigned;
    }

    public ImmutableSet<VariableOccurrence> uninitializedAccesses() {
      return uninitializedAccesses;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NodeInfo other
          && unassigned.equals(other.unassigned)
          && uninitializedAccesses.equals(other.uninitializedAccesses);
    }

    @Override
    public int hashCode() {
      return unassigned.hashCode() * 31 + uninitializedAccesses.hashCode();
    }

    @Override
    public String toString() {
      return "unassigned=" + unassigned + ", flagged=" + uninitializedAccesses;
    }
  }

  public static final UninitializedAccessAnalysis INSTANCE = new UninitializedAccessAnalysis();

  private UninitializedAccessAnalysis() {}

  /**
   * Returns the flagged occurrences that reach the flow's exit node, sorted. Occurrences that are
   * only followed by a revert are not included.
   */
  public static ImmutableList<VariableOccurrence> find(FunctionFlow flow) {
    NodeInfo atExit = DataflowSolver.solve(flow, INSTANCE).out(flow.exit());
    if (atExit == null) {
      return ImmutableList.of();
    }
    return ImmutableList.sortedCopyOf(atExit.uninitializedAccesses);
  }

  @Override
  public NodeInfo entryFact() {
    return NodeInfo.EMPTY;
  }

  @Override
  public NodeInfo transfer(CfgNode node, NodeInfo in) {
    if (node.occurrences().isEmpty()) {
      return in;
    }
    Set<VariableDeclaration> unassigned = Sets.newIdentityHashSet();
    unassigned.addAll(in.unassigned);
    Set<VariableOccurrence> flagged = new LinkedHashSet<>(in.uninitializedAccesses);
    for (VariableOccurrence occurrence : node.occurrences()) {
      switch (occurrence.kind()) {
        case DECLARATION:
          unassigned.add(occurrence.declaration());
          break;
        case ASSIGNMENT:
          unassigned.remove(occurrence.declaration());
          break;
        case ACCESS:
        case RETURN:
        case INLINE_ASSEMBLY:
          if (unassigned.contains(occurrence.declaration())) {
            flagged.add(occurrence);
          }
          break;
      }
    }
    return new NodeInfo(ImmutableSet.copyOf(unassigned), ImmutableSet.copyOf(flagged));
  }

  @Override
  public NodeInfo merge(NodeInfo existing, NodeInfo incoming) {
    if (existing.unassigned.containsAll(incoming.unassigned)
        && existing.uninitializedAccesses.containsAll(incoming.uninitializedAccesses)) {
      return existing;
    }
    return new NodeInfo(
        ImmutableSet.<VariableDeclaration>builder()
            .addAll(existing.unassigned)
            .addAll(incoming.unassigned)
            .build(),
        ImmutableSet.<VariableOccurrence>builder()
            .addAll(existing.uninitializedAccesses)
            .addAll(incoming.uninitializedAccesses)
            .build());
  }
}
