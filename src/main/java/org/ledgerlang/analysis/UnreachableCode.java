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
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.cfg.CfgNode;
import org.ledgerlang.cfg.FunctionFlow;

/**
 * Finds the code in a function that can never execute.
 *
 * <p>A node is unreachable if there is no path to it from the entry. We only look at nodes that
 * can themselves reach the end of the function (its exit, a revert, or the end of the
 * transaction); any other unreachable node is part of a region with no way out, and the start of
 * that region will have been found by this search anyway.
 */
public final class UnreachableCode {

  private UnreachableCode() {}

  /**
   * Returns the source ranges of the unreachable nodes in {@code flow}, sorted and with
   * overlapping or adjacent ranges combined.
   */
  public static ImmutableList<SourceLocation> find(FunctionFlow flow) {
    BitSet reachable = search(flow, ImmutableList.of(flow.entry()), CfgNode::exits);
    List<SourceLocation> unreachable = new ArrayList<>();
    BitSet reachesEnd =
        search(
            flow,
            ImmutableList.of(flow.exit(), flow.revert(), flow.transactionReturn()),
            CfgNode::entries);
    for (int i = reachesEnd.nextSetBit(0); i >= 0; i = reachesEnd.nextSetBit(i + 1)) {
      SourceLocation location = flow.node(i).location();
      if (!reachable.get(i) && location.isValid()) {
        unreachable.add(location);
      }
    }
    return merge(unreachable);
  }

  /** Returns the indices of the nodes reachable from {@code start} following {@code edges}. */
  private static BitSet search(
      FunctionFlow flow, List<CfgNode> start, Function<CfgNode, ImmutableIntArray> edges) {
    BitSet visited = new BitSet(flow.size());
    ArrayDeque<CfgNode> toVisit = new ArrayDeque<>(start);
    while (!toVisit.isEmpty()) {
      CfgNode node = toVisit.poll();
      if (visited.get(node.index)) {
        continue;
      }
      visited.set(node.index);
      edges.apply(node).forEach(next -> toVisit.add(flow.node(next)));
    }
    return visited;
  }

  /** Sorts the given locations and combines each run of overlapping or touching locations. */
  static ImmutableList<SourceLocation> merge(List<SourceLocation> locations) {
    if (locations.isEmpty()) {
      return ImmutableList.of();
    }
    Collections.sort(locations);
    ImmutableList.Builder<SourceLocation> result = ImmutableList.builder();
    SourceLocation current = locations.get(0);
    for (SourceLocation next : locations.subList(1, locations.size())) {
      if (next.source.equals(current.source) && next.start <= current.end) {
        current = current.extendTo(next);
      } else {
        result.add(current);
        current = next;
      }
    }
    result.add(current);
    return result.build();
  }
}
