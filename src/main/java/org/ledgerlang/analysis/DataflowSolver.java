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

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.cfg.CfgNode;
import org.ledgerlang.cfg.FunctionFlow;

/**
 * A worklist solver for {@link ForwardAnalysis}.
 *
 * <p>Starting from the entry node, each node taken from the worklist has its transfer function
 * applied and its output merged into each of its successors; a successor is (re-)queued the first
 * time it is reached and whenever the merge changes its input.
 */
public final class DataflowSolver {

  private DataflowSolver() {}

  public static <F> Result<F> solve(FunctionFlow flow, ForwardAnalysis<F> analysis) {
    int size = flow.size();
    List<@Nullable F> in = new ArrayList<>(Collections.nCopies(size, null));
    List<@Nullable F> out = new ArrayList<>(Collections.nCopies(size, null));
    boolean[] queued = new boolean[size];
    ArrayDeque<Integer> worklist = new ArrayDeque<>();
    int entry = flow.entry().index;
    in.set(entry, analysis.entryFact());
    worklist.add(entry);
    queued[entry] = true;
    while (!worklist.isEmpty()) {
      int index = worklist.poll();
      queued[index] = false;
      CfgNode node = flow.node(index);
      F before = in.get(index);
      Preconditions.checkState(before != null);
      F after = analysis.transfer(node, before);
      out.set(index, after);
      for (int i = 0; i < node.exits().length(); i++) {
        int successor = node.exits().get(i);
        F existing = in.get(successor);
        F merged = (existing == null) ? after : analysis.merge(existing, after);
        if (existing == null || !merged.equals(existing)) {
          in.set(successor, merged);
          if (!queued[successor]) {
            worklist.add(successor);
            queued[successor] = true;
          }
        }
      }
    }
    return new Result<>(in, out);
  }

  /** The facts computed for each node of a flow. */
  public static final class Result<F> {
    private final List<@Nullable F> in;
    private final List<@Nullable F> out;

    private Result(List<@Nullable F> in, List<@Nullable F> out) {
      this.in = in;
      this.out = out;
    }

    /** The fact on entry to the given node, or null if it is not reachable from the entry. */
    public @Nullable F in(CfgNode node) {
      return in.get(node.index);
    }

    /** The fact on exit from the given node, or null if it is not reachable from the entry. */
    public @Nullable F out(CfgNode node) {
      return out.get(node.index);
    }

    public boolean reached(CfgNode node) {
      return in.get(node.index) != null;
    }
  }
}
