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

import org.ledgerlang.cfg.CfgNode;

/**
 * A forward dataflow problem over a {@link org.ledgerlang.cfg.FunctionFlow}, solved by {@link
 * DataflowSolver}.
 *
 * <p>Facts must be immutable and implement {@code equals}; {@link #merge} must be monotone and the
 * lattice of reachable facts finite, or the solver will not terminate.
 */
public interface ForwardAnalysis<F> {

  /** The fact that holds on entry to the function. */
  F entryFact();

  /** Returns the fact that holds after {@code node}, given the fact that holds before it. */
  F transfer(CfgNode node, F in);

  /**
   * Combines the fact already known to hold on entry to a node with one arriving along another
   * edge.
   */
  F merge(F existing, F incoming);
}
