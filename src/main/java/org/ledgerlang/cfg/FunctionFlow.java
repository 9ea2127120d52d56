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

/**
 * The control-flow graph of a single function: an arena of {@link CfgNode}s plus the indices of
 * four distinguished nodes. Every flow has all four; a function that never reverts simply has a
 * {@link #revert} node without entries.
 */
public final class FunctionFlow {
  private final ImmutableList<CfgNode> nodes;
  private final int entry;
  private final int exit;
  private final int revert;
  private final int transactionReturn;

  FunctionFlow(
      ImmutableList<CfgNode> nodes, int entry, int exit, int revert, int transactionReturn) {
    this.nodes = nodes;
    this.entry = entry;
    this.exit = exit;
    this.revert = revert;
    this.transactionReturn = transactionReturn;
  }

  public ImmutableList<CfgNode> nodes() {
    return nodes;
  }

  public CfgNode node(int index) {
    return nodes.get(index);
  }

  public int size() {
    return nodes.size();
  }

  /** Where execution of the function starts. */
  public CfgNode entry() {
    return nodes.get(entry);
  }

  /** Where execution ends when the function returns normally. */
  public CfgNode exit() {
    return nodes.get(exit);
  }

  /** Where execution ends when the function reverts. */
  public CfgNode revert() {
    return nodes.get(revert);
  }

  /** Where execution ends when the whole transaction returns from inside the function. */
  public CfgNode transactionReturn() {
    return nodes.get(transactionReturn);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (CfgNode node : nodes) {
      sb.append(node).append('\n');
    }
    return sb.toString();
  }
}
