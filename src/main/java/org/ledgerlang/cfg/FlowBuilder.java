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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.ast.VariableDeclaration;
import org.ledgerlang.cfg.VariableOccurrence.Kind;

/**
 * Builds a {@link FunctionFlow}. A new FlowBuilder starts with the four distinguished nodes (entry,
 * exit, revert and transaction return); callers add the nodes for the function's blocks, link
 * them, and record the variable occurrences in each.
 *
 * <p>A typical {@code if (c) { x = 1; } return x;} might be built as
 *
 * <pre>
 * FlowBuilder fb = new FlowBuilder();
 * int cond = fb.newNode(condLoc);
 * int thenBlock = fb.newNode(thenLoc);
 * int join = fb.newNode(joinLoc);
 * fb.link(fb.entry(), cond).link(cond, thenBlock).link(cond, join).link(thenBlock, join);
 * fb.assign(thenBlock, x, assignLoc).returns(join, x, returnLoc).link(join, fb.exit());
 * FunctionFlow flow = fb.build();
 * </pre>
 */
public final class FlowBuilder {

  /** The mutable state of a node under construction. */
  private static class NodeState {
    final SourceLocation location;
    final List<VariableOccurrence> occurrences = new ArrayList<>();
    final List<Integer> entries = new ArrayList<>();
    final List<Integer> exits = new ArrayList<>();

    NodeState(SourceLocation location) {
      this.location = location;
    }
  }

  private final List<NodeState> nodes = new ArrayList<>();
  private final int entry;
  private final int exit;
  private final int revert;
  private final int transactionReturn;
  private boolean built;

  public FlowBuilder() {
    entry = newNode();
    exit = newNode();
    revert = newNode();
    transactionReturn = newNode();
  }

  public int entry() {
    return entry;
  }

  public int exit() {
    return exit;
  }

  public int revert() {
    return revert;
  }

  public int transactionReturn() {
    return transactionReturn;
  }

  /** Adds a node without a source location and returns its index. */
  public int newNode() {
    return newNode(SourceLocation.NONE);
  }

  /** Adds a node covering the given source range and returns its index. */
  public int newNode(SourceLocation location) {
    Preconditions.checkState(!built);
    nodes.add(new NodeState(location));
    return nodes.size() - 1;
  }

  /** Adds an edge from {@code from} to {@code to}; adding an existing edge again has no effect. */
  @CanIgnoreReturnValue
  public FlowBuilder link(int from, int to) {
    Preconditions.checkState(!built);
    NodeState origin = nodes.get(from);
    NodeState target = nodes.get(to);
    if (!origin.exits.contains(to)) {
      origin.exits.add(to);
      target.entries.add(from);
    }
    return this;
  }

  @CanIgnoreReturnValue
  public FlowBuilder declare(
      int node, VariableDeclaration variable, @Nullable SourceLocation location) {
    return addOccurrence(node, variable, Kind.DECLARATION, location);
  }

  @CanIgnoreReturnValue
  public FlowBuilder assign(
      int node, VariableDeclaration variable, @Nullable SourceLocation location) {
    return addOccurrence(node, variable, Kind.ASSIGNMENT, location);
  }

  @CanIgnoreReturnValue
  public FlowBuilder access(
      int node, VariableDeclaration variable, @Nullable SourceLocation location) {
    return addOccurrence(node, variable, Kind.ACCESS, location);
  }

  @CanIgnoreReturnValue
  public FlowBuilder returns(
      int node, VariableDeclaration variable, @Nullable SourceLocation location) {
    return addOccurrence(node, variable, Kind.RETURN, location);
  }

  @CanIgnoreReturnValue
  public FlowBuilder inlineAssembly(
      int node, VariableDeclaration variable, @Nullable SourceLocation location) {
    return addOccurrence(node, variable, Kind.INLINE_ASSEMBLY, location);
  }

  /** Appends an occurrence to the given node; occurrences must be added in program order. */
  @CanIgnoreReturnValue
  public FlowBuilder addOccurrence(
      int node, VariableDeclaration variable, Kind kind, @Nullable SourceLocation location) {
    Preconditions.checkState(!built);
    nodes.get(node).occurrences.add(new VariableOccurrence(variable, kind, location));
    return this;
  }

  /** Returns the completed flow; no further changes may be made to this builder. */
  public FunctionFlow build() {
    Preconditions.checkState(!built);
    built = true;
    ImmutableList.Builder<CfgNode> result = ImmutableList.builderWithExpectedSize(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      NodeState state = nodes.get(i);
      result.add(
          new CfgNode(
              i,
              state.location,
              ImmutableList.copyOf(state.occurrences),
              ImmutableIntArray.copyOf(state.entries),
              ImmutableIntArray.copyOf(state.exits)));
    }
    return new FunctionFlow(result.build(), entry, exit, revert, transactionReturn);
  }
}
