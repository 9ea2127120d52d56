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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.ContractDefinition;
import org.ledgerlang.ast.FunctionDefinition;

/**
 * The control-flow graphs of all the functions in a compilation run. A function inherited by
 * several contracts has one flow per contract, since which overrides it calls depends on the
 * most derived contract.
 */
public final class ControlFlowGraph {

  /** A function, the contract it is analyzed in, and its flow. */
  public static final class Entry {
    public final FunctionDefinition function;
    public final @Nullable ContractDefinition contract;
    public final FunctionFlow flow;

    Entry(FunctionDefinition function, @Nullable ContractDefinition contract, FunctionFlow flow) {
      this.function = function;
      this.contract = contract;
      this.flow = flow;
    }
  }

  private final ImmutableList<Entry> flows;

  private ControlFlowGraph(ImmutableList<Entry> flows) {
    this.flows = flows;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All flows, in the order they were added. */
  public ImmutableList<Entry> allFunctionFlows() {
    return flows;
  }

  /** Returns the flow of {@code function} when analyzed in {@code contract}, or null. */
  public @Nullable FunctionFlow functionFlow(
      FunctionDefinition function, @Nullable ContractDefinition contract) {
    for (Entry entry : flows) {
      if (entry.function == function && entry.contract == contract) {
        return entry.flow;
      }
    }
    return null;
  }

  public static final class Builder {
    private final ImmutableList.Builder<Entry> flows = ImmutableList.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(
        FunctionDefinition function, @Nullable ContractDefinition contract, FunctionFlow flow) {
      flows.add(new Entry(function, contract, flow));
      return this;
    }

    public ControlFlowGraph build() {
      return new ControlFlowGraph(flows.build());
    }
  }
}
