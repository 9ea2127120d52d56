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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.ContractDefinition;
import org.ledgerlang.ast.FunctionDefinition;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.ast.VariableDeclaration;
import org.ledgerlang.cfg.ControlFlowGraph;
import org.ledgerlang.cfg.FunctionFlow;
import org.ledgerlang.cfg.VariableOccurrence;
import org.ledgerlang.diagnostics.ErrorReporter;
import org.ledgerlang.diagnostics.SecondaryLocation;
import org.ledgerlang.types.DataLocation;
import org.ledgerlang.types.Type;

/**
 * Checks the control flow of every implemented function: reports storage and calldata pointers
 * that may be used before they are assigned, unnamed return variables that may be returned
 * without a value, and unreachable code.
 */
public final class ControlFlowAnalyzer {

  static final int UNINITIALIZED_POINTER = 3464;
  static final int UNASSIGNED_RETURN = 6321;
  static final int UNREACHABLE_CODE = 5740;

  private final ControlFlowGraph cfg;
  private final ErrorReporter errorReporter;
  private final WarningRegistry warnings;

  public ControlFlowAnalyzer(
      ControlFlowGraph cfg, ErrorReporter errorReporter, WarningRegistry warnings) {
    this.cfg = cfg;
    this.errorReporter = errorReporter;
    this.warnings = warnings;
  }

  /**
   * Analyzes every function flow in the graph. Returns true if no errors have been reported to
   * the error reporter (by this or any earlier pass).
   */
  @CanIgnoreReturnValue
  public boolean run() {
    for (ControlFlowGraph.Entry entry : cfg.allFunctionFlows()) {
      analyze(entry.function, entry.contract, entry.flow);
    }
    return !errorReporter.hasErrors();
  }

  /** Analyzes {@code function} as a member of {@code contract}. */
  public void analyze(
      FunctionDefinition function, @Nullable ContractDefinition contract, FunctionFlow flow) {
    if (!function.isImplemented()) {
      return;
    }
    @Nullable String mostDerived =
        (contract != null && contract != function.contract()) ? contract.name() : null;
    checkUninitializedAccess(flow, function.hasEmptyBody(), mostDerived);
    checkUnreachable(flow);
  }

  /**
   * Reports uses of possibly-unassigned variables that reach the flow's exit. Only storage and
   * calldata pointers (an error) and unnamed return variables in a non-empty body (a warning) are
   * reported; other locals are left to the optimizer.
   *
   * @param mostDerived the name of the contract the function is being analyzed in, if that is not
   *     the contract that defines it
   */
  void checkUninitializedAccess(
      FunctionFlow flow, boolean emptyBody, @Nullable String mostDerived) {
    for (VariableOccurrence occurrence : UninitializedAccessAnalysis.find(flow)) {
      VariableDeclaration variable = occurrence.declaration();
      Type type = variable.type();
      if (type != null && isPointer(type)) {
        reportUninitializedPointer(occurrence, type);
      } else if (!emptyBody && variable.name().isEmpty()) {
        if (warnings.markUnassignedReturn(variable)) {
          errorReporter.warning(
              UNASSIGNED_RETURN,
              variable.location(),
              "Unnamed return variable can remain unassigned"
                  + (mostDerived == null
                      ? "."
                      : " when the function is called when \""
                          + mostDerived
                          + "\" is the most derived contract.")
                  + " Add an explicit return with value to all non-reverting code paths or name"
                  + " the variable.");
        }
      }
    }
  }

  private static boolean isPointer(Type type) {
    return type.dataStoredIn(DataLocation.STORAGE) || type.dataStoredIn(DataLocation.CALLDATA);
  }

  private void reportUninitializedPointer(VariableOccurrence occurrence, Type type) {
    VariableDeclaration variable = occurrence.declaration();
    SourceLocation location = occurrence.occurrence();
    ImmutableList<SecondaryLocation> secondary;
    if (location != null) {
      secondary =
          ImmutableList.of(
              new SecondaryLocation(variable.location(), "The variable was declared here."));
    } else {
      location = variable.location();
      secondary = ImmutableList.of();
    }
    errorReporter.typeError(
        UNINITIALIZED_POINTER,
        location,
        secondary,
        "This variable is of "
            + (type.dataStoredIn(DataLocation.STORAGE) ? "storage" : "calldata")
            + " pointer type and can be "
            + (occurrence.kind() == VariableOccurrence.Kind.RETURN ? "returned" : "accessed")
            + " without prior assignment, which would lead to undefined behaviour.");
  }

  /** Warns once about each range of unreachable code. */
  void checkUnreachable(FunctionFlow flow) {
    for (SourceLocation location : UnreachableCode.find(flow)) {
      if (warnings.markUnreachable(location)) {
        errorReporter.warning(UNREACHABLE_CODE, location, "Unreachable code.");
      }
    }
  }
}
