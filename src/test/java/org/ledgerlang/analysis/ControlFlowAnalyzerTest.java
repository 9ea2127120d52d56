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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.ledgerlang.ast.ContractDefinition;
import org.ledgerlang.ast.FunctionDefinition;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.ast.VariableDeclaration;
import org.ledgerlang.cfg.ControlFlowGraph;
import org.ledgerlang.cfg.FlowBuilder;
import org.ledgerlang.cfg.FunctionFlow;
import org.ledgerlang.diagnostics.Diagnostic;
import org.ledgerlang.diagnostics.ErrorReporter;
import org.ledgerlang.diagnostics.SecondaryLocation;
import org.ledgerlang.diagnostics.Severity;
import org.ledgerlang.types.DataLocation;
import org.ledgerlang.types.ReferenceType;
import org.ledgerlang.types.TypeProvider;

@RunWith(JUnit4.class)
public class ControlFlowAnalyzerTest {
  private static final ReferenceType STORAGE_POINTER =
      new ReferenceType("struct S", DataLocation.STORAGE);
  private static final ReferenceType CALLDATA_POINTER =
      new ReferenceType("uint256[]", DataLocation.CALLDATA);
  private static final ReferenceType MEMORY_ARRAY =
      new ReferenceType("uint256[]", DataLocation.MEMORY);

  ErrorReporter reporter;
  WarningRegistry warnings;
  ContractDefinition base;
  ContractDefinition derived;
  FunctionDefinition f;

  private static SourceLocation loc(int start) {
    return SourceLocation.of("c.sol", start, start + 1);
  }

  @Before
  public void setup() {
    reporter = new ErrorReporter();
    warnings = new WarningRegistry();
    base = new ContractDefinition(loc(0), "Base");
    derived = new ContractDefinition(loc(500), "Derived");
    f = new FunctionDefinition(loc(10), "f", base, FunctionDefinition.Body.STATEMENTS);
  }

  /**
   * Returns the flow of a function that declares {@code variable}, assigns it only if some
   * condition holds, and then uses it (with an access if {@code returned} is false, otherwise a
   * return). The use is at {@code useLocation}.
   */
  private static FunctionFlow assignedOnOneBranch(
      VariableDeclaration variable, boolean returned, @Nullable SourceLocation useLocation) {
    FlowBuilder fb = new FlowBuilder();
    int decl = fb.newNode(loc(20));
    int thenBlock = fb.newNode(loc(30));
    int join = fb.newNode(loc(40));
    fb.declare(decl, variable, variable.location());
    fb.assign(thenBlock, variable, loc(30));
    if (returned) {
      fb.returns(join, variable, useLocation);
    } else {
      fb.access(join, variable, useLocation);
    }
    fb.link(fb.entry(), decl).link(decl, thenBlock).link(decl, join).link(thenBlock, join);
    fb.link(join, fb.exit());
    return fb.build();
  }

  private boolean run(FunctionDefinition function, ContractDefinition contract, FunctionFlow flow) {
    ControlFlowGraph cfg = ControlFlowGraph.builder().add(function, contract, flow).build();
    return new ControlFlowAnalyzer(cfg, reporter, warnings).run();
  }

  private Diagnostic onlyDiagnostic() {
    assertThat(reporter.diagnostics()).hasSize(1);
    return reporter.diagnostics().get(0);
  }

  @Test
  public void storagePointerReadAfterPartialAssignment() {
    VariableDeclaration p = VariableDeclaration.variable(loc(20), "p", STORAGE_POINTER);
    assertThat(run(f, base, assignedOnOneBranch(p, false, loc(42)))).isFalse();
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.errorId).isEqualTo(ControlFlowAnalyzer.UNINITIALIZED_POINTER);
    assertThat(diagnostic.severity).isEqualTo(Severity.ERROR);
    assertThat(diagnostic.location).isEqualTo(loc(42));
    assertThat(diagnostic.secondary)
        .containsExactly(new SecondaryLocation(loc(20), "The variable was declared here."));
    assertThat(diagnostic.message)
        .isEqualTo(
            "This variable is of storage pointer type and can be accessed without prior"
                + " assignment, which would lead to undefined behaviour.");
  }

  @Test
  public void calldataPointerReturned() {
    VariableDeclaration p = VariableDeclaration.variable(loc(20), "p", CALLDATA_POINTER);
    assertThat(run(f, base, assignedOnOneBranch(p, true, loc(42)))).isFalse();
    assertThat(onlyDiagnostic().message)
        .startsWith("This variable is of calldata pointer type and can be returned without");
  }

  @Test
  public void occurrenceWithoutLocation() {
    // An implicit return of a named return variable has no location of its own.
    VariableDeclaration p = VariableDeclaration.variable(loc(20), "p", STORAGE_POINTER);
    run(f, base, assignedOnOneBranch(p, true, null));
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.location).isEqualTo(loc(20));
    assertThat(diagnostic.secondary).isEmpty();
  }

  @Test
  public void namedLocalsAreNotReported() {
    VariableDeclaration v = VariableDeclaration.variable(loc(20), "v", TypeProvider.uint256());
    assertThat(run(f, base, assignedOnOneBranch(v, false, loc(42)))).isTrue();
    VariableDeclaration m = VariableDeclaration.variable(loc(20), "m", MEMORY_ARRAY);
    assertThat(run(f, base, assignedOnOneBranch(m, true, loc(42)))).isTrue();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void unnamedReturnVariable() {
    VariableDeclaration r = VariableDeclaration.variable(loc(20), "", TypeProvider.uint256());
    FunctionFlow flow = assignedOnOneBranch(r, true, null);
    assertThat(run(f, base, flow)).isTrue();
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.errorId).isEqualTo(ControlFlowAnalyzer.UNASSIGNED_RETURN);
    assertThat(diagnostic.severity).isEqualTo(Severity.WARNING);
    assertThat(diagnostic.location).isEqualTo(loc(20));
    assertThat(diagnostic.message)
        .isEqualTo(
            "Unnamed return variable can remain unassigned. Add an explicit return with value to"
                + " all non-reverting code paths or name the variable.");
    // Analyzing the same function again (e.g. in a derived contract) doesn't warn again.
    run(f, derived, flow);
    assertThat(reporter.diagnostics()).hasSize(1);
  }

  @Test
  public void unnamedReturnInDerivedContract() {
    VariableDeclaration r = VariableDeclaration.variable(loc(20), "", TypeProvider.uint256());
    run(f, derived, assignedOnOneBranch(r, true, null));
    assertThat(onlyDiagnostic().message)
        .isEqualTo(
            "Unnamed return variable can remain unassigned when the function is called when"
                + " \"Derived\" is the most derived contract. Add an explicit return with value"
                + " to all non-reverting code paths or name the variable.");
  }

  @Test
  public void emptyBody() {
    FunctionDefinition empty =
        new FunctionDefinition(loc(10), "g", base, FunctionDefinition.Body.EMPTY);
    VariableDeclaration r = VariableDeclaration.variable(loc(20), "", TypeProvider.uint256());
    assertThat(run(empty, base, assignedOnOneBranch(r, true, null))).isTrue();
    assertThat(reporter.diagnostics()).isEmpty();
    // Pointers are still checked.
    VariableDeclaration p = VariableDeclaration.variable(loc(20), "p", STORAGE_POINTER);
    assertThat(run(empty, base, assignedOnOneBranch(p, false, loc(42)))).isFalse();
  }

  @Test
  public void unimplementedFunctionsAreSkipped() {
    FunctionDefinition declared =
        new FunctionDefinition(loc(10), "h", base, FunctionDefinition.Body.NONE);
    VariableDeclaration p = VariableDeclaration.variable(loc(20), "p", STORAGE_POINTER);
    assertThat(run(declared, base, assignedOnOneBranch(p, false, loc(42)))).isTrue();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void runReportsEarlierErrors() {
    reporter.typeError(1234, loc(1), ImmutableList.of(), "Earlier.");
    ControlFlowAnalyzer analyzer =
        new ControlFlowAnalyzer(ControlFlowGraph.builder().build(), reporter, warnings);
    assertThat(analyzer.run()).isFalse();
  }

  @Test
  public void everyFlowIsAnalyzed() {
    VariableDeclaration p = VariableDeclaration.variable(loc(20), "p", STORAGE_POINTER);
    VariableDeclaration q = VariableDeclaration.variable(loc(60), "q", STORAGE_POINTER);
    FunctionDefinition g =
        new FunctionDefinition(loc(50), "g", base, FunctionDefinition.Body.STATEMENTS);
    ControlFlowGraph cfg =
        ControlFlowGraph.builder()
            .add(f, base, assignedOnOneBranch(p, false, loc(42)))
            .add(g, base, assignedOnOneBranch(q, false, loc(44)))
            .build();
    assertThat(new ControlFlowAnalyzer(cfg, reporter, warnings).run()).isFalse();
    assertThat(reporter.diagnostics()).hasSize(2);
  }
}
