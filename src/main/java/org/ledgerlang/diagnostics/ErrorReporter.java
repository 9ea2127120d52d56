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

package org.ledgerlang.diagnostics;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.ledgerlang.ast.SourceLocation;

/**
 * Collects the diagnostics reported while analyzing one compilation run.
 *
 * <p>Reporting never throws. A fatal report is recorded like any other, and callers that can
 * trigger one are expected to check {@link #hasFatalErrors} (or their own result) and stop
 * analyzing the current unit.
 */
public class ErrorReporter {
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private boolean hasErrors;
  private boolean hasFatalErrors;

  public void warning(int errorId, SourceLocation location, String message) {
    report(errorId, Severity.WARNING, location, ImmutableList.of(), message);
  }

  public void typeError(
      int errorId,
      SourceLocation location,
      ImmutableList<SecondaryLocation> secondary,
      String message) {
    report(errorId, Severity.ERROR, location, secondary, message);
  }

  public void fatalTypeError(int errorId, SourceLocation location, String message) {
    report(errorId, Severity.FATAL_ERROR, location, ImmutableList.of(), message);
  }

  @FormatMethod
  public void fatalTypeError(int errorId, SourceLocation location, String fmt, Object... fmtArgs) {
    fatalTypeError(errorId, location, String.format(fmt, fmtArgs));
  }

  /** Records a diagnostic; all the other reporting methods funnel through here. */
  protected void report(
      int errorId,
      Severity severity,
      SourceLocation location,
      ImmutableList<SecondaryLocation> secondary,
      String message) {
    diagnostics.add(new Diagnostic(errorId, severity, location, secondary, message));
    hasErrors |= severity.isError();
    hasFatalErrors |= (severity == Severity.FATAL_ERROR);
  }

  /** Returns the diagnostics reported so far, in the order they were reported. */
  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** True if at least one error or fatal error has been reported. */
  public boolean hasErrors() {
    return hasErrors;
  }

  public boolean hasFatalErrors() {
    return hasFatalErrors;
  }
}
