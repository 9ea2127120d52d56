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
import org.ledgerlang.ast.SourceLocation;

/**
 * A single error or warning produced by an analysis. Each kind of problem has a stable numeric
 * {@link #errorId} so that tools and tests can recognize it independently of the message text.
 */
public final class Diagnostic {
  public final int errorId;
  public final Severity severity;
  public final SourceLocation location;
  public final ImmutableList<SecondaryLocation> secondary;
  public final String message;

  public Diagnostic(
      int errorId,
      Severity severity,
      SourceLocation location,
      ImmutableList<SecondaryLocation> secondary,
      String message) {
    this.errorId = errorId;
    this.severity = severity;
    this.location = location;
    this.secondary = secondary;
    this.message = message;
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder()
            .append(String.format("%s %04d: %s (%s)", severity, errorId, message, location));
    for (SecondaryLocation s : secondary) {
      sb.append("\n  note: ").append(s);
    }
    return sb.toString();
  }
}
