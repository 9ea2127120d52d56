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

/** How serious a {@link Diagnostic} is; later constants are more severe. */
public enum Severity {
  WARNING("Warning"),
  ERROR("Error"),
  /** The current compilation unit cannot be analyzed any further. */
  FATAL_ERROR("Fatal error");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  /** True for {@link #ERROR} and {@link #FATAL_ERROR}. */
  public boolean isError() {
    return this != WARNING;
  }

  @Override
  public String toString() {
    return label;
  }
}
