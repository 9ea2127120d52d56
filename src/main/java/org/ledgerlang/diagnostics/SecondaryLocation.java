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

import org.ledgerlang.ast.SourceLocation;

/** An additional location attached to a diagnostic, with a note explaining its relevance. */
public final class SecondaryLocation {
  public final SourceLocation location;
  public final String note;

  public SecondaryLocation(SourceLocation location, String note) {
    this.location = location;
    this.note = note;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SecondaryLocation other
        && location.equals(other.location)
        && note.equals(other.note);
  }

  @Override
  public int hashCode() {
    return location.hashCode() * 31 + note.hashCode();
  }

  @Override
  public String toString() {
    return String.format("%s (%s)", note, location);
  }
}
