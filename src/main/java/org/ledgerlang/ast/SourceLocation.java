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

package org.ledgerlang.ast;

import com.google.common.base.Preconditions;
import java.util.Comparator;

/**
 * A half-open range {@code [start, end)} of character offsets in a named source. A location with a
 * negative start is "invalid", i.e. does not correspond to any source text.
 */
public final class SourceLocation implements Comparable<SourceLocation> {

  /** The location used for synthesized nodes. */
  public static final SourceLocation NONE = new SourceLocation("", -1, -1);

  private static final Comparator<SourceLocation> ORDER =
      Comparator.comparing((SourceLocation loc) -> loc.source)
          .thenComparingInt(loc -> loc.start)
          .thenComparingInt(loc -> loc.end);

  public final String source;
  public final int start;
  public final int end;

  private SourceLocation(String source, int start, int end) {
    this.source = source;
    this.start = start;
    this.end = end;
  }

  public static SourceLocation of(String source, int start, int end) {
    Preconditions.checkArgument(start >= 0 && end >= start, "bad range %s..%s", start, end);
    return new SourceLocation(source, start, end);
  }

  public boolean isValid() {
    return start >= 0;
  }

  /** Returns a location in the same source covering this location and {@code other}. */
  public SourceLocation extendTo(SourceLocation other) {
    Preconditions.checkArgument(source.equals(other.source));
    return new SourceLocation(source, Math.min(start, other.start), Math.max(end, other.end));
  }

  @Override
  public int compareTo(SourceLocation other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SourceLocation other
        && source.equals(other.source)
        && start == other.start
        && end == other.end;
  }

  @Override
  public int hashCode() {
    return (source.hashCode() * 31 + start) * 31 + end;
  }

  @Override
  public String toString() {
    return isValid() ? String.format("%s:%s..%s", source, start, end) : "(no location)";
  }
}
