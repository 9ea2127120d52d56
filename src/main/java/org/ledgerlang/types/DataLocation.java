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

package org.ledgerlang.types;

import com.google.common.base.Ascii;

/** Where the data behind a reference-typed value lives. */
public enum DataLocation {
  STORAGE,
  MEMORY,
  CALLDATA;

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}
