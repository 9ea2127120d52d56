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

/**
 * An array, struct or mapping type together with the data location of the values it refers to.
 * Only storage and calldata references are pointers into data that outlives the current call.
 */
public final class ReferenceType extends Type {
  private final String name;
  private final DataLocation location;

  public ReferenceType(String name, DataLocation location) {
    this.name = name;
    this.location = location;
  }

  public String name() {
    return name;
  }

  public DataLocation location() {
    return location;
  }

  @Override
  public Category category() {
    return Category.REFERENCE;
  }

  @Override
  public boolean dataStoredIn(DataLocation location) {
    return this.location == location;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ReferenceType other
        && name.equals(other.name)
        && location == other.location;
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + location.hashCode();
  }

  @Override
  public String toString() {
    String s = name + " " + location;
    return (location == DataLocation.MEMORY) ? s : s + " pointer";
  }
}
