/*
 * Copyright 2025 The Elara Authors
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

package org.elara.ast;

/**
 * A name tagged with an identity that no other binder in the compilation shares. Two Uniques are
 * equal if and only if their ids are equal; the underlying value is carried only for readability
 * of dumps and diagnostics.
 *
 * <p>Uniques can only be created by a {@link UniqueGen}.
 */
public final class Unique<T> {
  private final int id;
  private final T value;

  Unique(int id, T value) {
    this.id = id;
    this.value = value;
  }

  public int id() {
    return id;
  }

  public T value() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Unique<?> other && other.id == id;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  @Override
  public String toString() {
    return value + "#" + id;
  }
}
