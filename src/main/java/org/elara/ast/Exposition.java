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
 * One entry in an explicit exposing list, e.g. the {@code map}, {@code (+)} and {@code Maybe(..)}
 * in {@code module M exposing (map, (+), Maybe(..))}.
 *
 * @param <N> the representation of the exposed name, which varies by stage: a {@link
 *     MaybeQualified} before renaming and a {@link Qualified} afterwards
 */
public record Exposition<N>(Kind kind, Located<N> name) {

  /** What sort of declaration is being exposed. */
  public enum Kind {
    VALUE,
    OPERATOR,
    TYPE,
    /** A type together with all of its constructors, written {@code T(..)}. */
    TYPE_AND_CONSTRUCTORS;

    /** Returns true if entries of this kind expose a {@link TypeName}. */
    public boolean isType() {
      return this == TYPE || this == TYPE_AND_CONSTRUCTORS;
    }
  }

  public <M> Exposition<M> withName(Located<M> newName) {
    return new Exposition<>(kind, newName);
  }

  @Override
  public String toString() {
    return kind == Kind.TYPE_AND_CONSTRUCTORS ? name + "(..)" : name.toString();
  }
}
