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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Which names a module makes visible to its importers, or which names an import brings into
 * scope: either everything, or an explicit list.
 *
 * @param <N> the representation of names in the list; see {@link Exposition}
 */
public sealed interface Exposing<N> {

  @SuppressWarnings("unchecked")
  static <N> Exposing<N> all() {
    return (Exposing<N>) All.INSTANCE;
  }

  static <N> Exposing<N> some(ImmutableList<Exposition<N>> expositions) {
    return new Some<>(expositions);
  }

  /** {@code exposing (..)} */
  @SuppressWarnings("rawtypes")
  final class All<N> implements Exposing<N> {
    private static final All INSTANCE = new All();

    private All() {}

    @Override
    public String toString() {
      return "(..)";
    }
  }

  /** {@code exposing (a, b, C(..))} */
  record Some<N>(ImmutableList<Exposition<N>> expositions) implements Exposing<N> {
    @Override
    public String toString() {
      return "(" + Joiner.on(", ").join(expositions) + ")";
    }
  }
}
