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

import org.jspecify.annotations.Nullable;

/**
 * A name as written in source, optionally prefixed by a module name ({@code List.map} or just
 * {@code map}).
 */
public record MaybeQualified<N>(N name, @Nullable ModuleName module) {

  public static <N> MaybeQualified<N> unqualified(N name) {
    return new MaybeQualified<>(name, null);
  }

  public static <N> MaybeQualified<N> qualified(N name, ModuleName module) {
    return new MaybeQualified<>(name, module);
  }

  public boolean isQualified() {
    return module != null;
  }

  @Override
  public String toString() {
    return module == null ? String.valueOf(name) : module + "." + name;
  }
}
