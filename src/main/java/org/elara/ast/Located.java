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

import java.util.function.Function;

/** A value paired with the source region it was read from. */
public record Located<T>(SourceRegion region, T value) {

  public static <T> Located<T> generated(T value) {
    return new Located<>(SourceRegion.GENERATED, value);
  }

  /** Returns a Located with the same region and the result of applying {@code fn} to the value. */
  public <U> Located<U> map(Function<? super T, ? extends U> fn) {
    return new Located<>(region, fn.apply(value));
  }

  /** Returns {@code newValue} located at this value's region. */
  public <U> Located<U> withValue(U newValue) {
    return new Located<>(region, newValue);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
