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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** A dotted module name such as {@code Elara.Prim}. */
public record ModuleName(ImmutableList<String> parts) {

  public ModuleName {
    checkArgument(!parts.isEmpty(), "empty module name");
  }

  /** Parses a dotted name, e.g. {@code ModuleName.of("Data.List")}. */
  public static ModuleName of(String dotted) {
    return new ModuleName(ImmutableList.copyOf(Splitter.on('.').split(dotted)));
  }

  @Override
  public String toString() {
    return Joiner.on('.').join(parts);
  }
}
