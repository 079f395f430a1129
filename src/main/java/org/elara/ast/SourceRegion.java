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

import com.google.common.collect.Iterables;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A contiguous range of characters in a source file, used to point diagnostics at the construct
 * that caused them. Offsets are zero-based; {@code endOffset} is exclusive.
 */
public record SourceRegion(@Nullable String sourceFile, int startOffset, int endOffset) {

  /** The region attached to trees that the compiler makes up rather than reads from a file. */
  public static final SourceRegion GENERATED = new SourceRegion("<generated>", 0, 0);

  public SourceRegion {
    checkArgument(startOffset <= endOffset, "start %s after end %s", startOffset, endOffset);
  }

  /** Returns the smallest region containing all of the given regions, which must be non-empty. */
  public static SourceRegion spanning(Iterable<SourceRegion> regions) {
    SourceRegion first = Iterables.getFirst(regions, null);
    checkArgument(first != null, "no regions");
    int start = first.startOffset;
    int end = first.endOffset;
    for (SourceRegion r : regions) {
      checkSameFile(first, r);
      start = Math.min(start, r.startOffset);
      end = Math.max(end, r.endOffset);
    }
    return new SourceRegion(first.sourceFile, start, end);
  }

  private static void checkSameFile(SourceRegion a, SourceRegion b) {
    checkArgument(
        Objects.equals(a.sourceFile, b.sourceFile),
        "regions are in different files: %s and %s",
        a.sourceFile,
        b.sourceFile);
  }

  @Override
  public String toString() {
    return String.format("%s:%s-%s", sourceFile, startOffset, endOffset);
  }
}
