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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out {@link Unique}s with strictly increasing ids. A single UniqueGen should be shared by
 * everything renamed in one compilation; it is safe to use from multiple threads.
 */
public final class UniqueGen {
  private final AtomicInteger next;

  public UniqueGen() {
    this(0);
  }

  /** Creates a UniqueGen whose first Unique will have the given id. */
  public UniqueGen(int firstId) {
    this.next = new AtomicInteger(firstId);
  }

  public <T> Unique<T> makeUnique(T value) {
    return new Unique<>(next.getAndIncrement(), value);
  }

  /** Makes a Unique for a located name, keeping its region. */
  public <T> Located<Unique<T>> makeUnique(Located<T> value) {
    return value.withValue(makeUnique(value.value()));
  }

  /** Returns the id that the next call to {@link #makeUnique} will use. */
  public int peekNextId() {
    return next.get();
  }
}
