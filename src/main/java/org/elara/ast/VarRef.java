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
 * A resolved reference to a name: either a {@link Local} binder introduced inside the enclosing
 * declaration, or a {@link Global} module-level declaration.
 */
public sealed interface VarRef<T> {

  /** The referenced name without any qualification or unique tag. */
  T name();

  /** A reference to a binder introduced by a lambda, let, or pattern. */
  record Local<T>(Located<Unique<T>> unique) implements VarRef<T> {
    @Override
    public T name() {
      return unique.value().value();
    }

    @Override
    public String toString() {
      return unique.value().toString();
    }
  }

  /** A reference to a declaration of some module. */
  record Global<T>(Located<Qualified<T>> qualified) implements VarRef<T> {
    @Override
    public T name() {
      return qualified.value().name();
    }

    @Override
    public String toString() {
      return qualified.value().toString();
    }
  }
}
