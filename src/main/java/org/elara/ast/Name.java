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
 * A name that a module-level declaration can have: either a {@link VarName} (values and
 * operators) or a {@link TypeName} (types and their constructors).
 */
public sealed interface Name permits VarName, TypeName {

  /** The name as written, without any module qualifier. */
  String text();

  /** A short description used in diagnostics, e.g. "variable" or "type". */
  String kind();
}
