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

package org.elara.compiler;

import org.elara.ast.Located;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;

/** The errors that can stop a module from being desugared. */
public abstract class DesugarError extends CompileError {

  private DesugarError(String msg, SourceRegion region) {
    super(msg, region);
  }

  /** Two values, two signatures, or two type declarations with the same name. */
  public static final class DuplicateDeclaration extends DesugarError {
    public final Located<Name> name;
    public final ModuleName module;

    DuplicateDeclaration(Located<Name> name, ModuleName module) {
      super(
          String.format("Duplicate declaration of '%s' in module %s", name.value(), module),
          name.region());
      this.name = name;
      this.module = module;
    }
  }

  /** A {@code def} signature with no {@code let} giving the value it describes. */
  public static final class MissingDeclarationBody extends DesugarError {
    public final Located<Name> name;

    MissingDeclarationBody(Located<Name> name) {
      super(String.format("Type signature for '%s' lacks a value", name.value()), name.region());
      this.name = name;
    }
  }

  public static final class EmptyBlock extends DesugarError {
    EmptyBlock(SourceRegion region) {
      super("Empty block", region);
    }
  }
}
