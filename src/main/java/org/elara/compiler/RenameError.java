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

import org.elara.ast.Desugared;
import org.elara.ast.Located;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeVarName;
import org.jspecify.annotations.Nullable;

/**
 * The errors that can stop a module from being renamed. Each subclass carries the values a
 * diagnostic needs in structured form; {@link #getMessage} is only a plain-text summary.
 *
 * <p>Resolution errors ({@link UnknownModule}, {@link UnknownName}, {@link
 * NonExistentModuleDeclaration}, {@link UnknownTypeVariable}) mean a name could not be found or is
 * not visible; {@link QualifiedInWrongModule} means an explicit qualifier contradicts its context;
 * {@link BlockEndsWithLet} and {@link NativeDefUnsupported} are constructs that cannot be
 * desugared.
 */
public abstract class RenameError extends CompileError {

  private RenameError(String msg, SourceRegion region) {
    super(msg, region);
  }

  public static final class UnknownModule extends RenameError {
    public final ModuleName module;

    UnknownModule(ModuleName module, SourceRegion region) {
      super("Unknown module: " + module, region);
      this.module = module;
    }
  }

  /** A name that should belong to {@code actual} was written with the qualifier {@code stated}. */
  public static final class QualifiedInWrongModule extends RenameError {
    public final ModuleName stated;
    public final ModuleName actual;

    QualifiedInWrongModule(ModuleName stated, ModuleName actual, SourceRegion region) {
      super(String.format("Qualified name in wrong module: %s in %s", stated, actual), region);
      this.stated = stated;
      this.actual = actual;
    }
  }

  public static final class NonExistentModuleDeclaration extends RenameError {
    public final ModuleName module;
    public final Located<Name> name;

    NonExistentModuleDeclaration(ModuleName module, Located<Name> name) {
      super(
          String.format("Element %s does not exist in module %s", name.value(), module),
          name.region());
      this.module = module;
      this.name = name;
    }
  }

  public static final class UnknownTypeVariable extends RenameError {
    public final Located<TypeVarName> name;

    UnknownTypeVariable(Located<TypeVarName> name) {
      super("Unknown type variable: " + name.value(), name.region());
      this.name = name;
    }
  }

  /** A name that is not in scope, or that its module does not expose. */
  public static final class UnknownName extends RenameError {
    public final Located<Name> name;

    UnknownName(Located<Name> name) {
      super(
          String.format("Unknown %s name: %s", name.value().kind(), name.value()), name.region());
      this.name = name;
    }
  }

  public static final class NativeDefUnsupported extends RenameError {
    public final Desugared.Declaration declaration;

    NativeDefUnsupported(Desugared.Declaration declaration) {
      super("Native definitions are not supported", declaration.region());
      this.declaration = declaration;
    }
  }

  /**
   * A block whose last element is a {@code let}; {@code let} is not an expression, so there is
   * nothing for the block to evaluate to.
   */
  public static final class BlockEndsWithLet extends RenameError {
    public final Desugared.Expr let;

    /** The declaration containing the block, if known. */
    public final Desugared.@Nullable Declaration enclosing;

    BlockEndsWithLet(Desugared.Expr let, Desugared.@Nullable Declaration enclosing) {
      super(
          enclosing == null
              ? "Block ends with let"
              : "Block ends with let in declaration " + enclosing.name().value(),
          let.region());
      this.let = let;
      this.enclosing = enclosing;
    }
  }
}
