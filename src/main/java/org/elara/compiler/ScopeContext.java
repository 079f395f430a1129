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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.elara.ast.Desugared;
import org.elara.ast.Desugared.Adt;
import org.elara.ast.Desugared.ConstructorDecl;
import org.elara.ast.Desugared.TypeDeclaration;
import org.elara.ast.Located;
import org.elara.ast.MaybeQualified;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.Qualified;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeName;
import org.elara.ast.TypeVarName;
import org.elara.ast.Unique;
import org.elara.ast.VarName;
import org.elara.ast.VarRef;
import org.elara.ast.VarRef.Global;
import org.elara.ast.VarRef.Local;
import org.jspecify.annotations.Nullable;

/**
 * A ScopeContext maps the names visible at some point in a module to what they refer to: value
 * and type names to {@link VarRef}s, type variable names to {@link Unique}s.
 *
 * <p>Module-level names (the module's own declarations and everything its imports expose) are
 * added once and never removed. Local binders are added inside {@link #scoped} calls, which undo
 * them when the call returns or throws; a local binding shadows any global or outer local binding
 * of the same name until then.
 *
 * <p>A ScopeContext belongs to the renaming of a single module and is not thread-safe.
 */
final class ScopeContext {
  private final ModuleGraph graph;

  /** The declarations of the module being renamed, which need not be in {@link #graph}. */
  private final ModuleExports self;

  private final Map<VarName, VarRef<VarName>> varNames = new HashMap<>();
  private final Map<TypeName, VarRef<TypeName>> typeNames = new HashMap<>();
  private final Map<TypeVarName, Unique<TypeVarName>> typeVars = new HashMap<>();

  /** Maps the {@code A} of each {@code import N as A} to {@code N}. */
  private final Map<ModuleName, ModuleName> aliases = new HashMap<>();

  /**
   * Each local binding pushes an Undo that reverts it; {@link #scoped} pops back to the length
   * the log had on entry.
   */
  private final List<Undo<?, ?>> undoLog = new ArrayList<>();

  private record Undo<K, V>(Map<K, V> map, K key, @Nullable V previous) {
    void apply() {
      if (previous == null) {
        map.remove(key);
      } else {
        map.put(key, previous);
      }
    }
  }

  ScopeContext(ModuleGraph graph, ModuleExports self) {
    this.graph = graph;
    this.self = self;
  }

  /**
   * Calls {@code body}, then removes any local bindings it added (restoring whatever they
   * shadowed), whether it returns normally or throws.
   */
  @CanIgnoreReturnValue
  <T> T scoped(Supplier<T> body) {
    int checkpoint = undoLog.size();
    try {
      return body.get();
    } finally {
      for (int i = undoLog.size() - 1; i >= checkpoint; i--) {
        undoLog.remove(i).apply();
      }
    }
  }

  private <K, V> void bind(Map<K, V> map, K key, V value) {
    undoLog.add(new Undo<>(map, key, map.put(key, value)));
  }

  /** Binds {@code name} to a local binder until the enclosing {@link #scoped} call exits. */
  void bindLocal(VarName name, Located<Unique<VarName>> unique) {
    bind(varNames, name, new Local<>(unique));
  }

  /** Binds a type variable until the enclosing {@link #scoped} call exits. */
  void bindTypeVar(TypeVarName name, Unique<TypeVarName> unique) {
    bind(typeVars, name, unique);
  }

  /** Makes a module-level name visible for the rest of the module. */
  void addGlobal(Name name, ModuleName module, SourceRegion region) {
    if (name instanceof VarName vn) {
      varNames.put(vn, new Global<>(new Located<>(region, new Qualified<>(vn, module))));
    } else {
      TypeName tn = (TypeName) name;
      typeNames.put(tn, new Global<>(new Located<>(region, new Qualified<>(tn, module))));
    }
  }

  /**
   * Makes a declaration visible under its own name, qualified by the module it belongs to. ADT
   * declarations also make each of their constructors visible as a type-level name.
   */
  void addDeclaration(Desugared.Declaration decl) {
    ModuleName module = decl.moduleName().value();
    addGlobal(decl.name().value(), module, decl.region());
    if (decl.body() instanceof TypeDeclaration typeDecl
        && typeDecl.definition() instanceof Adt adt) {
      for (ConstructorDecl constructor : adt.constructors()) {
        addGlobal(constructor.name().value(), module, constructor.name().region());
      }
    }
  }

  /**
   * Makes visible the names that an import brings into scope: each name that the imported module
   * exposes and the import's own exposing list allows. A qualified import only records its alias.
   *
   * @throws RenameError.UnknownModule if the imported module is not in the graph
   */
  void addImport(Desugared.Import imp) {
    ModuleName target = imp.importing().value();
    ModuleExports exports = graph.exportsOf(target);
    if (exports == null) {
      throw new RenameError.UnknownModule(target, imp.importing().region());
    }
    if (imp.as() != null) {
      aliases.put(imp.as().value(), target);
    }
    if (imp.qualified()) {
      return;
    }
    for (Name name : exports.declaredNames()) {
      if (exports.exposes(name) && exports.allows(imp.exposing(), name)) {
        addGlobal(name, target, exports.regionOf(name));
      }
    }
  }

  /**
   * Returns {@code name} qualified by {@code current}. Used for exposing lists, where any explicit
   * qualifier must name the module the list belongs to.
   *
   * @throws RenameError.QualifiedInWrongModule if {@code name} has a different qualifier
   */
  static <N> Located<Qualified<N>> qualifyIn(ModuleName current, Located<MaybeQualified<N>> name) {
    ModuleName stated = name.value().module();
    if (stated != null && !stated.equals(current)) {
      throw new RenameError.QualifiedInWrongModule(stated, current, name.region());
    }
    return name.withValue(new Qualified<>(name.value().name(), current));
  }

  /**
   * Resolves a value or operator reference. A qualified name must be declared and exposed by its
   * module; an unqualified one must be in scope.
   */
  VarRef<VarName> lookupVarName(Located<MaybeQualified<VarName>> name) {
    MaybeQualified<VarName> mq = name.value();
    if (mq.isQualified()) {
      ModuleName module = checkExistsAndExposed(mq.module(), name.withValue(mq.name()));
      return new Global<>(name.withValue(new Qualified<>(mq.name(), module)));
    }
    VarRef<VarName> ref = varNames.get(mq.name());
    if (ref == null) {
      throw new RenameError.UnknownName(name.withValue(mq.name()));
    }
    return ref;
  }

  /** Resolves a type or constructor reference; see {@link #lookupVarName}. */
  Qualified<TypeName> lookupTypeName(Located<MaybeQualified<TypeName>> name) {
    MaybeQualified<TypeName> mq = name.value();
    if (mq.isQualified()) {
      ModuleName module = checkExistsAndExposed(mq.module(), name.withValue(mq.name()));
      return new Qualified<>(mq.name(), module);
    }
    VarRef<TypeName> ref = typeNames.get(mq.name());
    if (ref == null) {
      throw new RenameError.UnknownName(name.withValue(mq.name()));
    } else if (ref instanceof Global<TypeName> global) {
      return global.qualified().value();
    }
    throw new AssertionError("Local type name " + ref);
  }

  /** Returns the Unique for the given type variable, or null if it is not in scope. */
  @Nullable Unique<TypeVarName> lookupTypeVar(TypeVarName name) {
    return typeVars.get(name);
  }

  /**
   * Checks that {@code qualifier} (or the module it is an alias for) exists and exposes the
   * named element, and returns the module.
   */
  private ModuleName checkExistsAndExposed(ModuleName qualifier, Located<? extends Name> name) {
    ModuleName module = aliases.getOrDefault(qualifier, qualifier);
    if (module.equals(Primitives.MODULE) && Primitives.declares(name.value())) {
      return module;
    }
    Located<Name> asName = name.withValue(name.value());
    if (module.equals(self.module)) {
      // A module can refer to its own declarations whether or not it exposes them.
      if (!self.declares(name.value())) {
        throw new RenameError.NonExistentModuleDeclaration(module, asName);
      }
      return module;
    }
    ModuleExports exports = graph.exportsOf(module);
    if (exports == null) {
      throw new RenameError.UnknownModule(module, name.region());
    } else if (!exports.declares(name.value())) {
      throw new RenameError.NonExistentModuleDeclaration(module, asName);
    } else if (!exports.exposes(name.value())) {
      throw new RenameError.UnknownName(asName);
    }
    return module;
  }
}
