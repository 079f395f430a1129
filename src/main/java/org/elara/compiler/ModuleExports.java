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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.elara.ast.Desugared;
import org.elara.ast.Desugared.Adt;
import org.elara.ast.Desugared.ConstructorDecl;
import org.elara.ast.Desugared.TypeDeclaration;
import org.elara.ast.Exposing;
import org.elara.ast.Exposition;
import org.elara.ast.MaybeQualified;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeName;
import org.elara.ast.VarName;
import org.jspecify.annotations.Nullable;

/**
 * The names a module declares, and which of them it exposes to importers.
 *
 * <p>A module declares the name of each of its declarations and, for each ADT, the names of its
 * constructors. A constructor is exposed only if its module exposes everything, exposes the
 * constructor's type with {@code (..)}, or names the constructor itself.
 */
final class ModuleExports {
  final ModuleName module;
  private final Exposing<MaybeQualified<Name>> exposing;

  /** Every declared name, in source order, with the region of its declaration. */
  private final ImmutableMap<Name, SourceRegion> declared;

  /** Maps each constructor name to the type that declares it. */
  private final ImmutableMap<TypeName, TypeName> constructorTypes;

  ModuleExports(Desugared.Module m) {
    this.module = m.name().value();
    this.exposing = m.exposing();
    Map<Name, SourceRegion> declared = new LinkedHashMap<>();
    ImmutableMap.Builder<TypeName, TypeName> constructorTypes = ImmutableMap.builder();
    for (Desugared.Declaration decl : m.declarations()) {
      Name name = decl.name().value();
      declared.putIfAbsent(name, decl.region());
      if (decl.body() instanceof TypeDeclaration typeDecl
          && typeDecl.definition() instanceof Adt adt) {
        for (ConstructorDecl constructor : adt.constructors()) {
          declared.putIfAbsent(constructor.name().value(), constructor.name().region());
          constructorTypes.put(constructor.name().value(), (TypeName) name);
        }
      }
    }
    this.declared = ImmutableMap.copyOf(declared);
    this.constructorTypes = constructorTypes.buildKeepingLast();
  }

  /** Returns true if this module declares the given name (as a declaration or a constructor). */
  boolean declares(Name name) {
    return declared.containsKey(name);
  }

  /** Returns true if this module declares the given name and its exposing list includes it. */
  boolean exposes(Name name) {
    return declares(name) && allows(exposing, name);
  }

  /** Returns the region of the declaration of the given name, which must be declared. */
  SourceRegion regionOf(Name name) {
    return declared.get(name);
  }

  /** All declared names, in source order. */
  Iterable<Name> declaredNames() {
    return declared.keySet();
  }

  /**
   * Returns true if the given exposing spec (this module's own, or that of an import of this
   * module) includes the given name. Names in the list may be unqualified or qualified by this
   * module.
   */
  boolean allows(Exposing<MaybeQualified<Name>> spec, Name name) {
    if (!(spec instanceof Exposing.Some<MaybeQualified<Name>> some)) {
      return true;
    }
    @Nullable TypeName parent = (name instanceof TypeName tn) ? constructorTypes.get(tn) : null;
    for (Exposition<MaybeQualified<Name>> e : some.expositions()) {
      MaybeQualified<Name> exposed = e.name().value();
      if (exposed.module() != null && !exposed.module().equals(module)) {
        continue;
      }
      if (parent != null) {
        // Constructors are reached through their type, or by naming them directly.
        if ((e.kind() == Exposition.Kind.TYPE_AND_CONSTRUCTORS && exposed.name().equals(parent))
            || (e.kind().isType() && exposed.name().equals(name))) {
          return true;
        }
      } else if (exposed.name().equals(name) && kindMatches(e.kind(), name)) {
        return true;
      }
    }
    return false;
  }

  private static boolean kindMatches(Exposition.Kind kind, Name name) {
    if (name instanceof VarName vn) {
      return kind == (vn.isOperator() ? Exposition.Kind.OPERATOR : Exposition.Kind.VALUE);
    }
    return kind.isType();
  }
}
