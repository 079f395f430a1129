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

import com.google.common.collect.ImmutableSet;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeName;
import org.elara.ast.VarName;

/**
 * The names the compiler provides without any import. Source code reaches runtime primitives by
 * calling {@code elaraPrimitive} with the primitive's name, e.g. {@code elaraPrimitive "println"};
 * later stages replace these calls with the primitives themselves.
 */
public final class Primitives {

  public static final ModuleName MODULE = ModuleName.of("Elara.Prim");

  public static final VarName FETCH_PRIMITIVE = VarName.normal("elaraPrimitive");

  public static final TypeName STRING = new TypeName("String");

  /** The region attached to references to primitives. */
  static final SourceRegion REGION = new SourceRegion("<primitive>", 0, 0);

  private static final ImmutableSet<Name> NAMES = ImmutableSet.of(FETCH_PRIMITIVE, STRING);

  // Static methods only
  private Primitives() {}

  /** Returns true if {@code name} is one of the primitive declarations. */
  static boolean declares(Name name) {
    return NAMES.contains(name);
  }

  /** Makes every primitive visible, unqualified, in the given scope. */
  static void addTo(ScopeContext scope) {
    NAMES.forEach(name -> scope.addGlobal(name, MODULE, REGION));
  }
}
