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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class AstPrinterTest {

  private static final SourceRegion AT = SourceRegion.GENERATED;
  private static final ModuleName LIST = ModuleName.of("Data.List");

  private static Renamed.Type userType(String name) {
    return new Renamed.UserDefinedType(AT, new Qualified<>(new TypeName(name), LIST));
  }

  private static Renamed.Type typeVar(String name, int id) {
    return new Renamed.TypeVar(AT, new Unique<>(id, new TypeVarName(name)));
  }

  private static Renamed.Type fn(Renamed.Type from, Renamed.Type to) {
    return new Renamed.FunctionType(AT, from, to);
  }

  private static Renamed.Type app(Renamed.Type constructor, Renamed.Type argument) {
    return new Renamed.TypeConstructorApplication(AT, constructor, argument);
  }

  private static Object[] types() {
    Renamed.Type a = typeVar("a", 1);
    Renamed.Type b = typeVar("b", 2);
    return new Object[] {
      new Object[] {fn(a, b), "a#1 -> b#2"},
      new Object[] {fn(fn(a, b), a), "(a#1 -> b#2) -> a#1"},
      new Object[] {fn(a, fn(b, a)), "a#1 -> b#2 -> a#1"},
      new Object[] {app(userType("List"), a), "Data.List.List a#1"},
      new Object[] {
        app(userType("List"), app(userType("Maybe"), a)), "Data.List.List (Data.List.Maybe a#1)"
      },
      new Object[] {new Renamed.UnitType(AT), "()"},
      new Object[] {new Renamed.ListType(AT, a), "[a#1]"},
      new Object[] {new Renamed.TupleType(AT, ImmutableList.of(a, b)), "(a#1, b#2)"},
      new Object[] {
        new Renamed.RecordType(
            AT,
            ImmutableList.of(
                new Renamed.RecordField(Located.generated(VarName.normal("x")), a),
                new Renamed.RecordField(Located.generated(VarName.normal("y")), b))),
        "{ x : a#1, y : b#2 }"
      },
    };
  }

  @Test
  @Parameters(method = "types")
  public void printType(Renamed.Type type, String expected) {
    assertThat(AstPrinter.print(type)).isEqualTo(expected);
  }

  @Test
  public void refText() {
    VarRef<VarName> local =
        new VarRef.Local<>(Located.generated(new Unique<>(7, VarName.normal("x"))));
    VarRef<VarName> global =
        new VarRef.Global<>(Located.generated(new Qualified<>(VarName.operator("++"), LIST)));
    assertThat(AstPrinter.refText(local)).isEqualTo("x#7");
    assertThat(AstPrinter.refText(global)).isEqualTo("Data.List.++");
  }

  @Test
  public void printModule() {
    ModuleName main = ModuleName.of("Main");
    Renamed.Expr one = Renamed.Expr.of(AT, new Renamed.LiteralExpr(Literal.IntLiteral.of(1)));
    Renamed.Declaration decl =
        new Renamed.Declaration(
            AT,
            Located.generated(main),
            Located.generated(new Qualified<>(VarName.normal("one"), main)),
            new Renamed.Value(AT, one, userType("Int")));
    Renamed.Import imp =
        new Renamed.Import(
            AT,
            Located.generated(LIST),
            Located.generated(ModuleName.of("L")),
            true,
            Exposing.all());
    Renamed.Module module =
        new Renamed.Module(
            AT,
            Located.generated(main),
            Exposing.some(
                ImmutableList.of(
                    new Exposition<>(
                        Exposition.Kind.VALUE,
                        Located.generated(new Qualified<Name>(VarName.normal("one"), main))))),
            ImmutableList.of(imp),
            ImmutableList.of(decl));
    assertThat(AstPrinter.print(module))
        .isEqualTo(
            "module Main exposing (Main.one)\n"
                + "import qualified Data.List as L\n"
                + "def one : Data.List.Int\n"
                + "let one = 1");
  }
}
