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

import static com.google.common.truth.Truth.assertThat;
import static org.elara.testing.Trees.AT;
import static org.elara.testing.Trees.at;
import static org.elara.testing.Trees.pint;
import static org.elara.testing.Trees.pvar;
import static org.elara.testing.Trees.tcon;
import static org.elara.testing.Trees.tfun;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.elara.ast.Desugared;
import org.elara.ast.Exposing;
import org.elara.ast.Frontend;
import org.elara.ast.Literal;
import org.elara.ast.MaybeQualified;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeName;
import org.elara.ast.VarName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DesugarerTest {

  private static final ModuleName MAIN = ModuleName.of("Main");

  private static Frontend.Module module(Frontend.Declaration... declarations) {
    return new Frontend.Module(
        AT, at(MAIN), Exposing.all(), ImmutableList.of(), ImmutableList.copyOf(declarations));
  }

  private static Frontend.Declaration declaration(Name name, Frontend.DeclarationBody body) {
    return new Frontend.Declaration(body.region(), at(MAIN), at(name), body);
  }

  private static Frontend.Declaration let(
      String name, Frontend.Expr value, Desugared.Pattern... parameters) {
    return declaration(
        VarName.normal(name), new Frontend.Value(AT, value, ImmutableList.copyOf(parameters)));
  }

  private static Frontend.Declaration def(String name, Desugared.Type type) {
    return declaration(VarName.normal(name), new Frontend.ValueTypeDef(AT, type));
  }

  private static Frontend.Declaration type(String name) {
    return declaration(
        new TypeName(name),
        new Frontend.TypeDeclaration(
            AT, ImmutableList.of(), new Desugared.Alias(AT, tcon("String"))));
  }

  private static Frontend.Expr expr(Frontend.ExprNode node) {
    return Frontend.Expr.of(AT, node);
  }

  private static Frontend.Expr intLit(long value) {
    return expr(new Frontend.LiteralExpr(Literal.IntLiteral.of(value)));
  }

  private static Frontend.Expr var(String name) {
    return expr(new Frontend.Var(at(MaybeQualified.unqualified(VarName.normal(name)))));
  }

  private static Desugared.Expr desugarValue(Frontend.Declaration decl) {
    Desugared.Module m = Desugarer.desugar(module(decl));
    return ((Desugared.Value) m.declarations().get(0).body()).expression();
  }

  /** Casts to a lambda, checking that it is one. */
  private static Desugared.Lambda asLambda(Desugared.Expr e) {
    assertThat(e.node()).isInstanceOf(Desugared.Lambda.class);
    return (Desugared.Lambda) e.node();
  }

  @Test
  public void multiArgumentLambdaIsCurried() {
    Frontend.Expr lambda =
        expr(new Frontend.Lambda(ImmutableList.of(pvar("a"), pvar("b")), var("a")));
    Desugared.Lambda outer = asLambda(desugarValue(let("f", lambda)));
    assertThat(outer.pattern()).isEqualTo(pvar("a"));
    Desugared.Lambda inner = asLambda(outer.body());
    assertThat(inner.pattern()).isEqualTo(pvar("b"));
    assertThat(inner.body().node()).isInstanceOf(Desugared.Var.class);
  }

  @Test
  public void lambdaNeedsAPattern() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Frontend.Lambda(ImmutableList.of(), var("a")));
  }

  @Test
  public void declarationParametersBecomeLambdas() {
    Desugared.Lambda outer = asLambda(desugarValue(let("f", var("y"), pvar("x"), pint(0))));
    assertThat(outer.pattern()).isEqualTo(pvar("x"));
    Desugared.Lambda inner = asLambda(outer.body());
    assertThat(inner.pattern()).isEqualTo(pint(0));
    assertThat(inner.body().node())
        .isEqualTo(new Desugared.Var(at(MaybeQualified.unqualified(VarName.normal("y")))));
  }

  @Test
  public void curriedLambdaRegionsRunFromParameterToBody() {
    SourceRegion p1 = new SourceRegion("f.elr", 4, 5);
    SourceRegion p2 = new SourceRegion("f.elr", 6, 7);
    SourceRegion body = new SourceRegion("f.elr", 10, 15);
    Frontend.Expr value =
        new Frontend.Expr(body, new Frontend.LiteralExpr(Literal.IntLiteral.of(1)), null);
    Desugared.Expr e =
        desugarValue(
            let(
                "f",
                value,
                Desugared.Pattern.of(p1, new Desugared.WildcardPattern()),
                Desugared.Pattern.of(p2, new Desugared.WildcardPattern())));
    assertThat(e.region()).isEqualTo(new SourceRegion("f.elr", 4, 15));
    assertThat(asLambda(e).body().region()).isEqualTo(new SourceRegion("f.elr", 6, 15));
  }

  @Test
  public void letInParametersBecomeLambdas() {
    Frontend.Expr letIn =
        expr(
            new Frontend.LetIn(
                at(VarName.normal("g")), ImmutableList.of(pvar("x")), var("x"), var("g")));
    Desugared.LetIn result = (Desugared.LetIn) desugarValue(let("f", letIn)).node();
    assertThat(result.name().value()).isEqualTo(VarName.normal("g"));
    assertThat(asLambda(result.value()).pattern()).isEqualTo(pvar("x"));
  }

  @Test
  public void blockLetParametersBecomeLambdas() {
    Frontend.Expr block =
        expr(
            new Frontend.Block(
                ImmutableList.of(
                    expr(
                        new Frontend.Let(
                            at(VarName.normal("g")), ImmutableList.of(pvar("x")), var("x"))),
                    var("g"))));
    Desugared.Block result = (Desugared.Block) desugarValue(let("f", block)).node();
    assertThat(result.elements()).hasSize(2);
    Desugared.Let g = (Desugared.Let) result.elements().get(0).node();
    assertThat(asLambda(g.value()).pattern()).isEqualTo(pvar("x"));
  }

  @Test
  public void emptyBlockFails() {
    Frontend.Expr block = expr(new Frontend.Block(ImmutableList.of()));
    DesugarError.EmptyBlock e =
        assertThrows(DesugarError.EmptyBlock.class, () -> desugarValue(let("f", block)));
    assertThat(e.region).isEqualTo(AT);
  }

  @Test
  public void matchCasesAreKept() {
    Frontend.Expr match =
        expr(
            new Frontend.Match(
                var("x"),
                ImmutableList.of(
                    new Frontend.Case(pint(1), intLit(2)),
                    new Frontend.Case(pvar("y"), var("y")))));
    Desugared.Match result = (Desugared.Match) desugarValue(let("f", match)).node();
    assertThat(result.cases()).hasSize(2);
    assertThat(result.cases().get(1).pattern()).isEqualTo(pvar("y"));
  }

  @Test
  public void signatureIsMergedIntoValue() {
    Desugared.Type stringToString = tfun(tcon("String"), tcon("String"));
    for (boolean defFirst : new boolean[] {true, false}) {
      Frontend.Declaration def = def("f", stringToString);
      Frontend.Declaration let = let("f", var("x"), pvar("x"));
      Desugared.Module m = Desugarer.desugar(defFirst ? module(def, let) : module(let, def));
      assertThat(m.declarations()).hasSize(1);
      Desugared.Value value = (Desugared.Value) m.declarations().get(0).body();
      assertThat(value.valueType()).isEqualTo(stringToString);
      assertThat(value.expression().node()).isInstanceOf(Desugared.Lambda.class);
    }
  }

  @Test
  public void declarationsKeepOrderOfFirstAppearance() {
    Desugared.Module m =
        Desugarer.desugar(
            module(
                def("b", tcon("String")),
                let("a", intLit(1)),
                type("T"),
                let("b", intLit(2))));
    assertThat(
            m.declarations().stream()
                .map(d -> d.name().value().text())
                .collect(ImmutableList.toImmutableList()))
        .containsExactly("b", "a", "T")
        .inOrder();
  }

  @Test
  public void typeAndValueMayShareSpelling() {
    Desugared.Module m = Desugarer.desugar(module(type("Foo"), let("foo", intLit(1))));
    assertThat(m.declarations()).hasSize(2);
  }

  @Test
  public void duplicateValueFails() {
    DesugarError.DuplicateDeclaration e =
        assertThrows(
            DesugarError.DuplicateDeclaration.class,
            () -> Desugarer.desugar(module(let("f", intLit(1)), let("f", intLit(2)))));
    assertThat(e.name.value()).isEqualTo(VarName.normal("f"));
    assertThat(e.module).isEqualTo(MAIN);
  }

  @Test
  public void duplicateSignatureFails() {
    assertThrows(
        DesugarError.DuplicateDeclaration.class,
        () ->
            Desugarer.desugar(
                module(def("f", tcon("String")), def("f", tcon("String")), let("f", intLit(1)))));
  }

  @Test
  public void duplicateTypeFails() {
    assertThrows(
        DesugarError.DuplicateDeclaration.class,
        () -> Desugarer.desugar(module(type("T"), type("T"))));
  }

  @Test
  public void signatureWithoutValueFails() {
    DesugarError.MissingDeclarationBody e =
        assertThrows(
            DesugarError.MissingDeclarationBody.class,
            () -> Desugarer.desugar(module(def("f", tcon("String")))));
    assertThat(e.name).isEqualTo(at((Name) VarName.normal("f")));
  }

  @Test
  public void nativeDefIsPassedThrough() {
    Frontend.Declaration nativeDef =
        declaration(VarName.normal("println"), new Frontend.NativeDef(AT, tcon("String")));
    Desugared.Module m = Desugarer.desugar(module(nativeDef));
    assertThat(m.declarations().get(0).body()).isInstanceOf(Desugared.NativeDef.class);
  }

  @Test
  public void annotationsAreKept() {
    Frontend.Expr annotated = new Frontend.Expr(AT, var("x").node(), tcon("String"));
    Desugared.Lambda lambda = asLambda(desugarValue(let("f", annotated, pvar("x"))));
    assertThat(lambda.body().annotation()).isEqualTo(tcon("String"));
  }
}
