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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.elara.ast.Desugared.BinaryOperator;
import org.elara.ast.Desugared.Import;
import org.elara.ast.Desugared.Pattern;
import org.elara.ast.Desugared.Type;
import org.elara.ast.Desugared.TypeDefinition;
import org.jspecify.annotations.Nullable;

/**
 * The Frontend class is just a namespace for the tree produced by the parser.
 *
 * <p>Only the parts that desugaring changes are defined here: lambdas may take several patterns,
 * {@code let}s may take parameters, and a value's type may be given by a separate {@code def}
 * declaration. Patterns, types, operators and imports are shared with {@link Desugared}.
 */
public final class Frontend {

  // Just a namespace for the contained types.
  private Frontend() {}

  public record Module(
      SourceRegion region,
      Located<ModuleName> name,
      Exposing<MaybeQualified<Name>> exposing,
      ImmutableList<Import> imports,
      ImmutableList<Declaration> declarations) {}

  public record Declaration(
      SourceRegion region,
      Located<ModuleName> moduleName,
      Located<Name> name,
      DeclarationBody body) {}

  public sealed interface DeclarationBody {
    SourceRegion region();
  }

  /** {@code let f p1 p2 = e} */
  public record Value(SourceRegion region, Expr expression, ImmutableList<Pattern> parameters)
      implements DeclarationBody {}

  /** {@code def f : t} */
  public record ValueTypeDef(SourceRegion region, Type type) implements DeclarationBody {}

  public record NativeDef(SourceRegion region, Type type) implements DeclarationBody {}

  public record TypeDeclaration(
      SourceRegion region, ImmutableList<Located<TypeVarName>> vars, TypeDefinition definition)
      implements DeclarationBody {}

  public record Expr(SourceRegion region, ExprNode node, @Nullable Type annotation) {
    public static Expr of(SourceRegion region, ExprNode node) {
      return new Expr(region, node, null);
    }
  }

  public sealed interface ExprNode {}

  public record LiteralExpr(Literal literal) implements ExprNode {}

  public record Var(Located<MaybeQualified<VarName>> name) implements ExprNode {}

  public record Constructor(Located<MaybeQualified<TypeName>> name) implements ExprNode {}

  /** {@code \p1 p2 -> body}; there is at least one pattern. */
  public record Lambda(ImmutableList<Pattern> patterns, Expr body) implements ExprNode {
    public Lambda {
      checkArgument(!patterns.isEmpty(), "lambda with no patterns");
    }
  }

  public record FunctionCall(Expr function, Expr argument) implements ExprNode {}

  public record TypeApplication(Expr expr, Type type) implements ExprNode {}

  public record If(Expr condition, Expr thenBranch, Expr elseBranch) implements ExprNode {}

  public record BinaryOp(BinaryOperator operator, Expr left, Expr right) implements ExprNode {}

  public record ListExpr(ImmutableList<Expr> elements) implements ExprNode {}

  public record Match(Expr scrutinee, ImmutableList<Case> cases) implements ExprNode {}

  public record Case(Pattern pattern, Expr body) {}

  /** {@code let f p1 p2 = value in body} */
  public record LetIn(
      Located<VarName> name, ImmutableList<Pattern> parameters, Expr value, Expr body)
      implements ExprNode {}

  /** {@code let f p1 p2 = value} inside a block. */
  public record Let(Located<VarName> name, ImmutableList<Pattern> parameters, Expr value)
      implements ExprNode {}

  /** May be empty as parsed; desugaring rejects empty blocks. */
  public record Block(ImmutableList<Expr> elements) implements ExprNode {}

  public record InParens(Expr expr) implements ExprNode {}

  public record Tuple(ImmutableList<Expr> elements) implements ExprNode {}
}
