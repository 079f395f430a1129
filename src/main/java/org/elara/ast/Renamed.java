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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The Renamed class is just a namespace for the tree produced by the renamer.
 *
 * <p>The shapes follow {@link Desugared}, except that
 *
 * <ul>
 *   <li>every reference is a {@link VarRef} or {@link Qualified} name that is known to resolve;
 *   <li>every local binder (lambda argument, let name, pattern variable, type variable) is a
 *       {@link Unique};
 *   <li>every lambda binds a single variable, pattern lambdas having become {@code match}es; and
 *   <li>{@code let} blocks have become {@link LetIn} chains.
 * </ul>
 */
public final class Renamed {

  // Just a namespace for the contained types.
  private Renamed() {}

  public record Module(
      SourceRegion region,
      Located<ModuleName> name,
      Exposing<Qualified<Name>> exposing,
      ImmutableList<Import> imports,
      ImmutableList<Declaration> declarations) {}

  public record Import(
      SourceRegion region,
      Located<ModuleName> importing,
      @Nullable Located<ModuleName> as,
      boolean qualified,
      Exposing<Qualified<Name>> exposing) {}

  public record Declaration(
      SourceRegion region,
      Located<ModuleName> moduleName,
      Located<Qualified<Name>> name,
      DeclarationBody body) {}

  public sealed interface DeclarationBody {
    SourceRegion region();
  }

  public record Value(SourceRegion region, Expr expression, @Nullable Type valueType)
      implements DeclarationBody {}

  public record TypeDeclaration(
      SourceRegion region,
      ImmutableList<Located<Unique<TypeVarName>>> vars,
      TypeDefinition definition)
      implements DeclarationBody {}

  public sealed interface TypeDefinition {
    SourceRegion region();
  }

  public record Adt(SourceRegion region, ImmutableList<ConstructorDecl> constructors)
      implements TypeDefinition {}

  public record Alias(SourceRegion region, Type type) implements TypeDefinition {}

  public record ConstructorDecl(Located<Qualified<TypeName>> name, ImmutableList<Type> fields) {}

  public record Expr(SourceRegion region, ExprNode node, @Nullable Type annotation) {
    public static Expr of(SourceRegion region, ExprNode node) {
      return new Expr(region, node, null);
    }
  }

  public sealed interface ExprNode {}

  public record LiteralExpr(Literal literal) implements ExprNode {}

  public record Var(Located<VarRef<VarName>> ref) implements ExprNode {}

  public record Constructor(Located<Qualified<TypeName>> name) implements ExprNode {}

  /** A lambda binding exactly one variable. */
  public record Lambda(Located<Unique<VarName>> argument, Expr body) implements ExprNode {}

  public record FunctionCall(Expr function, Expr argument) implements ExprNode {}

  public record TypeApplication(Expr expr, Type type) implements ExprNode {}

  public record If(Expr condition, Expr thenBranch, Expr elseBranch) implements ExprNode {}

  public record BinaryOp(BinaryOperator operator, Expr left, Expr right) implements ExprNode {}

  public record ListExpr(ImmutableList<Expr> elements) implements ExprNode {}

  public record Match(Expr scrutinee, ImmutableList<MatchCase> cases) implements ExprNode {}

  public record MatchCase(Pattern pattern, Expr body) {}

  public record LetIn(Located<Unique<VarName>> name, Expr value, Expr body) implements ExprNode {}

  /** A sequence of expressions none of which binds names for the others. */
  public record Block(ImmutableList<Expr> elements) implements ExprNode {}

  public record InParens(Expr expr) implements ExprNode {}

  public record Tuple(ImmutableList<Expr> elements) implements ExprNode {}

  public sealed interface BinaryOperator {
    SourceRegion region();
  }

  public record SymOp(SourceRegion region, VarRef<VarName> ref) implements BinaryOperator {}

  /**
   * A function or constructor used infix. Resolves exactly like the equivalent prefix reference;
   * the distinction only matters when printing.
   */
  public record Infixed(SourceRegion region, VarRef<? extends Name> ref)
      implements BinaryOperator {}

  public record Pattern(SourceRegion region, PatternNode node, @Nullable Type annotation) {
    public static Pattern of(SourceRegion region, PatternNode node) {
      return new Pattern(region, node, null);
    }
  }

  public sealed interface PatternNode {}

  public record VarPattern(Located<Unique<VarName>> name) implements PatternNode {}

  public record ConstructorPattern(
      Located<Qualified<TypeName>> constructor, ImmutableList<Pattern> arguments)
      implements PatternNode {}

  public record ListPattern(ImmutableList<Pattern> elements) implements PatternNode {}

  public record ConsPattern(Pattern head, Pattern tail) implements PatternNode {}

  public record WildcardPattern() implements PatternNode {}

  public record LiteralPattern(Literal literal) implements PatternNode {}

  public sealed interface Type {
    SourceRegion region();
  }

  public record TypeVar(SourceRegion region, Unique<TypeVarName> name) implements Type {}

  public record FunctionType(SourceRegion region, Type from, Type to) implements Type {}

  public record UnitType(SourceRegion region) implements Type {}

  public record TypeConstructorApplication(SourceRegion region, Type constructor, Type argument)
      implements Type {}

  public record UserDefinedType(SourceRegion region, Qualified<TypeName> name) implements Type {}

  public record RecordType(SourceRegion region, ImmutableList<RecordField> fields)
      implements Type {}

  public record RecordField(Located<VarName> name, Type type) {}

  public record TupleType(SourceRegion region, ImmutableList<Type> elements) implements Type {}

  public record ListType(SourceRegion region, Type element) implements Type {}
}
