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
 * The Desugared class is just a namespace for the tree produced by desugaring and consumed by the
 * renamer.
 *
 * <p>Compared to the {@link Frontend} tree, every lambda takes exactly one pattern, {@code let}s no
 * longer have parameters, and each {@code def} signature has been merged into the declaration it
 * describes. Names are still the strings written in the source, optionally module-qualified.
 *
 * <p>Patterns, types, binary operators and imports are unchanged by desugaring; the {@link
 * Frontend} tree uses the definitions here.
 */
public final class Desugared {

  // Just a namespace for the contained types.
  private Desugared() {}

  public record Module(
      SourceRegion region,
      Located<ModuleName> name,
      Exposing<MaybeQualified<Name>> exposing,
      ImmutableList<Import> imports,
      ImmutableList<Declaration> declarations) {}

  /**
   * {@code import N}, {@code import N as A}, or {@code import qualified N}, optionally followed by
   * an exposing list that limits which of N's names are brought into scope unqualified.
   */
  public record Import(
      SourceRegion region,
      Located<ModuleName> importing,
      @Nullable Located<ModuleName> as,
      boolean qualified,
      Exposing<MaybeQualified<Name>> exposing) {}

  public record Declaration(
      SourceRegion region,
      Located<ModuleName> moduleName,
      Located<Name> name,
      DeclarationBody body) {}

  public sealed interface DeclarationBody {
    SourceRegion region();
  }

  /** {@code let x = e}, with the type from a matching {@code def x : t} if there was one. */
  public record Value(SourceRegion region, Expr expression, @Nullable Type valueType)
      implements DeclarationBody {}

  /** A declaration whose implementation is supplied by the runtime. */
  public record NativeDef(SourceRegion region, Type type) implements DeclarationBody {}

  /** {@code type T a b = ...} */
  public record TypeDeclaration(
      SourceRegion region, ImmutableList<Located<TypeVarName>> vars, TypeDefinition definition)
      implements DeclarationBody {}

  /** The right hand side of a type declaration. */
  public sealed interface TypeDefinition {
    SourceRegion region();
  }

  /** {@code type Maybe a = Just a | Nothing} */
  public record Adt(SourceRegion region, ImmutableList<ConstructorDecl> constructors)
      implements TypeDefinition {}

  /** {@code type Name = String} */
  public record Alias(SourceRegion region, Type type) implements TypeDefinition {}

  public record ConstructorDecl(Located<TypeName> name, ImmutableList<Type> fields) {}

  /** An expression with its source region and an optional type annotation, {@code (e : t)}. */
  public record Expr(SourceRegion region, ExprNode node, @Nullable Type annotation) {
    public static Expr of(SourceRegion region, ExprNode node) {
      return new Expr(region, node, null);
    }
  }

  public sealed interface ExprNode {}

  public record LiteralExpr(Literal literal) implements ExprNode {}

  public record Var(Located<MaybeQualified<VarName>> name) implements ExprNode {}

  /** A reference to a data constructor, e.g. {@code Just}. */
  public record Constructor(Located<MaybeQualified<TypeName>> name) implements ExprNode {}

  public record Lambda(Pattern pattern, Expr body) implements ExprNode {}

  public record FunctionCall(Expr function, Expr argument) implements ExprNode {}

  /** {@code e @t} */
  public record TypeApplication(Expr expr, Type type) implements ExprNode {}

  public record If(Expr condition, Expr thenBranch, Expr elseBranch) implements ExprNode {}

  public record BinaryOp(BinaryOperator operator, Expr left, Expr right) implements ExprNode {}

  public record ListExpr(ImmutableList<Expr> elements) implements ExprNode {}

  public record Match(Expr scrutinee, ImmutableList<MatchCase> cases) implements ExprNode {}

  public record MatchCase(Pattern pattern, Expr body) {}

  /** {@code let x = value in body} */
  public record LetIn(Located<VarName> name, Expr value, Expr body) implements ExprNode {}

  /** {@code let x = value} as an element of a block; scopes over the rest of the block. */
  public record Let(Located<VarName> name, Expr value) implements ExprNode {}

  /** A non-empty sequence of expressions, whose value is that of the last one. */
  public record Block(ImmutableList<Expr> elements) implements ExprNode {}

  /** Kept until operator shunting, which needs to know where the programmer wrote parentheses. */
  public record InParens(Expr expr) implements ExprNode {}

  public record Tuple(ImmutableList<Expr> elements) implements ExprNode {}

  public sealed interface BinaryOperator {
    SourceRegion region();
  }

  /** A symbolic operator such as {@code +}. */
  public record SymOp(SourceRegion region, MaybeQualified<VarName> name)
      implements BinaryOperator {}

  /** A function or constructor used infix with backquotes, e.g. {@code a `div` b}. */
  public record Infixed(SourceRegion region, MaybeQualified<Name> name) implements BinaryOperator {}

  /** A pattern with its source region and an optional type annotation. */
  public record Pattern(SourceRegion region, PatternNode node, @Nullable Type annotation) {
    public static Pattern of(SourceRegion region, PatternNode node) {
      return new Pattern(region, node, null);
    }
  }

  public sealed interface PatternNode {}

  public record VarPattern(Located<VarName> name) implements PatternNode {}

  public record ConstructorPattern(
      Located<MaybeQualified<TypeName>> constructor, ImmutableList<Pattern> arguments)
      implements PatternNode {}

  public record ListPattern(ImmutableList<Pattern> elements) implements PatternNode {}

  /** {@code head :: tail} */
  public record ConsPattern(Pattern head, Pattern tail) implements PatternNode {}

  public record WildcardPattern() implements PatternNode {}

  public record LiteralPattern(Literal literal) implements PatternNode {}

  public sealed interface Type {
    SourceRegion region();
  }

  public record TypeVar(SourceRegion region, TypeVarName name) implements Type {}

  public record FunctionType(SourceRegion region, Type from, Type to) implements Type {}

  public record UnitType(SourceRegion region) implements Type {}

  /** {@code List a} */
  public record TypeConstructorApplication(SourceRegion region, Type constructor, Type argument)
      implements Type {}

  public record UserDefinedType(SourceRegion region, MaybeQualified<TypeName> name)
      implements Type {}

  public record RecordType(SourceRegion region, ImmutableList<RecordField> fields)
      implements Type {}

  public record RecordField(Located<VarName> name, Type type) {}

  public record TupleType(SourceRegion region, ImmutableList<Type> elements) implements Type {}

  public record ListType(SourceRegion region, Type element) implements Type {}
}
