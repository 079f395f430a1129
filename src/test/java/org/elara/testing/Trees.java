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

package org.elara.testing;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.function.Function;
import org.elara.ast.Desugared;
import org.elara.ast.Desugared.Declaration;
import org.elara.ast.Desugared.Expr;
import org.elara.ast.Desugared.Import;
import org.elara.ast.Desugared.Pattern;
import org.elara.ast.Desugared.Type;
import org.elara.ast.Exposing;
import org.elara.ast.Exposition;
import org.elara.ast.Literal;
import org.elara.ast.Located;
import org.elara.ast.MaybeQualified;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeName;
import org.elara.ast.TypeVarName;
import org.elara.ast.VarName;

/**
 * Static helpers for building desugared trees in tests. Every node gets the region {@link #AT};
 * tests that care about regions construct them directly.
 *
 * <p>A name containing a dot (e.g. {@code "Data.List.map"}) is split into a module qualifier and
 * the last component.
 */
public final class Trees {

  public static final SourceRegion AT = new SourceRegion("test.elr", 0, 0);

  // Static methods only
  private Trees() {}

  public static <T> Located<T> at(T value) {
    return new Located<>(AT, value);
  }

  public static ModuleName moduleName(String name) {
    return ModuleName.of(name);
  }

  private static <N> MaybeQualified<N> maybeQualified(
      String dotted, Function<String, N> makeName) {
    int dot = dotted.lastIndexOf('.');
    if (dot <= 0 || dot == dotted.length() - 1) {
      return MaybeQualified.unqualified(makeName.apply(dotted));
    }
    return MaybeQualified.qualified(
        makeName.apply(dotted.substring(dot + 1)), ModuleName.of(dotted.substring(0, dot)));
  }

  // Modules and declarations

  public static Desugared.Module module(
      String name,
      Exposing<MaybeQualified<Name>> exposing,
      ImmutableList<Import> imports,
      Declaration... declarations) {
    ModuleName m = ModuleName.of(name);
    ImmutableList<Declaration> decls =
        Arrays.stream(declarations)
            .map(d -> new Declaration(d.region(), at(m), d.name(), d.body()))
            .collect(ImmutableList.toImmutableList());
    return new Desugared.Module(AT, at(m), exposing, imports, decls);
  }

  /** A module exposing everything and importing nothing. */
  public static Desugared.Module module(String name, Declaration... declarations) {
    return module(name, Exposing.all(), ImmutableList.of(), declarations);
  }

  /**
   * A value declaration. The declaration's module is filled in by {@link #module}; until then it
   * is a placeholder.
   */
  public static Declaration value(String name, Expr expression) {
    return value(name, expression, null);
  }

  public static Declaration value(String name, Expr expression, Type type) {
    return new Declaration(
        AT, at(PLACEHOLDER), at(varName(name)), new Desugared.Value(AT, expression, type));
  }

  public static Declaration nativeDef(String name, Type type) {
    return new Declaration(
        AT, at(PLACEHOLDER), at(varName(name)), new Desugared.NativeDef(AT, type));
  }

  /** {@code type name vars = c1 | c2 ...} */
  public static Declaration adt(
      String name, ImmutableList<String> vars, Desugared.ConstructorDecl... constructors) {
    return typeDecl(name, vars, new Desugared.Adt(AT, ImmutableList.copyOf(constructors)));
  }

  public static Declaration alias(String name, ImmutableList<String> vars, Type type) {
    return typeDecl(name, vars, new Desugared.Alias(AT, type));
  }

  private static Declaration typeDecl(
      String name, ImmutableList<String> vars, Desugared.TypeDefinition definition) {
    ImmutableList<Located<TypeVarName>> typeVars =
        vars.stream().map(v -> at(new TypeVarName(v))).collect(ImmutableList.toImmutableList());
    return new Declaration(
        AT,
        at(PLACEHOLDER),
        at(new TypeName(name)),
        new Desugared.TypeDeclaration(AT, typeVars, definition));
  }

  public static Desugared.ConstructorDecl constructor(String name, Type... fields) {
    return new Desugared.ConstructorDecl(at(new TypeName(name)), ImmutableList.copyOf(fields));
  }

  private static final ModuleName PLACEHOLDER = ModuleName.of("Placeholder");

  /** Returns {@code (+)} for an operator name, {@code VarName.normal} for anything else. */
  public static VarName varName(String text) {
    return Character.isLetter(text.charAt(0)) || text.charAt(0) == '_'
        ? VarName.normal(text)
        : VarName.operator(text);
  }

  // Exposing lists and imports

  @SafeVarargs
  public static Exposing<MaybeQualified<Name>> exposing(
      Exposition<MaybeQualified<Name>>... expositions) {
    return Exposing.some(ImmutableList.copyOf(expositions));
  }

  public static Exposition<MaybeQualified<Name>> exposeValue(String name) {
    VarName vn = varName(name);
    return new Exposition<>(
        vn.isOperator() ? Exposition.Kind.OPERATOR : Exposition.Kind.VALUE,
        at(maybeQualified(name, t -> (Name) varName(t))));
  }

  public static Exposition<MaybeQualified<Name>> exposeType(String name) {
    return new Exposition<>(
        Exposition.Kind.TYPE, at(maybeQualified(name, t -> (Name) new TypeName(t))));
  }

  /** {@code T(..)} */
  public static Exposition<MaybeQualified<Name>> exposeTypeAndConstructors(String name) {
    return new Exposition<>(
        Exposition.Kind.TYPE_AND_CONSTRUCTORS,
        at(maybeQualified(name, t -> (Name) new TypeName(t))));
  }

  public static Import importAll(String module) {
    return new Import(AT, at(ModuleName.of(module)), null, false, Exposing.all());
  }

  public static Import importExposing(String module, Exposing<MaybeQualified<Name>> exposing) {
    return new Import(AT, at(ModuleName.of(module)), null, false, exposing);
  }

  public static Import importQualified(String module) {
    return new Import(AT, at(ModuleName.of(module)), null, true, Exposing.all());
  }

  public static Import importAs(String module, String alias) {
    return new Import(
        AT, at(ModuleName.of(module)), at(ModuleName.of(alias)), false, Exposing.all());
  }

  // Expressions

  private static Expr expr(Desugared.ExprNode node) {
    return Expr.of(AT, node);
  }

  public static Expr intLit(long value) {
    return expr(new Desugared.LiteralExpr(Literal.IntLiteral.of(value)));
  }

  public static Expr string(String value) {
    return expr(new Desugared.LiteralExpr(new Literal.StringLiteral(value)));
  }

  public static Expr var(String name) {
    return expr(new Desugared.Var(at(maybeQualified(name, Trees::varName))));
  }

  public static Expr con(String name) {
    return expr(new Desugared.Constructor(at(maybeQualified(name, t -> new TypeName(t)))));
  }

  public static Expr lambda(Pattern pattern, Expr body) {
    return expr(new Desugared.Lambda(pattern, body));
  }

  /** {@code \x -> body} */
  public static Expr lambda(String arg, Expr body) {
    return lambda(pvar(arg), body);
  }

  /** {@code f a b ...}, applied one argument at a time. */
  public static Expr call(Expr function, Expr... args) {
    Expr result = function;
    for (Expr arg : args) {
      result = expr(new Desugared.FunctionCall(result, arg));
    }
    return result;
  }

  public static Expr ifExpr(Expr condition, Expr thenBranch, Expr elseBranch) {
    return expr(new Desugared.If(condition, thenBranch, elseBranch));
  }

  /** {@code left op right} for a symbolic operator. */
  public static Expr binOp(String op, Expr left, Expr right) {
    return expr(
        new Desugared.BinaryOp(
            new Desugared.SymOp(AT, maybeQualified(op, VarName::operator)), left, right));
  }

  /** {@code left `name` right}; an upper-case name is a constructor. */
  public static Expr infixed(String name, Expr left, Expr right) {
    MaybeQualified<Name> mq =
        maybeQualified(
            name,
            t -> Character.isUpperCase(t.charAt(0)) ? (Name) new TypeName(t) : VarName.normal(t));
    return expr(new Desugared.BinaryOp(new Desugared.Infixed(AT, mq), left, right));
  }

  public static Expr list(Expr... elements) {
    return expr(new Desugared.ListExpr(ImmutableList.copyOf(elements)));
  }

  public static Expr tuple(Expr... elements) {
    return expr(new Desugared.Tuple(ImmutableList.copyOf(elements)));
  }

  public static Expr match(Expr scrutinee, Desugared.MatchCase... cases) {
    return expr(new Desugared.Match(scrutinee, ImmutableList.copyOf(cases)));
  }

  public static Desugared.MatchCase matchCase(Pattern pattern, Expr body) {
    return new Desugared.MatchCase(pattern, body);
  }

  public static Expr letIn(String name, Expr value, Expr body) {
    return expr(new Desugared.LetIn(at(varName(name)), value, body));
  }

  /** {@code let name = value}, for use in a block. */
  public static Expr let(String name, Expr value) {
    return expr(new Desugared.Let(at(varName(name)), value));
  }

  public static Expr block(Expr... elements) {
    return expr(new Desugared.Block(ImmutableList.copyOf(elements)));
  }

  public static Expr parens(Expr e) {
    return expr(new Desugared.InParens(e));
  }

  public static Expr typeApplication(Expr e, Type type) {
    return expr(new Desugared.TypeApplication(e, type));
  }

  /** {@code (e : type)} */
  public static Expr annotated(Expr e, Type type) {
    return new Expr(e.region(), e.node(), type);
  }

  // Patterns

  private static Pattern pattern(Desugared.PatternNode node) {
    return Pattern.of(AT, node);
  }

  public static Pattern pvar(String name) {
    return pattern(new Desugared.VarPattern(at(varName(name))));
  }

  public static Pattern pwild() {
    return pattern(new Desugared.WildcardPattern());
  }

  public static Pattern pint(long value) {
    return pattern(new Desugared.LiteralPattern(Literal.IntLiteral.of(value)));
  }

  public static Pattern pstring(String value) {
    return pattern(new Desugared.LiteralPattern(new Literal.StringLiteral(value)));
  }

  public static Pattern pcon(String name, Pattern... args) {
    return pattern(
        new Desugared.ConstructorPattern(
            at(maybeQualified(name, t -> new TypeName(t))), ImmutableList.copyOf(args)));
  }

  public static Pattern plist(Pattern... elements) {
    return pattern(new Desugared.ListPattern(ImmutableList.copyOf(elements)));
  }

  public static Pattern pcons(Pattern head, Pattern tail) {
    return pattern(new Desugared.ConsPattern(head, tail));
  }

  public static Pattern annotated(Pattern p, Type type) {
    return new Pattern(p.region(), p.node(), type);
  }

  // Types

  public static Type tvar(String name) {
    return new Desugared.TypeVar(AT, new TypeVarName(name));
  }

  public static Type tcon(String name) {
    return new Desugared.UserDefinedType(AT, maybeQualified(name, t -> new TypeName(t)));
  }

  /** {@code a -> b -> ...}, right-associated. */
  public static Type tfun(Type first, Type... rest) {
    if (rest.length == 0) {
      return first;
    }
    return new Desugared.FunctionType(
        AT, first, tfun(rest[0], Arrays.copyOfRange(rest, 1, rest.length)));
  }

  public static Type tapp(Type constructor, Type argument) {
    return new Desugared.TypeConstructorApplication(AT, constructor, argument);
  }

  public static Type tlist(Type element) {
    return new Desugared.ListType(AT, element);
  }

  public static Type tunit() {
    return new Desugared.UnitType(AT);
  }
}
