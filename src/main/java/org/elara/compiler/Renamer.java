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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.elara.ast.Desugared;
import org.elara.ast.Exposing;
import org.elara.ast.Exposition;
import org.elara.ast.Literal;
import org.elara.ast.Located;
import org.elara.ast.MaybeQualified;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.Qualified;
import org.elara.ast.Renamed;
import org.elara.ast.SourceRegion;
import org.elara.ast.TypeName;
import org.elara.ast.TypeVarName;
import org.elara.ast.Unique;
import org.elara.ast.UniqueGen;
import org.elara.ast.VarName;
import org.elara.ast.VarRef;
import org.jspecify.annotations.Nullable;

/**
 * Turns a {@link Desugared.Module} into a {@link Renamed.Module}: every reference is resolved to
 * the binder or declaration it names, every local binder gets a fresh {@link Unique}, and the
 * remaining sugar is removed along the way:
 *
 * <ul>
 *   <li>a lambda whose argument is not a plain variable, e.g. {@code \[] -> 1}, becomes {@code \x
 *       -> match x with [] -> 1}; and
 *   <li>{@code let}s in a block become a {@code let ... in} chain over the rest of the block, e.g.
 *       {@code let y = 1; y + 1} becomes {@code let y = 1 in y + 1}.
 * </ul>
 *
 * A Renamer is used for a single module and stops at the first {@link RenameError}.
 */
public final class Renamer {
  private final Desugared.Module module;
  private final UniqueGen uniqueGen;
  private final ScopeContext scope;

  /** The declaration whose body is being renamed; used for locating BlockEndsWithLet errors. */
  private Desugared.@Nullable Declaration currentDeclaration;

  private Renamer(Desugared.Module module, ModuleGraph graph, UniqueGen uniqueGen) {
    this.module = module;
    this.uniqueGen = uniqueGen;
    this.scope = new ScopeContext(graph, new ModuleExports(module));
  }

  /**
   * Renames a module.
   *
   * @param graph the modules that {@code module} may import or refer to by qualified name
   * @param uniqueGen the source of Uniques for local binders; should be shared by all modules of a
   *     compilation
   * @throws RenameError if any name cannot be resolved or any construct cannot be desugared
   */
  public static Renamed.Module rename(
      Desugared.Module module, ModuleGraph graph, UniqueGen uniqueGen) {
    return new Renamer(module, graph, uniqueGen).renameModule();
  }

  private Renamed.Module renameModule() {
    // Step one: make visible everything that can be referred to without qualification, in
    // increasing order of precedence.  All declarations are added before any are renamed so that
    // forward and mutually recursive references resolve.
    Primitives.addTo(scope);
    module.imports().forEach(scope::addImport);
    module.declarations().forEach(scope::addDeclaration);
    // Step two: rename everything.
    ModuleName name = module.name().value();
    Exposing<Qualified<Name>> exposing = renameExposing(name, module.exposing());
    ImmutableList<Renamed.Import> imports = map(module.imports(), this::renameImport);
    ImmutableList<Renamed.Declaration> declarations =
        map(module.declarations(), this::renameDeclaration);
    return new Renamed.Module(
        module.region(), module.name(), exposing, imports, DeclarationSorter.sort(declarations));
  }

  private static Exposing<Qualified<Name>> renameExposing(
      ModuleName owner, Exposing<MaybeQualified<Name>> exposing) {
    if (exposing instanceof Exposing.Some<MaybeQualified<Name>> some) {
      return Exposing.some(
          map(some.expositions(), e -> e.withName(ScopeContext.qualifyIn(owner, e.name()))));
    }
    return Exposing.all();
  }

  private Renamed.Import renameImport(Desugared.Import imp) {
    return new Renamed.Import(
        imp.region(),
        imp.importing(),
        imp.as(),
        imp.qualified(),
        renameExposing(imp.importing().value(), imp.exposing()));
  }

  private Renamed.Declaration renameDeclaration(Desugared.Declaration decl) {
    Desugared.Declaration prev = currentDeclaration;
    currentDeclaration = decl;
    try {
      ModuleName owner = decl.moduleName().value();
      Located<Qualified<Name>> name = decl.name().map(n -> new Qualified<>(n, owner));
      return new Renamed.Declaration(decl.region(), decl.moduleName(), name, renameBody(decl));
    } finally {
      currentDeclaration = prev;
    }
  }

  private Renamed.DeclarationBody renameBody(Desugared.Declaration decl) {
    Desugared.DeclarationBody body = decl.body();
    if (body instanceof Desugared.Value value) {
      // Type variables introduced by the annotation are visible in the expression, and nowhere
      // else.
      return scope.scoped(
          () -> {
            Renamed.Type type = renameTypeOrNull(value.valueType(), true);
            return new Renamed.Value(value.region(), renameExpr(value.expression()), type);
          });
    } else if (body instanceof Desugared.TypeDeclaration typeDecl) {
      return scope.scoped(() -> renameTypeDeclaration(decl.moduleName().value(), typeDecl));
    } else if (body instanceof Desugared.NativeDef) {
      throw new RenameError.NativeDefUnsupported(decl);
    }
    throw new AssertionError(body);
  }

  private Renamed.TypeDeclaration renameTypeDeclaration(
      ModuleName owner, Desugared.TypeDeclaration typeDecl) {
    ImmutableList<Located<Unique<TypeVarName>>> vars =
        map(
            typeDecl.vars(),
            v -> {
              Located<Unique<TypeVarName>> unique = uniqueGen.makeUnique(v);
              scope.bindTypeVar(v.value(), unique.value());
              return unique;
            });
    Renamed.TypeDefinition definition;
    if (typeDecl.definition() instanceof Desugared.Adt adt) {
      definition =
          new Renamed.Adt(
              adt.region(),
              map(
                  adt.constructors(),
                  c ->
                      new Renamed.ConstructorDecl(
                          c.name().map(n -> new Qualified<>(n, owner)),
                          map(c.fields(), t -> renameType(t, false)))));
    } else {
      Desugared.Alias alias = (Desugared.Alias) typeDecl.definition();
      definition = new Renamed.Alias(alias.region(), renameType(alias.type(), false));
    }
    return new Renamed.TypeDeclaration(typeDecl.region(), vars, definition);
  }

  private Renamed.@Nullable Type renameTypeOrNull(
      Desugared.@Nullable Type type, boolean allowNewVars) {
    return (type == null) ? null : renameType(type, allowNewVars);
  }

  /**
   * Resolves the type constructors and type variables in a type.
   *
   * @param allowNewVars if true, a type variable that is not in scope is given a new Unique and
   *     added to the scope (as in {@code def id : a -> a}); if false it is an error (as in {@code
   *     type Invalid a = b})
   */
  private Renamed.Type renameType(Desugared.Type type, boolean allowNewVars) {
    SourceRegion region = type.region();
    if (type instanceof Desugared.TypeVar typeVar) {
      Unique<TypeVarName> unique = scope.lookupTypeVar(typeVar.name());
      if (unique == null) {
        if (!allowNewVars) {
          throw new RenameError.UnknownTypeVariable(new Located<>(region, typeVar.name()));
        }
        unique = uniqueGen.makeUnique(typeVar.name());
        scope.bindTypeVar(typeVar.name(), unique);
      }
      return new Renamed.TypeVar(region, unique);
    } else if (type instanceof Desugared.FunctionType fn) {
      return new Renamed.FunctionType(
          region, renameType(fn.from(), allowNewVars), renameType(fn.to(), allowNewVars));
    } else if (type instanceof Desugared.UnitType) {
      return new Renamed.UnitType(region);
    } else if (type instanceof Desugared.TypeConstructorApplication app) {
      return new Renamed.TypeConstructorApplication(
          region,
          renameType(app.constructor(), allowNewVars),
          renameType(app.argument(), allowNewVars));
    } else if (type instanceof Desugared.UserDefinedType userDefined) {
      return new Renamed.UserDefinedType(
          region, scope.lookupTypeName(new Located<>(region, userDefined.name())));
    } else if (type instanceof Desugared.RecordType record) {
      return new Renamed.RecordType(
          region,
          map(
              record.fields(),
              f -> new Renamed.RecordField(f.name(), renameType(f.type(), allowNewVars))));
    } else if (type instanceof Desugared.TupleType tuple) {
      return new Renamed.TupleType(region, map(tuple.elements(), t -> renameType(t, allowNewVars)));
    } else if (type instanceof Desugared.ListType list) {
      return new Renamed.ListType(region, renameType(list.element(), allowNewVars));
    }
    throw new AssertionError(type);
  }

  private Renamed.Expr renameExpr(Desugared.Expr expr) {
    Desugared.ExprNode node = expr.node();
    if (node instanceof Desugared.Block block) {
      return withAnnotation(
          desugarBlock(block.elements()), renameTypeOrNull(expr.annotation(), false));
    } else if (node instanceof Desugared.Let) {
      // A let outside any block is a block that ends with a let.
      return desugarBlock(ImmutableList.of(expr));
    }
    Renamed.ExprNode renamed = renameExprNode(expr);
    return new Renamed.Expr(expr.region(), renamed, renameTypeOrNull(expr.annotation(), false));
  }

  private Renamed.ExprNode renameExprNode(Desugared.Expr expr) {
    Desugared.ExprNode node = expr.node();
    if (node instanceof Desugared.LiteralExpr literal) {
      return new Renamed.LiteralExpr(literal.literal());
    } else if (node instanceof Desugared.Var var) {
      return new Renamed.Var(var.name().withValue(scope.lookupVarName(var.name())));
    } else if (node instanceof Desugared.Constructor constructor) {
      return new Renamed.Constructor(
          constructor.name().withValue(scope.lookupTypeName(constructor.name())));
    } else if (node instanceof Desugared.Lambda lambda) {
      return renameLambda(lambda.pattern(), lambda.body());
    } else if (node instanceof Desugared.FunctionCall call) {
      Renamed.Expr function = renameExpr(call.function());
      return new Renamed.FunctionCall(function, renameExpr(call.argument()));
    } else if (node instanceof Desugared.TypeApplication app) {
      Renamed.Expr e = renameExpr(app.expr());
      return new Renamed.TypeApplication(e, renameType(app.type(), false));
    } else if (node instanceof Desugared.If ifExpr) {
      Renamed.Expr condition = renameExpr(ifExpr.condition());
      Renamed.Expr thenBranch = renameExpr(ifExpr.thenBranch());
      return new Renamed.If(condition, thenBranch, renameExpr(ifExpr.elseBranch()));
    } else if (node instanceof Desugared.BinaryOp binOp) {
      Renamed.BinaryOperator op = renameOperator(binOp.operator());
      Renamed.Expr left = renameExpr(binOp.left());
      return new Renamed.BinaryOp(op, left, renameExpr(binOp.right()));
    } else if (node instanceof Desugared.ListExpr list) {
      return new Renamed.ListExpr(map(list.elements(), this::renameExpr));
    } else if (node instanceof Desugared.Match match) {
      Renamed.Expr scrutinee = renameExpr(match.scrutinee());
      return new Renamed.Match(
          scrutinee, map(match.cases(), c -> renameCase(c.pattern(), c.body())));
    } else if (node instanceof Desugared.LetIn letIn) {
      Located<Unique<VarName>> name = uniqueGen.makeUnique(letIn.name());
      // The name is bound while renaming the value too, so that local functions can recurse.
      return scope.scoped(
          () -> {
            scope.bindLocal(letIn.name().value(), name);
            Renamed.Expr value = renameExpr(letIn.value());
            return new Renamed.LetIn(name, value, renameExpr(letIn.body()));
          });
    } else if (node instanceof Desugared.Tuple tuple) {
      return new Renamed.Tuple(map(tuple.elements(), this::renameExpr));
    } else if (node instanceof Desugared.InParens inParens) {
      return new Renamed.InParens(renameExpr(inParens.expr()));
    }
    // Block and Let are handled by renameExpr
    throw new AssertionError(node);
  }

  private Renamed.BinaryOperator renameOperator(Desugared.BinaryOperator op) {
    SourceRegion region = op.region();
    if (op instanceof Desugared.SymOp symOp) {
      return new Renamed.SymOp(region, scope.lookupVarName(new Located<>(region, symOp.name())));
    }
    MaybeQualified<Name> name = ((Desugared.Infixed) op).name();
    VarRef<? extends Name> ref;
    if (name.name() instanceof VarName varName) {
      ref = scope.lookupVarName(
          new Located<>(region, new MaybeQualified<>(varName, name.module())));
    } else {
      TypeName typeName = (TypeName) name.name();
      Qualified<TypeName> constructor =
          scope.lookupTypeName(
              new Located<>(region, new MaybeQualified<>(typeName, name.module())));
      ref = new VarRef.Global<>(new Located<>(region, constructor));
    }
    return new Renamed.Infixed(region, ref);
  }

  /**
   * Renames one arm of a match. The variables bound by the pattern are visible in the body, and
   * not in any other arm.
   */
  private Renamed.MatchCase renameCase(Desugared.Pattern pattern, Desugared.Expr body) {
    return scope.scoped(
        () -> {
          Renamed.Pattern p = renamePattern(pattern);
          return new Renamed.MatchCase(p, renameExpr(body));
        });
  }

  /**
   * Renames a lambda. {@code \x -> e} keeps its shape; any other argument pattern is matched
   * against a fresh variable, so {@code \(a, b) -> a} becomes {@code \tuple -> match tuple with
   * (a, b) -> a}.
   */
  private Renamed.Lambda renameLambda(Desugared.Pattern pattern, Desugared.Expr body) {
    if (pattern.node() instanceof Desugared.VarPattern varPattern && pattern.annotation() == null) {
      Located<Unique<VarName>> arg = uniqueGen.makeUnique(varPattern.name());
      Renamed.Expr renamedBody =
          scope.scoped(
              () -> {
                scope.bindLocal(varPattern.name().value(), arg);
                return renameExpr(body);
              });
      return new Renamed.Lambda(arg, renamedBody);
    }
    Located<Unique<VarName>> arg =
        uniqueGen.makeUnique(new Located<>(pattern.region(), patternToVarName(pattern)));
    Renamed.Expr scrutinee =
        Renamed.Expr.of(arg.region(), new Renamed.Var(arg.withValue(new VarRef.Local<>(arg))));
    Renamed.MatchCase matchCase = renameCase(pattern, body);
    Renamed.Expr match =
        Renamed.Expr.of(
            span(pattern.region(), body.region()),
            new Renamed.Match(scrutinee, ImmutableList.of(matchCase)));
    return new Renamed.Lambda(arg, match);
  }

  /**
   * Chooses a name for the variable that a pattern lambda's argument is bound to. The name is
   * uniquified like any other, so this only makes dumps easier to read.
   */
  private static VarName patternToVarName(Desugared.Pattern pattern) {
    Desugared.PatternNode node = pattern.node();
    String name;
    if (node instanceof Desugared.VarPattern var) {
      return var.name().value();
    } else if (node instanceof Desugared.WildcardPattern) {
      name = "wildcard";
    } else if (node instanceof Desugared.ListPattern) {
      name = "list";
    } else if (node instanceof Desugared.ConsPattern) {
      name = "cons";
    } else if (node instanceof Desugared.ConstructorPattern) {
      name = "constructor";
    } else {
      Literal literal = ((Desugared.LiteralPattern) node).literal();
      if (literal instanceof Literal.IntLiteral) {
        name = "int";
      } else if (literal instanceof Literal.FloatLiteral) {
        name = "float";
      } else if (literal instanceof Literal.StringLiteral) {
        name = "string";
      } else if (literal instanceof Literal.CharLiteral) {
        name = "char";
      } else {
        name = "unit";
      }
    }
    return VarName.normal(name);
  }

  /**
   * Renames the elements of a block. Each {@code let} scopes over the rest of the block and
   * becomes a {@code let ... in} whose body is the rest of the block; other elements are renamed
   * independently. A block with only one element (after this) is replaced by that element.
   */
  private Renamed.Expr desugarBlock(List<Desugared.Expr> elements) {
    List<Renamed.Expr> renamed = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) {
      Desugared.Expr element = elements.get(i);
      if (!(element.node() instanceof Desugared.Let let)) {
        renamed.add(renameExpr(element));
        continue;
      }
      if (i == elements.size() - 1) {
        throw new RenameError.BlockEndsWithLet(element, currentDeclaration);
      }
      renamed.add(renameLet(element, let, elements.subList(i + 1, elements.size())));
      break;
    }
    if (renamed.size() == 1) {
      return renamed.get(0);
    }
    SourceRegion region =
        span(elements.get(0).region(), elements.get(elements.size() - 1).region());
    return Renamed.Expr.of(region, new Renamed.Block(ImmutableList.copyOf(renamed)));
  }

  /** Renames {@code let x = value} followed by {@code rest} as {@code let x = value in rest}. */
  private Renamed.Expr renameLet(
      Desugared.Expr letExpr, Desugared.Let let, List<Desugared.Expr> rest) {
    Renamed.Expr value = renameExpr(let.value());
    Renamed.Type annotation = renameTypeOrNull(letExpr.annotation(), false);
    Located<Unique<VarName>> name = uniqueGen.makeUnique(let.name());
    Renamed.Expr body =
        scope.scoped(
            () -> {
              scope.bindLocal(let.name().value(), name);
              return desugarBlock(rest);
            });
    return new Renamed.Expr(letExpr.region(), new Renamed.LetIn(name, value, body), annotation);
  }

  private Renamed.Pattern renamePattern(Desugared.Pattern pattern) {
    Desugared.PatternNode node = pattern.node();
    Renamed.PatternNode renamed;
    if (node instanceof Desugared.VarPattern var) {
      Located<Unique<VarName>> unique = uniqueGen.makeUnique(var.name());
      // Visible to the rest of the pattern and to the arm's body.
      scope.bindLocal(var.name().value(), unique);
      renamed = new Renamed.VarPattern(unique);
    } else if (node instanceof Desugared.ConstructorPattern constructor) {
      Qualified<TypeName> name = scope.lookupTypeName(constructor.constructor());
      renamed =
          new Renamed.ConstructorPattern(
              constructor.constructor().withValue(name),
              map(constructor.arguments(), this::renamePattern));
    } else if (node instanceof Desugared.ListPattern list) {
      renamed = new Renamed.ListPattern(map(list.elements(), this::renamePattern));
    } else if (node instanceof Desugared.ConsPattern cons) {
      Renamed.Pattern head = renamePattern(cons.head());
      renamed = new Renamed.ConsPattern(head, renamePattern(cons.tail()));
    } else if (node instanceof Desugared.WildcardPattern) {
      renamed = new Renamed.WildcardPattern();
    } else {
      renamed = new Renamed.LiteralPattern(((Desugared.LiteralPattern) node).literal());
    }
    return new Renamed.Pattern(
        pattern.region(), renamed, renameTypeOrNull(pattern.annotation(), false));
  }

  private static Renamed.Expr withAnnotation(Renamed.Expr expr, Renamed.@Nullable Type type) {
    return (type == null) ? expr : new Renamed.Expr(expr.region(), expr.node(), type);
  }

  /**
   * Returns the region from the start of {@code first} to the end of {@code last}, or {@code last}
   * if they are in different files (which happens only for generated trees).
   */
  private static SourceRegion span(SourceRegion first, SourceRegion last) {
    return Objects.equals(first.sourceFile(), last.sourceFile())
        ? SourceRegion.spanning(ImmutableList.of(first, last))
        : last;
  }

  /** Applies {@code fn} to each element in order, collecting the results. */
  private static <T, R> ImmutableList<R> map(List<T> list, Function<? super T, R> fn) {
    ImmutableList.Builder<R> result = ImmutableList.builderWithExpectedSize(list.size());
    for (T t : list) {
      result.add(fn.apply(t));
    }
    return result.build();
  }
}
