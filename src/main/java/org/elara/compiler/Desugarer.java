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
import com.google.common.collect.Lists;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.elara.ast.Desugared;
import org.elara.ast.Frontend;
import org.elara.ast.ModuleName;
import org.elara.ast.Name;
import org.elara.ast.SourceRegion;
import org.jspecify.annotations.Nullable;

/**
 * Turns a parsed {@link Frontend.Module} into a {@link Desugared.Module}:
 *
 * <ul>
 *   <li>{@code \a b -> e} becomes {@code \a -> \b -> e};
 *   <li>{@code let f a b = e}, at top level or in an expression, becomes {@code let f = \a -> \b ->
 *       e}; and
 *   <li>each {@code def f : t} is merged into the {@code let f} it describes.
 * </ul>
 *
 * Desugaring looks at one module at a time and resolves no names.
 */
public final class Desugarer {
  private final ModuleName moduleName;

  private Desugarer(ModuleName moduleName) {
    this.moduleName = moduleName;
  }

  /**
   * Desugars a module.
   *
   * @throws DesugarError if the module declares a name twice, has a {@code def} without a
   *     matching {@code let}, or contains an empty block
   */
  public static Desugared.Module desugar(Frontend.Module module) {
    return new Desugarer(module.name().value()).desugarModule(module);
  }

  private Desugared.Module desugarModule(Frontend.Module module) {
    // Declarations are merged by name, keeping the position of the first one seen.
    Map<Name, PartialDeclaration> byName = new LinkedHashMap<>();
    for (Frontend.Declaration decl : module.declarations()) {
      Name name = decl.name().value();
      PartialDeclaration prev = byName.get(name);
      if (prev == null) {
        byName.put(name, new PartialDeclaration(decl));
      } else {
        prev.merge(decl);
      }
    }
    ImmutableList<Desugared.Declaration> declarations =
        byName.values().stream()
            .map(PartialDeclaration::complete)
            .collect(ImmutableList.toImmutableList());
    return new Desugared.Module(
        module.region(), module.name(), module.exposing(), module.imports(), declarations);
  }

  /** The pieces of a declaration seen so far. */
  private class PartialDeclaration {
    final Frontend.Declaration first;
    SourceRegion region;
    Frontend.@Nullable Value value;
    Frontend.@Nullable ValueTypeDef typeDef;

    /** A type declaration or native def, which can't be combined with anything. */
    Frontend.@Nullable DeclarationBody other;

    PartialDeclaration(Frontend.Declaration decl) {
      this.first = decl;
      this.region = decl.region();
      add(decl);
    }

    void merge(Frontend.Declaration decl) {
      if (other != null) {
        throw duplicate(decl);
      }
      add(decl);
      region = span(region, decl.region());
    }

    private void add(Frontend.Declaration decl) {
      Frontend.DeclarationBody body = decl.body();
      if (body instanceof Frontend.Value v) {
        if (value != null) {
          throw duplicate(decl);
        }
        value = v;
      } else if (body instanceof Frontend.ValueTypeDef t) {
        if (typeDef != null) {
          throw duplicate(decl);
        }
        typeDef = t;
      } else if (value != null || typeDef != null) {
        throw duplicate(decl);
      } else {
        other = body;
      }
    }

    private DesugarError duplicate(Frontend.Declaration decl) {
      return new DesugarError.DuplicateDeclaration(decl.name(), moduleName);
    }

    Desugared.Declaration complete() {
      Desugared.DeclarationBody body;
      if (value != null) {
        Desugared.Expr expression = curry(value.parameters(), desugarExpr(value.expression()));
        Desugared.Type type = (typeDef == null) ? null : typeDef.type();
        body = new Desugared.Value(value.region(), expression, type);
      } else if (typeDef != null) {
        throw new DesugarError.MissingDeclarationBody(first.name());
      } else if (other instanceof Frontend.NativeDef nativeDef) {
        body = new Desugared.NativeDef(nativeDef.region(), nativeDef.type());
      } else {
        Frontend.TypeDeclaration typeDecl = (Frontend.TypeDeclaration) other;
        body =
            new Desugared.TypeDeclaration(
                typeDecl.region(), typeDecl.vars(), typeDecl.definition());
      }
      return new Desugared.Declaration(region, first.moduleName(), first.name(), body);
    }
  }

  private Desugared.Expr desugarExpr(Frontend.Expr expr) {
    return new Desugared.Expr(expr.region(), desugarExprNode(expr), expr.annotation());
  }

  private Desugared.ExprNode desugarExprNode(Frontend.Expr expr) {
    Frontend.ExprNode node = expr.node();
    if (node instanceof Frontend.LiteralExpr literal) {
      return new Desugared.LiteralExpr(literal.literal());
    } else if (node instanceof Frontend.Var var) {
      return new Desugared.Var(var.name());
    } else if (node instanceof Frontend.Constructor constructor) {
      return new Desugared.Constructor(constructor.name());
    } else if (node instanceof Frontend.Lambda lambda) {
      // The outermost lambda keeps the region and annotation of the original.
      Desugared.Expr body = desugarExpr(lambda.body());
      List<Desugared.Pattern> patterns = lambda.patterns();
      Desugared.Expr inner = curry(patterns.subList(1, patterns.size()), body);
      return new Desugared.Lambda(patterns.get(0), inner);
    } else if (node instanceof Frontend.FunctionCall call) {
      return new Desugared.FunctionCall(desugarExpr(call.function()), desugarExpr(call.argument()));
    } else if (node instanceof Frontend.TypeApplication app) {
      return new Desugared.TypeApplication(desugarExpr(app.expr()), app.type());
    } else if (node instanceof Frontend.If ifExpr) {
      return new Desugared.If(
          desugarExpr(ifExpr.condition()),
          desugarExpr(ifExpr.thenBranch()),
          desugarExpr(ifExpr.elseBranch()));
    } else if (node instanceof Frontend.BinaryOp binOp) {
      return new Desugared.BinaryOp(
          binOp.operator(), desugarExpr(binOp.left()), desugarExpr(binOp.right()));
    } else if (node instanceof Frontend.ListExpr list) {
      return new Desugared.ListExpr(map(list.elements(), this::desugarExpr));
    } else if (node instanceof Frontend.Match match) {
      return new Desugared.Match(
          desugarExpr(match.scrutinee()),
          map(match.cases(), c -> new Desugared.MatchCase(c.pattern(), desugarExpr(c.body()))));
    } else if (node instanceof Frontend.LetIn letIn) {
      Desugared.Expr value = desugarExpr(letIn.value());
      return new Desugared.LetIn(
          letIn.name(),
          curry(letIn.parameters(), value),
          desugarExpr(letIn.body()));
    } else if (node instanceof Frontend.Let let) {
      Desugared.Expr value = desugarExpr(let.value());
      return new Desugared.Let(let.name(), curry(let.parameters(), value));
    } else if (node instanceof Frontend.Block block) {
      if (block.elements().isEmpty()) {
        throw new DesugarError.EmptyBlock(expr.region());
      }
      return new Desugared.Block(map(block.elements(), this::desugarExpr));
    } else if (node instanceof Frontend.InParens inParens) {
      return new Desugared.InParens(desugarExpr(inParens.expr()));
    } else if (node instanceof Frontend.Tuple tuple) {
      return new Desugared.Tuple(map(tuple.elements(), this::desugarExpr));
    }
    throw new AssertionError(node);
  }

  /**
   * Wraps {@code body} in one single-pattern lambda per parameter, so that {@code [a, b]} and
   * {@code e} give {@code \a -> \b -> e}. Returns {@code body} if there are no parameters.
   * Each lambda's region runs from its parameter to the end of the body.
   */
  private static Desugared.Expr curry(List<Desugared.Pattern> parameters, Desugared.Expr body) {
    Desugared.Expr result = body;
    for (Desugared.Pattern p : Lists.reverse(parameters)) {
      SourceRegion region = span(p.region(), body.region());
      result = Desugared.Expr.of(region, new Desugared.Lambda(p, result));
    }
    return result;
  }

  /** Returns the region covering both arguments, or {@code last} if they are in different files. */
  private static SourceRegion span(SourceRegion first, SourceRegion last) {
    return Objects.equals(first.sourceFile(), last.sourceFile())
        ? SourceRegion.spanning(ImmutableList.of(first, last))
        : last;
  }

  private static <T, R> ImmutableList<R> map(List<T> list, Function<? super T, R> fn) {
    return list.stream().map(fn).collect(ImmutableList.toImmutableList());
  }
}
