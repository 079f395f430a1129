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

import java.util.List;
import java.util.function.Consumer;

/**
 * Renders renamed trees as compact, source-like text for dumps and tests. Local binders are shown
 * with their unique id ({@code x#3}) and globals with their module ({@code Data.List.map}), so two
 * occurrences print the same only if they refer to the same thing.
 *
 * <p>The output is not meant to be parsed back; in particular every match and block is printed on
 * one line.
 */
public final class AstPrinter {
  private final StringBuilder sb = new StringBuilder();

  private AstPrinter() {}

  public static String print(Renamed.Module module) {
    AstPrinter p = new AstPrinter();
    p.sb.append("module ").append(module.name().value());
    if (module.exposing() instanceof Exposing.Some<Qualified<Name>>) {
      p.sb.append(" exposing ").append(module.exposing());
    }
    for (Renamed.Import imp : module.imports()) {
      p.sb.append('\n');
      p.printImport(imp);
    }
    for (Renamed.Declaration decl : module.declarations()) {
      p.sb.append('\n');
      p.printDeclaration(decl);
    }
    return p.sb.toString();
  }

  public static String print(Renamed.Declaration decl) {
    AstPrinter p = new AstPrinter();
    p.printDeclaration(decl);
    return p.sb.toString();
  }

  public static String print(Renamed.Expr expr) {
    AstPrinter p = new AstPrinter();
    p.printExpr(expr);
    return p.sb.toString();
  }

  public static String print(Renamed.Pattern pattern) {
    AstPrinter p = new AstPrinter();
    p.printPattern(pattern);
    return p.sb.toString();
  }

  public static String print(Renamed.Type type) {
    AstPrinter p = new AstPrinter();
    p.printType(type);
    return p.sb.toString();
  }

  /** Returns {@code name#id} for a local reference and {@code Module.name} for a global one. */
  public static String refText(VarRef<? extends Name> ref) {
    if (ref instanceof VarRef.Local<? extends Name> local) {
      Unique<? extends Name> unique = local.unique().value();
      return unique.value().text() + "#" + unique.id();
    }
    Qualified<? extends Name> qualified = ((VarRef.Global<? extends Name>) ref).qualified().value();
    return qualified.module() + "." + qualified.name().text();
  }

  private void printImport(Renamed.Import imp) {
    sb.append("import ");
    if (imp.qualified()) {
      sb.append("qualified ");
    }
    sb.append(imp.importing().value());
    if (imp.as() != null) {
      sb.append(" as ").append(imp.as().value());
    }
    if (imp.exposing() instanceof Exposing.Some<Qualified<Name>>) {
      sb.append(" exposing ").append(imp.exposing());
    }
  }

  private void printDeclaration(Renamed.Declaration decl) {
    Renamed.DeclarationBody body = decl.body();
    Name name = decl.name().value().name();
    if (body instanceof Renamed.Value value) {
      if (value.valueType() != null) {
        sb.append("def ").append(name).append(" : ");
        printType(value.valueType());
        sb.append('\n');
      }
      sb.append("let ").append(name).append(" = ");
      printExpr(value.expression());
      return;
    }
    Renamed.TypeDeclaration typeDecl = (Renamed.TypeDeclaration) body;
    sb.append("type ").append(name);
    for (Located<Unique<TypeVarName>> v : typeDecl.vars()) {
      sb.append(' ').append(v.value());
    }
    sb.append(" = ");
    if (typeDecl.definition() instanceof Renamed.Alias alias) {
      printType(alias.type());
      return;
    }
    List<Renamed.ConstructorDecl> constructors =
        ((Renamed.Adt) typeDecl.definition()).constructors();
    for (int i = 0; i < constructors.size(); i++) {
      if (i != 0) {
        sb.append(" | ");
      }
      Renamed.ConstructorDecl c = constructors.get(i);
      sb.append(c.name().value().name());
      for (Renamed.Type field : c.fields()) {
        sb.append(' ');
        printTypeAtom(field);
      }
    }
  }

  private void printExpr(Renamed.Expr expr) {
    if (expr.annotation() == null) {
      printExprNode(expr.node());
    } else {
      sb.append('(');
      printExprNode(expr.node());
      sb.append(" : ");
      printType(expr.annotation());
      sb.append(')');
    }
  }

  private void printExprNode(Renamed.ExprNode node) {
    if (node instanceof Renamed.LiteralExpr literal) {
      sb.append(literal.literal());
    } else if (node instanceof Renamed.Var var) {
      sb.append(refText(var.ref().value()));
    } else if (node instanceof Renamed.Constructor constructor) {
      sb.append(constructor.name().value());
    } else if (node instanceof Renamed.Lambda lambda) {
      sb.append('\\').append(lambda.argument().value()).append(" -> ");
      printExpr(lambda.body());
    } else if (node instanceof Renamed.FunctionCall call) {
      if (call.function().node() instanceof Renamed.FunctionCall) {
        printExpr(call.function());
      } else {
        printExprAtom(call.function());
      }
      sb.append(' ');
      printExprAtom(call.argument());
    } else if (node instanceof Renamed.TypeApplication app) {
      printExprAtom(app.expr());
      sb.append(" @");
      printTypeAtom(app.type());
    } else if (node instanceof Renamed.If ifExpr) {
      sb.append("if ");
      printExpr(ifExpr.condition());
      sb.append(" then ");
      printExpr(ifExpr.thenBranch());
      sb.append(" else ");
      printExpr(ifExpr.elseBranch());
    } else if (node instanceof Renamed.BinaryOp binOp) {
      printExprAtom(binOp.left());
      if (binOp.operator() instanceof Renamed.SymOp symOp) {
        sb.append(' ').append(refText(symOp.ref())).append(' ');
      } else {
        sb.append(" `").append(refText(((Renamed.Infixed) binOp.operator()).ref())).append("` ");
      }
      printExprAtom(binOp.right());
    } else if (node instanceof Renamed.ListExpr list) {
      printSeparated("[", list.elements(), ", ", "]", this::printExpr);
    } else if (node instanceof Renamed.Match match) {
      sb.append("match ");
      printExpr(match.scrutinee());
      printSeparated(
          " with { ",
          match.cases(),
          "; ",
          " }",
          c -> {
            printPattern(c.pattern());
            sb.append(" -> ");
            printExpr(c.body());
          });
    } else if (node instanceof Renamed.LetIn letIn) {
      sb.append("let ").append(letIn.name().value()).append(" = ");
      printExpr(letIn.value());
      sb.append(" in ");
      printExpr(letIn.body());
    } else if (node instanceof Renamed.Block block) {
      printSeparated("{ ", block.elements(), "; ", " }", this::printExpr);
    } else if (node instanceof Renamed.InParens inParens) {
      sb.append('(');
      printExpr(inParens.expr());
      sb.append(')');
    } else if (node instanceof Renamed.Tuple tuple) {
      printSeparated("(", tuple.elements(), ", ", ")", this::printExpr);
    }
  }

  /** Prints an expression, parenthesized unless it is self-delimiting. */
  private void printExprAtom(Renamed.Expr expr) {
    Renamed.ExprNode node = expr.node();
    boolean atomic =
        expr.annotation() != null
            || node instanceof Renamed.LiteralExpr
            || node instanceof Renamed.Var
            || node instanceof Renamed.Constructor
            || node instanceof Renamed.ListExpr
            || node instanceof Renamed.Block
            || node instanceof Renamed.InParens
            || node instanceof Renamed.Tuple;
    if (atomic) {
      printExpr(expr);
    } else {
      sb.append('(');
      printExpr(expr);
      sb.append(')');
    }
  }

  private void printPattern(Renamed.Pattern pattern) {
    if (pattern.annotation() != null) {
      sb.append('(');
      printPatternNode(pattern.node());
      sb.append(" : ");
      printType(pattern.annotation());
      sb.append(')');
    } else {
      printPatternNode(pattern.node());
    }
  }

  private void printPatternNode(Renamed.PatternNode node) {
    if (node instanceof Renamed.VarPattern var) {
      sb.append(var.name().value());
    } else if (node instanceof Renamed.ConstructorPattern constructor) {
      sb.append(constructor.constructor().value());
      for (Renamed.Pattern arg : constructor.arguments()) {
        sb.append(' ');
        if (arg.node() instanceof Renamed.ConstructorPattern c && !c.arguments().isEmpty()
            || arg.node() instanceof Renamed.ConsPattern) {
          sb.append('(');
          printPattern(arg);
          sb.append(')');
        } else {
          printPattern(arg);
        }
      }
    } else if (node instanceof Renamed.ListPattern list) {
      printSeparated("[", list.elements(), ", ", "]", this::printPattern);
    } else if (node instanceof Renamed.ConsPattern cons) {
      printPattern(cons.head());
      sb.append(" :: ");
      printPattern(cons.tail());
    } else if (node instanceof Renamed.WildcardPattern) {
      sb.append('_');
    } else {
      sb.append(((Renamed.LiteralPattern) node).literal());
    }
  }

  private void printType(Renamed.Type type) {
    if (type instanceof Renamed.TypeVar typeVar) {
      sb.append(typeVar.name());
    } else if (type instanceof Renamed.FunctionType fn) {
      if (fn.from() instanceof Renamed.FunctionType) {
        sb.append('(');
        printType(fn.from());
        sb.append(')');
      } else {
        printType(fn.from());
      }
      sb.append(" -> ");
      printType(fn.to());
    } else if (type instanceof Renamed.UnitType) {
      sb.append("()");
    } else if (type instanceof Renamed.TypeConstructorApplication app) {
      printType(app.constructor());
      sb.append(' ');
      printTypeAtom(app.argument());
    } else if (type instanceof Renamed.UserDefinedType userDefined) {
      sb.append(userDefined.name());
    } else if (type instanceof Renamed.RecordType record) {
      printSeparated(
          "{ ",
          record.fields(),
          ", ",
          " }",
          f -> {
            sb.append(f.name().value()).append(" : ");
            printType(f.type());
          });
    } else if (type instanceof Renamed.TupleType tuple) {
      printSeparated("(", tuple.elements(), ", ", ")", this::printType);
    } else if (type instanceof Renamed.ListType list) {
      sb.append('[');
      printType(list.element());
      sb.append(']');
    }
  }

  private void printTypeAtom(Renamed.Type type) {
    if (type instanceof Renamed.FunctionType
        || type instanceof Renamed.TypeConstructorApplication) {
      sb.append('(');
      printType(type);
      sb.append(')');
    } else {
      printType(type);
    }
  }

  private <T> void printSeparated(
      String open, List<T> items, String separator, String close, Consumer<T> printer) {
    sb.append(open);
    for (int i = 0; i < items.size(); i++) {
      if (i != 0) {
        sb.append(separator);
      }
      printer.accept(items.get(i));
    }
    sb.append(close);
  }
}
