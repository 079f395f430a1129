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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.elara.ast.Qualified;
import org.elara.ast.Renamed;
import org.elara.ast.VarRef;

/**
 * Orders the renamed declarations of a module so that later stages can process them in one pass:
 * type declarations first, in source order, followed by value declarations with each one after
 * the declarations it refers to. Mutually recursive values stay together, in source order.
 */
final class DeclarationSorter {

  private final ImmutableList<Renamed.Declaration> values;

  /** Maps each value declaration's name to its index in {@link #values}. */
  private final Map<Qualified<?>, Integer> indexOf = new HashMap<>();

  // State for Tarjan's algorithm, indexed like values.
  private final int[] visitOrder;
  private final int[] lowLink;
  private final boolean[] onStack;
  private final Deque<Integer> stack = new ArrayDeque<>();
  private int nextVisit = 1;
  private final ImmutableList.Builder<Renamed.Declaration> result = ImmutableList.builder();

  private DeclarationSorter(ImmutableList<Renamed.Declaration> values) {
    this.values = values;
    for (int i = 0; i < values.size(); i++) {
      indexOf.put(values.get(i).name().value(), i);
    }
    visitOrder = new int[values.size()];
    lowLink = new int[values.size()];
    onStack = new boolean[values.size()];
  }

  static ImmutableList<Renamed.Declaration> sort(List<Renamed.Declaration> declarations) {
    ImmutableList.Builder<Renamed.Declaration> result = ImmutableList.builder();
    ImmutableList.Builder<Renamed.Declaration> values = ImmutableList.builder();
    for (Renamed.Declaration decl : declarations) {
      if (decl.body() instanceof Renamed.TypeDeclaration) {
        result.add(decl);
      } else {
        values.add(decl);
      }
    }
    return result.addAll(new DeclarationSorter(values.build()).sortValues()).build();
  }

  private ImmutableList<Renamed.Declaration> sortValues() {
    for (int i = 0; i < values.size(); i++) {
      if (visitOrder[i] == 0) {
        visit(i);
      }
    }
    return result.build();
  }

  /** A declaration being visited, with the references still to be followed. */
  private record Frame(int index, Iterator<Integer> references) {}

  /**
   * Tarjan's strongly connected components algorithm, with an explicit stack so that long
   * dependency chains do not exhaust the thread's stack. Each component is emitted as soon as it
   * is complete, which is after every component it refers to.
   */
  private void visit(int root) {
    Deque<Frame> work = new ArrayDeque<>();
    work.push(enter(root));
    while (!work.isEmpty()) {
      Frame frame = work.peek();
      int i = frame.index();
      if (frame.references().hasNext()) {
        int j = frame.references().next();
        if (visitOrder[j] == 0) {
          work.push(enter(j));
        } else if (onStack[j]) {
          lowLink[i] = Math.min(lowLink[i], visitOrder[j]);
        }
        continue;
      }
      work.pop();
      if (lowLink[i] == visitOrder[i]) {
        emitComponent(i);
      }
      Frame caller = work.peek();
      if (caller != null) {
        lowLink[caller.index()] = Math.min(lowLink[caller.index()], lowLink[i]);
      }
    }
  }

  private Frame enter(int i) {
    visitOrder[i] = nextVisit++;
    lowLink[i] = visitOrder[i];
    stack.push(i);
    onStack[i] = true;
    return new Frame(i, references(i).iterator());
  }

  /** Pops the component whose root is {@code i} and emits it in source order. */
  private void emitComponent(int i) {
    List<Integer> component = new ArrayList<>();
    int j;
    do {
      j = stack.pop();
      onStack[j] = false;
      component.add(j);
    } while (j != i);
    component.sort(Comparator.naturalOrder());
    component.forEach(k -> result.add(values.get(k)));
  }

  /** Returns the indices of the value declarations that declaration {@code i} refers to. */
  private Set<Integer> references(int i) {
    Set<Qualified<?>> names = new LinkedHashSet<>();
    Renamed.Value value = (Renamed.Value) values.get(i).body();
    addGlobalReferences(value.expression(), names);
    Set<Integer> refs = new LinkedHashSet<>();
    for (Qualified<?> name : names) {
      Integer j = indexOf.get(name);
      if (j != null) {
        refs.add(j);
      }
    }
    return refs;
  }

  /** Adds the name of each declaration that {@code expr} refers to. */
  static void addGlobalReferences(Renamed.Expr expr, Set<Qualified<?>> names) {
    Renamed.ExprNode node = expr.node();
    if (node instanceof Renamed.Var var) {
      addRef(var.ref().value(), names);
    } else if (node instanceof Renamed.Lambda lambda) {
      addGlobalReferences(lambda.body(), names);
    } else if (node instanceof Renamed.FunctionCall call) {
      addGlobalReferences(call.function(), names);
      addGlobalReferences(call.argument(), names);
    } else if (node instanceof Renamed.TypeApplication app) {
      addGlobalReferences(app.expr(), names);
    } else if (node instanceof Renamed.If ifExpr) {
      addGlobalReferences(ifExpr.condition(), names);
      addGlobalReferences(ifExpr.thenBranch(), names);
      addGlobalReferences(ifExpr.elseBranch(), names);
    } else if (node instanceof Renamed.BinaryOp binOp) {
      if (binOp.operator() instanceof Renamed.SymOp symOp) {
        addRef(symOp.ref(), names);
      } else {
        addRef(((Renamed.Infixed) binOp.operator()).ref(), names);
      }
      addGlobalReferences(binOp.left(), names);
      addGlobalReferences(binOp.right(), names);
    } else if (node instanceof Renamed.ListExpr list) {
      list.elements().forEach(e -> addGlobalReferences(e, names));
    } else if (node instanceof Renamed.Match match) {
      addGlobalReferences(match.scrutinee(), names);
      match.cases().forEach(c -> addGlobalReferences(c.body(), names));
    } else if (node instanceof Renamed.LetIn letIn) {
      addGlobalReferences(letIn.value(), names);
      addGlobalReferences(letIn.body(), names);
    } else if (node instanceof Renamed.Block block) {
      block.elements().forEach(e -> addGlobalReferences(e, names));
    } else if (node instanceof Renamed.InParens inParens) {
      addGlobalReferences(inParens.expr(), names);
    } else if (node instanceof Renamed.Tuple tuple) {
      tuple.elements().forEach(e -> addGlobalReferences(e, names));
    }
    // Literals and constructors refer to no values
  }

  private static void addRef(VarRef<?> ref, Set<Qualified<?>> names) {
    if (ref instanceof VarRef.Global<?> global) {
      names.add(global.qualified().value());
    }
  }
}
