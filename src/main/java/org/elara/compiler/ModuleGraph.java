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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.stream.Collectors;
import org.elara.ast.Desugared;
import org.elara.ast.ModuleName;
import org.jspecify.annotations.Nullable;

/**
 * The desugared modules of a program, keyed by name, with the import edges between them.
 *
 * <p>A ModuleGraph is immutable, so any number of modules may be renamed against it concurrently.
 * Imports of modules that are not in the graph are kept out of the edges; renaming the importing
 * module reports them.
 */
public final class ModuleGraph {

  /** Modules in the order they were given, keyed by name. */
  private final ImmutableMap<ModuleName, Desugared.Module> modules;

  private final ImmutableMap<ModuleName, ModuleExports> exports;

  /** Maps each module to the (in-graph) modules it imports. */
  private final ImmutableMap<ModuleName, ImmutableSet<ModuleName>> dependencies;

  /** Dependencies before dependents; computed eagerly so a cycle is reported on construction. */
  private final ImmutableList<Desugared.Module> topologicalOrder;

  private ModuleGraph(Iterable<Desugared.Module> modules) {
    Map<ModuleName, Desugared.Module> byName = new LinkedHashMap<>();
    for (Desugared.Module m : modules) {
      if (byName.putIfAbsent(m.name().value(), m) != null) {
        throw new CompileError("Duplicate module " + m.name().value(), m.region());
      }
    }
    this.modules = ImmutableMap.copyOf(byName);
    this.exports = ImmutableMap.copyOf(Maps.transformValues(byName, ModuleExports::new));
    this.dependencies =
        ImmutableMap.copyOf(
            Maps.transformValues(
                byName,
                m ->
                    m.imports().stream()
                        .map(i -> i.importing().value())
                        .filter(byName::containsKey)
                        .collect(ImmutableSet.toImmutableSet())));
    this.topologicalOrder = sort();
  }

  /**
   * Creates a graph of the given modules.
   *
   * @throws CompileError if two modules have the same name, or if the modules import each other
   *     cyclically
   */
  public static ModuleGraph of(Iterable<Desugared.Module> modules) {
    return new ModuleGraph(modules);
  }

  public static ModuleGraph of(Desugared.Module... modules) {
    return new ModuleGraph(ImmutableList.copyOf(modules));
  }

  /** Returns the module with the given name, or null if there is no such module. */
  public Desugared.@Nullable Module moduleFromName(ModuleName name) {
    return modules.get(name);
  }

  /** Returns the declared and exposed names of the given module, or null if it is not present. */
  @Nullable ModuleExports exportsOf(ModuleName name) {
    return exports.get(name);
  }

  /** Returns the modules that the given module imports, limited to those in this graph. */
  public ImmutableSet<ModuleName> dependencies(ModuleName name) {
    return dependencies.getOrDefault(name, ImmutableSet.of());
  }

  /** Every module exactly once, each after all the modules it imports. */
  public ImmutableList<Desugared.Module> topologicalOrder() {
    return topologicalOrder;
  }

  /** Every module exactly once, each before all the modules it imports. */
  public ImmutableList<Desugared.Module> reverseTopologicalOrder() {
    return topologicalOrder.reverse();
  }

  /** Kahn's algorithm; modules that become ready together keep their original order. */
  private ImmutableList<Desugared.Module> sort() {
    Map<ModuleName, Integer> inDegree = new HashMap<>();
    Map<ModuleName, List<ModuleName>> dependents = new HashMap<>();
    for (ModuleName name : modules.keySet()) {
      inDegree.put(name, dependencies.get(name).size());
      for (ModuleName dep : dependencies.get(name)) {
        dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(name);
      }
    }
    Queue<ModuleName> ready = new ArrayDeque<>();
    modules.keySet().stream().filter(n -> inDegree.get(n) == 0).forEach(ready::add);
    ImmutableList.Builder<Desugared.Module> result = ImmutableList.builder();
    int emitted = 0;
    while (!ready.isEmpty()) {
      ModuleName next = ready.remove();
      result.add(modules.get(next));
      emitted++;
      for (ModuleName dependent : dependents.getOrDefault(next, List.of())) {
        if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
          ready.add(dependent);
        }
      }
    }
    if (emitted != modules.size()) {
      List<ModuleName> cyclic =
          modules.keySet().stream().filter(n -> inDegree.get(n) > 0).collect(Collectors.toList());
      throw new CompileError(
          "Circular dependency detected between modules " + cyclic,
          modules.get(cyclic.get(0)).region());
    }
    return result.build();
  }
}
