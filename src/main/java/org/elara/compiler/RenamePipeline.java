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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountedCompleter;
import java.util.concurrent.atomic.AtomicBoolean;
import org.elara.ast.Desugared;
import org.elara.ast.Frontend;
import org.elara.ast.ModuleName;
import org.elara.ast.Renamed;
import org.elara.ast.UniqueGen;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the desugarer and renamer over all the modules of a program.
 *
 * <p>Each module is renamed independently against the same {@link ModuleGraph}, so they may be
 * renamed in any order; by default they are renamed one at a time in topological order. A module
 * that fails contributes its error to the {@link Result} instead of a renamed module.
 */
public final class RenamePipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(RenamePipeline.class);

  private final RenameOptions options;
  private final UniqueGen uniqueGen;

  public RenamePipeline(RenameOptions options) {
    this(options, new UniqueGen());
  }

  public RenamePipeline(RenameOptions options, UniqueGen uniqueGen) {
    this.options = options;
    this.uniqueGen = uniqueGen;
  }

  /**
   * The outcome of running the pipeline: the modules that were renamed successfully (in
   * topological order) and the errors that stopped the others.
   */
  public record Result(
      ImmutableMap<ModuleName, Renamed.Module> modules, ImmutableList<CompileError> errors) {

    public boolean succeeded() {
      return errors.isEmpty();
    }
  }

  /** Desugars the given modules and then renames them; see {@link #renameAll}. */
  public Result run(List<Frontend.Module> modules) {
    List<CompileError> errors = new ArrayList<>();
    List<Desugared.Module> desugared = new ArrayList<>();
    for (Frontend.Module module : modules) {
      try {
        desugared.add(Desugarer.desugar(module));
      } catch (DesugarError e) {
        LOGGER.warn("Failed to desugar module {}: {}", module.name().value(), e.getMessage());
        errors.add(e);
        if (options.stopOnFirstError) {
          return new Result(ImmutableMap.of(), ImmutableList.copyOf(errors));
        }
      }
    }
    ModuleGraph graph;
    try {
      graph = ModuleGraph.of(desugared);
    } catch (CompileError e) {
      LOGGER.warn("{}", e.getMessage());
      errors.add(e);
      return new Result(ImmutableMap.of(), ImmutableList.copyOf(errors));
    }
    Result renamed = renameAll(graph);
    if (errors.isEmpty()) {
      return renamed;
    }
    errors.addAll(renamed.errors());
    return new Result(renamed.modules(), ImmutableList.copyOf(errors));
  }

  /** Renames every module in the graph. */
  public Result renameAll(ModuleGraph graph) {
    ImmutableList<Desugared.Module> order = graph.topologicalOrder();
    LOGGER.debug("Renaming {} modules with {}", order.size(), options);
    Map<ModuleName, Renamed.Module> renamed = new ConcurrentHashMap<>();
    List<CompileError> errors = Collections.synchronizedList(new ArrayList<>());
    AtomicBoolean failed = new AtomicBoolean();
    if (options.parallel) {
      CountedCompleter<Void> baseTask =
          new CountedCompleter<Void>() {
            @Override
            public void compute() {
              // Just waits for all its children to complete.
              tryComplete();
            }
          };
      for (Desugared.Module module : order) {
        baseTask.addToPendingCount(1);
        new CountedCompleter<Void>(baseTask) {
          @Override
          public void compute() {
            renameOne(graph, module, renamed, errors, failed);
            tryComplete();
          }
        }.fork();
      }
      baseTask.invoke();
    } else {
      for (Desugared.Module module : order) {
        renameOne(graph, module, renamed, errors, failed);
      }
    }
    // Report modules in topological order regardless of the order they finished in.
    ImmutableMap.Builder<ModuleName, Renamed.Module> result = ImmutableMap.builder();
    for (Desugared.Module module : order) {
      Renamed.Module r = renamed.get(module.name().value());
      if (r != null) {
        result.put(module.name().value(), r);
      }
    }
    return new Result(result.buildOrThrow(), ImmutableList.copyOf(errors));
  }

  private void renameOne(
      ModuleGraph graph,
      Desugared.Module module,
      Map<ModuleName, Renamed.Module> renamed,
      List<CompileError> errors,
      AtomicBoolean failed) {
    ModuleName name = module.name().value();
    if (options.stopOnFirstError && failed.get()) {
      LOGGER.debug("Skipping module {} after an earlier failure", name);
      return;
    }
    LOGGER.debug("Renaming module {}", name);
    try {
      renamed.put(name, Renamer.rename(module, graph, uniqueGen));
      LOGGER.debug("Renamed module {}", name);
    } catch (RenameError e) {
      LOGGER.warn("Failed to rename module {}: {}", name, e.getMessage());
      failed.set(true);
      errors.add(e);
    }
  }
}
