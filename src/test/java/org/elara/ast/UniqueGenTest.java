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

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class UniqueGenTest {

  @Test
  public void idsIncrease() {
    UniqueGen gen = new UniqueGen(10);
    Unique<String> a = gen.makeUnique("a");
    Unique<String> b = gen.makeUnique("a");
    assertThat(a.id()).isEqualTo(10);
    assertThat(b.id()).isEqualTo(11);
    assertThat(gen.peekNextId()).isEqualTo(12);
  }

  @Test
  public void equalityIsByIdOnly() {
    UniqueGen gen = new UniqueGen();
    Unique<String> x1 = gen.makeUnique("x");
    Unique<String> x2 = gen.makeUnique("x");
    assertThat(x1).isNotEqualTo(x2);
    assertThat(x1).isEqualTo(new Unique<>(x1.id(), "renamed"));
    assertThat(x1.hashCode()).isEqualTo(new Unique<>(x1.id(), "renamed").hashCode());
    assertThat(x1.toString()).isEqualTo("x#0");
  }

  @Test
  public void locatedUniqueKeepsRegion() {
    SourceRegion region = new SourceRegion("a.elr", 3, 4);
    Located<Unique<VarName>> u =
        new UniqueGen().makeUnique(new Located<>(region, VarName.normal("x")));
    assertThat(u.region()).isEqualTo(region);
    assertThat(u.value().value()).isEqualTo(VarName.normal("x"));
  }

  @Test
  public void concurrentUseGivesDistinctIds(@TestParameter({"1", "4", "16"}) int threads)
      throws Exception {
    UniqueGen gen = new UniqueGen();
    int perThread = 1000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<Integer>>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(
            executor.submit(
                () -> {
                  List<Integer> ids = new ArrayList<>();
                  for (int i = 0; i < perThread; i++) {
                    ids.add(gen.makeUnique("v").id());
                  }
                  return ids;
                }));
      }
      Set<Integer> all = new HashSet<>();
      for (Future<List<Integer>> f : futures) {
        all.addAll(f.get());
      }
      assertThat(all).hasSize(threads * perThread);
      assertThat(gen.peekNextId()).isEqualTo(threads * perThread);
    } finally {
      executor.shutdown();
    }
  }
}
