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

import static com.google.common.truth.Truth.assertThat;

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RenameOptionsTest {

  @After
  public void clearProperties() {
    System.clearProperty("elara.rename.parallel");
    System.clearProperty("elara.rename.stopOnFirstError");
  }

  @Test
  public void defaults() {
    assertThat(RenameOptions.DEFAULT.parallel).isFalse();
    assertThat(RenameOptions.DEFAULT.stopOnFirstError).isTrue();
    assertThat(RenameOptions.fromSystemProperties().toString())
        .isEqualTo(RenameOptions.DEFAULT.toString());
  }

  @Test
  public void readsSystemProperties() {
    System.setProperty("elara.rename.parallel", "true");
    System.setProperty("elara.rename.stopOnFirstError", "false");
    RenameOptions options = RenameOptions.fromSystemProperties();
    assertThat(options.parallel).isTrue();
    assertThat(options.stopOnFirstError).isFalse();
  }

  @Test
  public void toBuilderCopies() {
    RenameOptions options = RenameOptions.DEFAULT.toBuilder().setParallel(true).build();
    assertThat(options.parallel).isTrue();
    assertThat(options.stopOnFirstError).isTrue();
    assertThat(options.toString()).isEqualTo("RenameOptions{parallel=true, stopOnFirstError=true}");
  }
}
