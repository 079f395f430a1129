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

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Settings for a {@link RenamePipeline}. */
public final class RenameOptions {

  /** The options used when none are given: sequential, stopping at the first error. */
  public static final RenameOptions DEFAULT = builder().build();

  /** If true, modules are renamed concurrently on the common ForkJoinPool. */
  public final boolean parallel;

  /**
   * If true, no further modules are started after one fails; otherwise every module is renamed
   * and all of the errors are reported.
   */
  public final boolean stopOnFirstError;

  private RenameOptions(Builder builder) {
    this.parallel = builder.parallel;
    this.stopOnFirstError = builder.stopOnFirstError;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options read from the system properties {@code elara.rename.parallel} and {@code
   * elara.rename.stopOnFirstError}, using the defaults for any that are not set.
   */
  public static RenameOptions fromSystemProperties() {
    return builder()
        .setParallel(Boolean.parseBoolean(System.getProperty("elara.rename.parallel", "false")))
        .setStopOnFirstError(
            Boolean.parseBoolean(System.getProperty("elara.rename.stopOnFirstError", "true")))
        .build();
  }

  public Builder toBuilder() {
    return new Builder().setParallel(parallel).setStopOnFirstError(stopOnFirstError);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("parallel", parallel)
        .add("stopOnFirstError", stopOnFirstError)
        .toString();
  }

  public static final class Builder {
    private boolean parallel = false;
    private boolean stopOnFirstError = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setParallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStopOnFirstError(boolean stopOnFirstError) {
      this.stopOnFirstError = stopOnFirstError;
      return this;
    }

    public RenameOptions build() {
      return new RenameOptions(this);
    }
  }
}
