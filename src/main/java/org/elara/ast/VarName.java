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

/**
 * The name of a value: either an alphanumeric name starting with a lower-case letter ({@code map})
 * or an operator ({@code +}).
 */
public record VarName(String text, boolean isOperator) implements Name {

  public static VarName normal(String text) {
    return new VarName(text, false);
  }

  public static VarName operator(String text) {
    return new VarName(text, true);
  }

  @Override
  public String kind() {
    return isOperator ? "operator" : "variable";
  }

  @Override
  public String toString() {
    return isOperator ? "(" + text + ")" : text;
  }
}
