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

import java.math.BigInteger;

/**
 * A literal constant. Literals have the same representation in every stage's expressions and
 * patterns, so they are shared rather than redefined per stage.
 */
public sealed interface Literal {

  record IntLiteral(BigInteger value) implements Literal {
    public static IntLiteral of(long value) {
      return new IntLiteral(BigInteger.valueOf(value));
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  record FloatLiteral(double value) implements Literal {
    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  record StringLiteral(String value) implements Literal {
    @Override
    public String toString() {
      return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
  }

  record CharLiteral(char value) implements Literal {
    @Override
    public String toString() {
      return "'" + value + "'";
    }
  }

  /** The unit value {@code ()}. */
  record UnitLiteral() implements Literal {
    @Override
    public String toString() {
      return "()";
    }
  }

  UnitLiteral UNIT = new UnitLiteral();
}
