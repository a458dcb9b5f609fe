/*
 * Copyright 2025 The Taintflow Authors
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

package org.taintflow.ucfg;

import com.google.common.base.Preconditions;

/**
 * An argument or returned value in the UCFG: either a reference to a variable that may carry a
 * tracked string, or the constant that stands for every value that isn't tracked.
 */
public sealed interface Expression permits Expression.Constant, Expression.Variable {

  /**
   * The one constant used for every value that isn't a tracked string (numbers, objects, string
   * literals, unresolved expressions, ...). Its value is what the analysis engine expects.
   */
  Constant CONSTANT = new Constant("\"\"");

  /** Returns a reference to the variable named {@code name}. */
  static Variable variable(String name) {
    return new Variable(name);
  }

  /** True if this is a {@link Variable}, i.e. a possible carrier of tainted data. */
  default boolean isVariable() {
    return this instanceof Variable;
  }

  /** A constant; in practice always {@link #CONSTANT}. */
  record Constant(String value) implements Expression {
    public Constant {
      Preconditions.checkNotNull(value);
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /** A reference to a source variable or parameter, or to a generated temporary. */
  record Variable(String name) implements Expression {
    public Variable {
      Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
