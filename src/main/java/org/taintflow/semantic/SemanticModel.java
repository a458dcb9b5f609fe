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

package org.taintflow.semantic;

import org.jspecify.annotations.Nullable;
import org.taintflow.syntax.SyntaxNode;

/** The semantic facts the front end resolved for the syntax of one source file. */
public interface SemanticModel {

  /**
   * Returns the symbol that {@code node} refers to (the called method for an invocation or object
   * creation, the named symbol for an identifier), or null if it could not be resolved.
   */
  @Nullable Symbol symbolOf(SyntaxNode node);

  /**
   * Returns the symbol that {@code node} declares (the local variable for a variable declarator),
   * or null if it declares nothing or could not be resolved.
   */
  @Nullable Symbol declaredSymbolOf(SyntaxNode node);
}
