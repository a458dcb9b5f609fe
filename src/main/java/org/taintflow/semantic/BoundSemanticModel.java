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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.taintflow.syntax.SyntaxNode;

/**
 * A SemanticModel backed by explicit bindings from nodes to symbols, for front ends that resolve
 * names up front. Nodes are keyed by identity.
 */
public class BoundSemanticModel implements SemanticModel {

  private final Map<SyntaxNode, Symbol> references = new IdentityHashMap<>();
  private final Map<SyntaxNode, Symbol> declarations = new IdentityHashMap<>();

  /** Records that {@code node} refers to {@code symbol}. */
  @CanIgnoreReturnValue
  public BoundSemanticModel bind(SyntaxNode node, Symbol symbol) {
    Symbol prev =
        references.put(Preconditions.checkNotNull(node), Preconditions.checkNotNull(symbol));
    Preconditions.checkArgument(prev == null || prev == symbol, "%s is already bound", node);
    return this;
  }

  /** Records that {@code node} declares {@code symbol}. */
  @CanIgnoreReturnValue
  public BoundSemanticModel declare(SyntaxNode node, Symbol symbol) {
    Symbol prev =
        declarations.put(Preconditions.checkNotNull(node), Preconditions.checkNotNull(symbol));
    Preconditions.checkArgument(prev == null || prev == symbol, "%s is already declared", node);
    return this;
  }

  @Override
  public @Nullable Symbol symbolOf(SyntaxNode node) {
    return references.get(node);
  }

  @Override
  public @Nullable Symbol declaredSymbolOf(SyntaxNode node) {
    return declarations.get(node);
  }
}
