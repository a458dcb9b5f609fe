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
import org.jspecify.annotations.Nullable;
import org.taintflow.syntax.SyntaxNode;

/**
 * An attribute applied to a symbol. {@code constructor} is null if the front end could not resolve
 * which attribute constructor the application calls.
 */
public record AttributeData(
    TypeSymbol attributeClass, @Nullable MethodSymbol constructor, SyntaxNode applicationSyntax) {

  public AttributeData {
    Preconditions.checkNotNull(attributeClass);
    Preconditions.checkNotNull(applicationSyntax);
  }
}
