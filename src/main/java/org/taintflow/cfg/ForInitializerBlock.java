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

package org.taintflow.cfg;

import com.google.common.base.Preconditions;
import java.util.List;
import org.taintflow.syntax.SyntaxNode;

/** A block holding the initializers of a {@code for} loop. */
public final class ForInitializerBlock extends Block {

  public final SyntaxNode forNode;

  public ForInitializerBlock(List<? extends SyntaxNode> instructions, SyntaxNode forNode) {
    super(instructions);
    this.forNode = Preconditions.checkNotNull(forNode);
  }
}
