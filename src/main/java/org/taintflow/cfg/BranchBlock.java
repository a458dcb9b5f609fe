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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.taintflow.syntax.SyntaxNode;

/**
 * A block ended by a branching statement (e.g. a {@code switch}), whose successors are the possible
 * targets of the branch.
 */
public class BranchBlock extends Block {

  /** The statement that ends this block, or null if the front end didn't record one. */
  public final @Nullable SyntaxNode branchingNode;

  public BranchBlock(List<? extends SyntaxNode> instructions, @Nullable SyntaxNode branchingNode) {
    super(instructions);
    this.branchingNode = branchingNode;
  }
}
