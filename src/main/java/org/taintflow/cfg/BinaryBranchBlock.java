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
import org.jspecify.annotations.Nullable;
import org.taintflow.syntax.SyntaxNode;

/**
 * A block ended by a two-way conditional branch. Its successors are, in order, the block taken when
 * the condition is true and the block taken when it is false.
 */
public final class BinaryBranchBlock extends BranchBlock {

  private @Nullable Block trueSuccessor;
  private @Nullable Block falseSuccessor;

  public BinaryBranchBlock(List<? extends SyntaxNode> instructions, SyntaxNode branchingNode) {
    super(instructions, Preconditions.checkNotNull(branchingNode));
  }

  /** Links this block; requires exactly two successors, the true one first. */
  @Override
  public void linkTo(Block... successors) {
    Preconditions.checkArgument(
        successors.length == 2, "A binary branch has exactly two successors");
    super.linkTo(successors);
    trueSuccessor = successors[0];
    falseSuccessor = successors[1];
  }

  /** The block taken when the condition holds; null until linked. */
  public @Nullable Block trueSuccessor() {
    return trueSuccessor;
  }

  /** The block taken when the condition does not hold; null until linked. */
  public @Nullable Block falseSuccessor() {
    return falseSuccessor;
  }
}
