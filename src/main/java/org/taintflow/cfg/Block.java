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
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.taintflow.syntax.SyntaxNode;

/**
 * A Block is one node of a method's control-flow graph, as built by the front end: a straight-line
 * sequence of statement-level {@link SyntaxNode}s, and the blocks that control may pass to when
 * they have been executed.
 *
 * <p>Blocks are created first and linked afterwards (with {@link #linkTo}), so that graphs with
 * back-edges can be built. Each block can be linked only once, and belongs to at most one {@link
 * ControlFlowGraph}.
 *
 * <p>The subclasses distinguish the statement (if any) that ended the block. Front ends may add
 * subclasses of their own; consumers treat unknown subclasses as plain blocks.
 */
public abstract class Block {

  /** The index of this block in its {@link ControlFlowGraph#blocks} list; -1 until added. */
  private int index = -1;

  private final ImmutableList<SyntaxNode> instructions;

  private ImmutableList<Block> successors = ImmutableList.of();

  private boolean linked;

  protected Block(List<? extends SyntaxNode> instructions) {
    this.instructions = ImmutableList.copyOf(instructions);
  }

  /** The statements and expressions of this block, in evaluation order. */
  public final ImmutableList<SyntaxNode> instructions() {
    return instructions;
  }

  /** The blocks that control may pass to from this one, in the order the front end gave them. */
  public final ImmutableList<Block> successors() {
    return successors;
  }

  /** Sets this block's successors; may only be called once. */
  public void linkTo(Block... successors) {
    Preconditions.checkState(!linked, "Block is already linked");
    for (Block successor : successors) {
      Preconditions.checkNotNull(successor);
    }
    this.successors = ImmutableList.copyOf(Arrays.asList(successors));
    linked = true;
  }

  /**
   * The index of this block in its {@link ControlFlowGraph#blocks} list; negative if it has not
   * been added to a graph.
   */
  public final int index() {
    return index;
  }

  /** Enables ControlFlowGraph to set {@link #index}; not for general use. */
  final void setIndex(int index) {
    Preconditions.checkState(this.index < 0, "Block already belongs to a graph");
    this.index = index;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "#" + index + instructions;
  }
}
