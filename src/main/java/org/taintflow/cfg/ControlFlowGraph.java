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
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;

/**
 * The control-flow graph of one method body: its blocks in the order the front end produced them,
 * the block where execution starts, and the block where every path ends.
 *
 * <p>The graph may contain cycles. Blocks refer to their successors directly; each block also
 * records its position in {@link #blocks} (see {@link Block#index}).
 */
public final class ControlFlowGraph {

  /** All blocks of the graph ({@code blocks.get(i).index() == i}). */
  public final ImmutableList<Block> blocks;

  public final Block entryBlock;

  public final ExitBlock exitBlock;

  private ControlFlowGraph(ImmutableList<Block> blocks, Block entryBlock, ExitBlock exitBlock) {
    this.blocks = blocks;
    this.entryBlock = entryBlock;
    this.exitBlock = exitBlock;
  }

  /**
   * Creates a graph from linked blocks. Every block must be new to graphs, and every successor of
   * a block must itself be one of {@code blocks}. If the blocks are rejected they are left as they
   * were, and can be used in another call.
   */
  public static ControlFlowGraph of(List<Block> blocks, Block entryBlock, ExitBlock exitBlock) {
    ImmutableList<Block> list = ImmutableList.copyOf(blocks);
    Set<Block> members = Sets.newIdentityHashSet();
    for (Block block : list) {
      Preconditions.checkState(block.index() < 0, "%s already belongs to a graph", block);
      Preconditions.checkArgument(members.add(block), "%s is listed twice", block);
    }
    Preconditions.checkArgument(members.contains(entryBlock), "Entry block is not in the graph");
    Preconditions.checkArgument(members.contains(exitBlock), "Exit block is not in the graph");
    for (Block block : list) {
      for (Block successor : block.successors()) {
        Preconditions.checkArgument(
            members.contains(successor), "%s links to a block outside the graph", block);
      }
    }
    for (int i = 0; i < list.size(); i++) {
      list.get(i).setIndex(i);
    }
    return new ControlFlowGraph(list, entryBlock, exitBlock);
  }

  @Override
  public String toString() {
    return "cfg" + blocks;
  }
}
