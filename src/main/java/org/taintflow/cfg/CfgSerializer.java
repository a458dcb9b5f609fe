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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.Writer;
import org.jspecify.annotations.Nullable;
import org.taintflow.syntax.SyntaxNode;

/**
 * Renders a {@link ControlFlowGraph} as a Graphviz graph, for debugging the front end and the UCFG
 * lowering.
 *
 * <p>Each block becomes a node labelled with its variant (e.g. {@code BRANCH}), followed by the
 * kind of the statement that ended it if there is one (e.g. {@code BINARY:IfStatement}), and then
 * by the text of each of its instructions. Edges out of a {@link BinaryBranchBlock} are labelled
 * {@code True} and {@code False}. Block ids are assigned the same way as in the UCFG, so the two
 * can be read side by side.
 */
public final class CfgSerializer {

  private CfgSerializer() {}

  /** Returns the graph for {@code cfg}, named {@code methodName}. */
  public static String serialize(String methodName, ControlFlowGraph cfg) {
    StringBuilder sb = new StringBuilder();
    try {
      new Walker(new DotWriter(sb)).visit(methodName, cfg);
    } catch (IOException e) {
      // StringBuilder.append doesn't throw
      throw new AssertionError(e);
    }
    return sb.toString();
  }

  /** Writes the graph for {@code cfg}, named {@code methodName}, to {@code writer}. */
  public static void serialize(String methodName, ControlFlowGraph cfg, Writer writer)
      throws IOException {
    new Walker(new DotWriter(writer)).visit(methodName, cfg);
  }

  /**
   * Returns the header used for a block of the given class: the first word of its name, upper
   * cased (e.g. {@code "FOREACH"} for {@link ForeachCollectionProducerBlock}). A leading acronym is
   * one word ({@code "IO"} for {@code IOBlock}).
   */
  static String variantHeader(Class<? extends Block> blockClass) {
    String name = blockClass.getSimpleName();
    if (name.isEmpty()) {
      return "BLOCK";
    }
    int end = 1;
    if (name.length() > 1
        && Ascii.isUpperCase(name.charAt(0))
        && Ascii.isUpperCase(name.charAt(1))) {
      while (end < name.length() && Ascii.isUpperCase(name.charAt(end))) {
        end++;
      }
      // The last capital of the run starts the next word
      if (end < name.length() && Ascii.isLowerCase(name.charAt(end))) {
        end--;
      }
    } else {
      while (end < name.length() && !Ascii.isUpperCase(name.charAt(end))) {
        end++;
      }
    }
    return Ascii.toUpperCase(name.substring(0, end));
  }

  /**
   * Returns the statement that ended {@code block}, for the variants that record one; null for
   * exit blocks, plain blocks, and variants we don't know about.
   */
  private static @Nullable SyntaxNode terminator(Block block) {
    if (block instanceof BranchBlock branch) {
      return branch.branchingNode;
    } else if (block instanceof ForeachCollectionProducerBlock foreach) {
      return foreach.foreachNode;
    } else if (block instanceof ForInitializerBlock forInitializer) {
      return forInitializer.forNode;
    } else if (block instanceof JumpBlock jump) {
      return jump.jumpNode;
    } else if (block instanceof LockBlock lock) {
      return lock.lockNode;
    } else if (block instanceof UsingEndBlock using) {
      return using.usingStatement;
    }
    return null;
  }

  private static class Walker {
    private final BlockIdMap blockId = new BlockIdMap();
    private final DotWriter writer;

    Walker(DotWriter writer) {
      this.writer = writer;
    }

    void visit(String methodName, ControlFlowGraph cfg) throws IOException {
      writer.writeGraphStart(methodName);
      for (Block block : cfg.blocks) {
        visit(block);
      }
      writer.writeGraphEnd();
    }

    private void visit(Block block) throws IOException {
      String header = variantHeader(block.getClass());
      SyntaxNode terminator = terminator(block);
      if (terminator != null) {
        header += ":" + terminator.kind().displayName();
      }
      ImmutableList<String> lines =
          block.instructions().stream().map(SyntaxNode::toString).collect(toImmutableList());
      String id = blockId.get(block);
      writer.writeNode(id, header, lines);
      for (Block successor : block.successors()) {
        writer.writeEdge(id, blockId.get(successor), edgeLabel(block, successor));
      }
    }

    private static String edgeLabel(Block block, Block successor) {
      if (block instanceof BinaryBranchBlock binary) {
        if (successor == binary.trueSuccessor()) {
          return "True";
        } else if (successor == binary.falseSuccessor()) {
          return "False";
        }
      }
      return "";
    }
  }
}
