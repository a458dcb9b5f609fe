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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.taintflow.cfg.Block;
import org.taintflow.cfg.BlockIdMap;
import org.taintflow.cfg.ControlFlowGraph;
import org.taintflow.cfg.JumpBlock;
import org.taintflow.cfg.TemporaryBlock;
import org.taintflow.semantic.ControllerEntryPoints;
import org.taintflow.semantic.EntryPointRecognizer;
import org.taintflow.semantic.MethodSymbol;
import org.taintflow.semantic.SemanticModel;
import org.taintflow.semantic.Symbol;
import org.taintflow.syntax.SyntaxNode;

/**
 * Builds the {@link Ucfg} of a method from its control-flow graph and the semantic facts the front
 * end resolved for it.
 *
 * <p>There is one UCFG {@link BasicBlock} for each CFG {@link Block}, in the same order and with
 * ids assigned by a {@link BlockIdMap}. A block's terminator is the return it contains if any
 * (always a constant return for the CFG's exit block), and otherwise a jump to its successors. If
 * the method is an entry point, an extra block that marks its parameters as external inputs is
 * appended and becomes the UCFG's entry.
 *
 * <p>A UcfgBuilder keeps no state between calls to {@link #build}, and can be used to build
 * several methods concurrently.
 */
public class UcfgBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EntryPointRecognizer entryPoints;

  /** If true, each UCFG built is logged (at FINE). */
  public boolean verbose;

  /** Creates a UcfgBuilder that treats web controller actions as entry points. */
  public UcfgBuilder() {
    this(ControllerEntryPoints.INSTANCE);
  }

  public UcfgBuilder(EntryPointRecognizer entryPoints) {
    this.entryPoints = Preconditions.checkNotNull(entryPoints);
  }

  /**
   * Returns the UCFG of the method declared by {@code declaration}.
   *
   * @param semanticModel resolves the symbols referenced in the method body
   * @param declaration the declaration of the method, constructor or accessor; it and every node
   *     that becomes an instruction must have a source span
   * @param method the symbol declared by {@code declaration}
   * @param cfg the control-flow graph of the body
   * @throws MissingLocationException if a node that needs a location has no span
   */
  public Ucfg build(
      SemanticModel semanticModel,
      SyntaxNode declaration,
      MethodSymbol method,
      ControlFlowGraph cfg) {
    BlockIdMap blockId = new BlockIdMap();
    String methodId = MethodIds.of(method);
    Location location = Location.of(declaration);

    ImmutableList.Builder<BasicBlock> basicBlocks = ImmutableList.builder();
    for (Block block : cfg.blocks) {
      basicBlocks.add(buildBasicBlock(semanticModel, cfg, block, blockId));
    }
    ImmutableList<String> parameters =
        method.parameters.stream().map(p -> p.name).collect(toImmutableList());

    String entry = blockId.get(cfg.entryBlock);
    if (declaration instanceof SyntaxNode.MethodDeclaration methodDeclaration
        && methodDeclaration.hasParameterList()
        && entryPoints.isEntryPoint(method)) {
      BasicBlock entryPointBlock =
          buildEntryPointBlock(methodDeclaration, method, entry, blockId);
      basicBlocks.add(entryPointBlock);
      entry = entryPointBlock.id();
    }

    Ucfg ucfg =
        new Ucfg(methodId, location, parameters, basicBlocks.build(), ImmutableList.of(entry));
    if (verbose) {
      logger.atFine().log("UCFG of %s:\n%s", methodId, ucfg);
    }
    return ucfg;
  }

  private static BasicBlock buildBasicBlock(
      SemanticModel semanticModel, ControlFlowGraph cfg, Block block, BlockIdMap blockId) {
    BlockBuilder blockBuilder = new BlockBuilder(blockId.get(block));
    InstructionBuilder instructionBuilder = new InstructionBuilder(semanticModel, blockBuilder);
    for (SyntaxNode instruction : block.instructions()) {
      instructionBuilder.build(instruction);
    }
    if (block instanceof JumpBlock jump) {
      // e.g. a return statement, which sets the terminator
      instructionBuilder.build(jump.jumpNode);
    }
    if (block == cfg.exitBlock) {
      blockBuilder.setReturn(null, Expression.CONSTANT);
    }
    if (!blockBuilder.hasTerminator()) {
      blockBuilder.setJump(
          block.successors().stream().map(blockId::get).collect(toImmutableList()));
    }
    return blockBuilder.build();
  }

  /**
   * Returns a block that marks the method's parameters as entry point inputs, records the
   * attributes applied to them, and then jumps to {@code cfgEntryId}.
   */
  private static BasicBlock buildEntryPointBlock(
      SyntaxNode.MethodDeclaration declaration,
      MethodSymbol method,
      String cfgEntryId,
      BlockIdMap blockId) {
    BlockBuilder blockBuilder = new BlockBuilder(blockId.get(new TemporaryBlock()));
    blockBuilder.setJump(ImmutableList.of(cfgEntryId));
    blockBuilder.addEntryPointInstruction(declaration);
    for (Symbol.Parameter parameter : method.parameters) {
      blockBuilder.addAttributeInstructions(parameter);
    }
    return blockBuilder.build();
  }
}
