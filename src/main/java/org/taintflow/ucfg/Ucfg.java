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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.jspecify.annotations.Nullable;

/**
 * The UCFG of one method: a control-flow graph that keeps only the operations that can move string
 * data, in the form expected by the taint analysis engine.
 */
public final class Ucfg {

  /** The method's id (see {@link MethodIds}). */
  public final String methodId;

  /** The location of the method's declaration. */
  public final Location location;

  /** The names of the method's parameters, in declaration order. */
  public final ImmutableList<String> parameters;

  /** The blocks of the UCFG; each CFG block in order, then any synthesized entry-point block. */
  public final ImmutableList<BasicBlock> basicBlocks;

  /** The ids of the blocks where execution starts; always exactly one. */
  public final ImmutableList<String> entries;

  private final ImmutableMap<String, BasicBlock> blocksById;

  public Ucfg(
      String methodId,
      Location location,
      ImmutableList<String> parameters,
      ImmutableList<BasicBlock> basicBlocks,
      ImmutableList<String> entries) {
    this.methodId = Preconditions.checkNotNull(methodId);
    this.location = Preconditions.checkNotNull(location);
    this.parameters = Preconditions.checkNotNull(parameters);
    this.basicBlocks = Preconditions.checkNotNull(basicBlocks);
    this.entries = Preconditions.checkNotNull(entries);
    // Fails if two blocks have the same id
    this.blocksById = Maps.uniqueIndex(basicBlocks, BasicBlock::id);
  }

  /** Returns the block with the given id, or null if there is none. */
  public @Nullable BasicBlock basicBlock(String id) {
    return blocksById.get(id);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(methodId).append(" @").append(location).append('\n');
    sb.append("parameters: ").append(parameters).append('\n');
    sb.append("entries: ").append(entries).append('\n');
    for (BasicBlock block : basicBlocks) {
      sb.append(block);
    }
    return sb.toString();
  }
}
