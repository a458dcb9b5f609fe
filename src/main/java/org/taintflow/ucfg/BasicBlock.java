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

/** A block of the UCFG: a list of instructions followed by exactly one {@link Terminator}. */
public record BasicBlock(
    String id, ImmutableList<Instruction> instructions, Terminator terminator) {

  public BasicBlock {
    Preconditions.checkNotNull(id);
    Preconditions.checkNotNull(instructions);
    Preconditions.checkNotNull(terminator);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(id).append(":\n");
    for (Instruction instruction : instructions) {
      sb.append("  ").append(instruction).append('\n');
    }
    sb.append("  ").append(terminator).append('\n');
    return sb.toString();
  }
}
