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

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Assigns ids to blocks: the first time a block is seen it gets the next integer ("0", "1", ...),
 * and it keeps that id from then on.
 *
 * <p>A BlockIdMap should be used for one method only, and from one thread.
 */
public final class BlockIdMap {

  private final Map<Block, String> ids = new IdentityHashMap<>();

  private int counter;

  /** Returns the id of {@code block}, assigning a new one if it hasn't been seen before. */
  public String get(Block block) {
    return ids.computeIfAbsent(block, b -> String.valueOf(counter++));
  }

  /** The number of ids assigned so far. */
  public int size() {
    return counter;
  }
}
