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

import com.google.common.collect.ImmutableList;

/** The single block that every path through the method ends in. It has no successors. */
public final class ExitBlock extends Block {

  public ExitBlock() {
    super(ImmutableList.of());
  }

  @Override
  public void linkTo(Block... successors) {
    throw new IllegalStateException("The exit block has no successors");
  }
}
