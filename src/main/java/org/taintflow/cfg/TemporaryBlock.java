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

/**
 * A placeholder block with no statements; used where a block identity is needed for something that
 * is not part of the front end's graph (e.g. to draw a fresh id from a {@link BlockIdMap}).
 */
public final class TemporaryBlock extends Block {

  public TemporaryBlock() {
    super(ImmutableList.of());
  }
}
