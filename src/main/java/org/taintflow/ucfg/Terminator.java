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
import org.jspecify.annotations.Nullable;

/** How control leaves a {@link BasicBlock}: a jump to other blocks, or a return from the method. */
public sealed interface Terminator permits Terminator.Jump, Terminator.Return {

  /** Control continues at one of the blocks with the given ids (in the CFG's successor order). */
  record Jump(ImmutableList<String> destinations) implements Terminator {
    public Jump {
      Preconditions.checkNotNull(destinations);
    }

    @Override
    public String toString() {
      return "jump " + String.join(", ", destinations);
    }
  }

  /**
   * The method returns {@code returnedExpression}. {@code location} is that of the {@code return}
   * statement, or null for the return synthesized at the exit block.
   */
  record Return(@Nullable Location location, Expression returnedExpression)
      implements Terminator {
    public Return {
      Preconditions.checkNotNull(returnedExpression);
    }

    @Override
    public String toString() {
      return "return " + returnedExpression;
    }
  }
}
