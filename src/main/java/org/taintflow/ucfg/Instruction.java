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
import org.taintflow.util.StringUtil;

/**
 * One UCFG instruction: at {@code location}, call {@code methodId} with {@code args} and store the
 * result in {@code variable}. {@code methodId} is either a method id (see {@link MethodIds}) or one
 * of the {@link KnownMethodId}s.
 */
public record Instruction(
    Location location, String methodId, String variable, ImmutableList<Expression> args) {

  public Instruction {
    Preconditions.checkNotNull(location);
    Preconditions.checkNotNull(methodId);
    Preconditions.checkNotNull(variable);
    Preconditions.checkNotNull(args);
  }

  @Override
  public String toString() {
    return variable + " = " + methodId + StringUtil.joinElements("(", ")", args.size(), args::get);
  }
}
