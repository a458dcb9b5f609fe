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

/**
 * The reserved method ids of UCFG operations that aren't calls to a source method. None of them can
 * collide with a method's display string.
 */
public final class KnownMethodId {

  private KnownMethodId() {}

  /** {@code variable = args[0]}. */
  public static final String ASSIGNMENT = "__assignment";

  /** String concatenation; the arguments are the right operand, then the left. */
  public static final String CONCATENATION = "__concat";

  /** Links an attribute instance ({@code args[0]}) to the parameter named by {@code variable}. */
  public static final String ANNOTATION = "__annotation";

  /** Marks the method's parameters ({@code args}) as coming from outside the program. */
  public static final String ENTRY_POINT = "__entrypoint";

  /** A method that couldn't be resolved. */
  public static final String UNKNOWN = "__unknown";
}
