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

package org.taintflow.semantic;

/**
 * Decides whether a method is an entry point: a method invoked from outside the program (e.g. to
 * handle a web request), whose parameters are therefore possible taint sources.
 */
@FunctionalInterface
public interface EntryPointRecognizer {

  /** Never treats a method as an entry point. */
  EntryPointRecognizer NONE = method -> false;

  boolean isEntryPoint(MethodSymbol method);
}
