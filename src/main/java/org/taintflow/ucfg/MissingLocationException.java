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
 * Thrown when a node that must be located in the UCFG (an instruction, a return, or the method
 * declaration itself) has no source span. This indicates a front end that broke its contract, and
 * is never recovered from while building.
 */
public class MissingLocationException extends RuntimeException {

  public MissingLocationException(Object node) {
    super("No source location for \"" + node + "\"");
  }
}
