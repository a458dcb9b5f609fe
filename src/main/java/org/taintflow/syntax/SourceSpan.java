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

package org.taintflow.syntax;

import com.google.common.base.Preconditions;

/**
 * The position of a node in its source file, as reported by the front end: lines and columns are
 * 0-based, and {@code endColumn} is exclusive.
 */
public record SourceSpan(
    String filePath, int startLine, int startColumn, int endLine, int endColumn) {

  public SourceSpan {
    Preconditions.checkNotNull(filePath);
    Preconditions.checkArgument(startLine >= 0 && startColumn >= 0, "Negative start position");
    Preconditions.checkArgument(
        endLine > startLine || (endLine == startLine && endColumn >= startColumn),
        "Span ends before it starts");
  }

  /** Returns a span that starts and ends on a single line. */
  public static SourceSpan onLine(String filePath, int line, int startColumn, int endColumn) {
    return new SourceSpan(filePath, line, startColumn, line, endColumn);
  }

  @Override
  public String toString() {
    return String.format(
        "%s[%d:%d-%d:%d]", filePath, startLine, startColumn, endLine, endColumn);
  }
}
