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
import org.taintflow.syntax.SourceSpan;
import org.taintflow.syntax.SyntaxNode;

/**
 * A location in the UCFG's coordinate system: 1-based lines, 0-based columns, and an inclusive end
 * column.
 */
public record Location(
    String fileId, int startLine, int startLineOffset, int endLine, int endLineOffset) {

  public Location {
    Preconditions.checkNotNull(fileId);
  }

  /**
   * Converts a front end span (0-based lines and columns, exclusive end column) to a Location.
   *
   * <p>An empty span ends up with {@code endLineOffset == startLineOffset - 1}. Callers outside
   * this package go through {@link #of(SyntaxNode)}, which reports a missing span.
   */
  static Location of(SourceSpan span) {
    return new Location(
        span.filePath(),
        span.startLine() + 1,
        span.startColumn(),
        span.endLine() + 1,
        span.endColumn() - 1);
  }

  /**
   * Returns the location of {@code node}.
   *
   * @throws MissingLocationException if the node has no span
   */
  public static Location of(SyntaxNode node) {
    SourceSpan span = node.span();
    if (span == null) {
      throw new MissingLocationException(node);
    }
    return of(span);
  }

  @Override
  public String toString() {
    return String.format(
        "%s:%d:%d-%d:%d", fileId, startLine, startLineOffset, endLine, endLineOffset);
  }
}
