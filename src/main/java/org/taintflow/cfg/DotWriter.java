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

import java.io.IOException;
import java.util.List;
import org.taintflow.util.StringUtil;

/**
 * Writes a directed graph in the Graphviz DOT language. Nodes are drawn as records whose first
 * field is a header and whose remaining fields are lines of text.
 */
final class DotWriter {

  private final Appendable out;

  DotWriter(Appendable out) {
    this.out = out;
  }

  void writeGraphStart(String graphName) throws IOException {
    out.append("digraph ").append(StringUtil.quote(graphName)).append(" {\n");
  }

  void writeGraphEnd() throws IOException {
    out.append("}\n");
  }

  void writeNode(String id, String header, List<String> lines) throws IOException {
    out.append(id).append(" [shape=record label=\"{").append(StringUtil.escapeRecordField(header));
    for (String line : lines) {
      out.append('|').append(StringUtil.escapeRecordField(line));
    }
    out.append("}\"]\n");
  }

  /** Writes an edge; an empty {@code label} writes an unlabelled edge. */
  void writeEdge(String fromId, String toId, String label) throws IOException {
    out.append(fromId).append(" -> ").append(toId);
    if (!label.isEmpty()) {
      out.append(" [label=").append(StringUtil.quote(label)).append(']');
    }
    out.append('\n');
  }
}
