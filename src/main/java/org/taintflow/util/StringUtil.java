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

package org.taintflow.util;

import java.util.function.IntFunction;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building and escaping strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code ", "}, and adding the
   * given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  /** Characters with a meaning of their own inside a Graphviz record label. */
  private static final Pattern NEEDS_ESCAPE = Pattern.compile("[\"{}<>|\\\\\r\n]");

  private static String escapeChar(MatchResult mr, String s) {
    return switch (s.charAt(mr.start())) {
      case '\"' -> "\\\\\"";
      case '{' -> "\\\\{";
      case '}' -> "\\\\}";
      case '<' -> "\\\\<";
      case '>' -> "\\\\>";
      case '|' -> "\\\\|";
      case '\\' -> "\\\\\\\\";
      // Record fields are single-line; line breaks become plain spaces.
      case '\r', '\n' -> " ";
      default -> throw new AssertionError();
    };
  }

  /**
   * Given a string, returns it escaped for use as one field of a Graphviz record label (without
   * surrounding quotes).
   */
  public static String escapeRecordField(String s) {
    if (s == null) {
      return "null";
    }
    Matcher m = NEEDS_ESCAPE.matcher(s);
    return m.replaceAll(mr -> escapeChar(mr, s));
  }

  /** Given a string, returns an equivalent quoted Graphviz identifier. */
  public static String quote(String s) {
    return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
