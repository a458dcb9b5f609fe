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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.taintflow.syntax.SourceSpan;
import org.taintflow.syntax.SyntaxNode;

@RunWith(JUnit4.class)
public class LocationTest {

  @Test
  public void linesBecomeOneBasedAndEndColumnInclusive() {
    Location location = Location.of(new SourceSpan("A.cs", 0, 4, 2, 11));

    assertThat(location).isEqualTo(new Location("A.cs", 1, 4, 3, 10));
    assertThat(location.toString()).isEqualTo("A.cs:1:4-3:10");
  }

  @Test
  public void emptySpanEndsBeforeItStarts() {
    Location location = Location.of(SourceSpan.onLine("A.cs", 5, 7, 7));

    assertThat(location.startLineOffset()).isEqualTo(7);
    assertThat(location.endLineOffset()).isEqualTo(6);
  }

  @Test
  public void nodeLocationComesFromItsSpan() {
    SyntaxNode node = new SyntaxNode.Identifier("x", SourceSpan.onLine("B.cs", 3, 8, 9));

    assertThat(Location.of(node)).isEqualTo(new Location("B.cs", 4, 8, 4, 8));
  }

  @Test
  public void nodeWithoutSpanHasNoLocation() {
    SyntaxNode node = new SyntaxNode.Identifier("x", null);

    MissingLocationException e =
        assertThrows(MissingLocationException.class, () -> Location.of(node));
    assertThat(e).hasMessageThat().contains("\"x\"");
  }
}
