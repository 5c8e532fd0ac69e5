/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.debugging.sourceindex;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PositionIndexTest {

  @Test
  public void testSourceOrderingUsesRankNotLexicalOrder() {
    Comparator<String> ordering =
        PositionIndex.sourceOrdering(ImmutableList.of("z.js", "a.js", "m.js"));

    assertThat(ordering.compare("z.js", "a.js")).isLessThan(0);
    assertThat(ordering.compare("m.js", "a.js")).isGreaterThan(0);
    assertThat(ordering.compare("a.js", "a.js")).isEqualTo(0);
  }

  @Test
  public void testDuplicateSourcesRankByFirstAppearance() {
    Comparator<String> ordering =
        PositionIndex.sourceOrdering(ImmutableList.of("b.js", "a.js", "b.js"));

    assertThat(ordering.compare("b.js", "a.js")).isLessThan(0);
  }

  @Test
  public void testUnknownSourceLookupMisses() {
    PositionIndex index =
        PositionIndex.builder().add("a.js", 0, 0, GeneratedPosition.create(0, 0)).build();

    assertThat(index.getFile("b.js")).isNull();
    assertThat(index.get("b.js", 0, 0)).isEmpty();
    assertThat(PositionIndex.sourceOrdering(ImmutableList.of("a.js")).compare("b.js", "a.js"))
        .isGreaterThan(0);
  }

  @Test
  public void testSourcesKeepDeclarationOrder() {
    PositionIndex index =
        PositionIndex.builder()
            .declareSources(ImmutableList.of("z.js", "a.js"))
            .add("a.js", 0, 0, GeneratedPosition.create(0, 0))
            .add("q.js", 0, 0, GeneratedPosition.create(1, 0))
            .add("z.js", 0, 0, GeneratedPosition.create(2, 0))
            .build();

    assertThat(index.getSources()).containsExactly("z.js", "a.js", "q.js").inOrder();
    assertThat(index.getFiles().keySet()).containsExactly("z.js", "a.js", "q.js").inOrder();
  }

  @Test
  public void testLinesAndColumnsAreNumericallyOrdered() {
    FileIndex file =
        FileIndex.builder()
            .add(10, 3, GeneratedPosition.create(0, 0))
            .add(2, 30, GeneratedPosition.create(0, 1))
            .add(2, 4, GeneratedPosition.create(0, 2))
            .build();

    assertThat(file.getLines().keySet()).containsExactly(2, 10).inOrder();
    assertThat(file.getLines().get(2).keySet()).containsExactly(4, 30).inOrder();
  }

  @Test
  public void testAddAppendsToExistingPositions() {
    PositionIndex index =
        PositionIndex.builder()
            .add("a.js", 1, 2, GeneratedPosition.create(5, 0))
            .add("a.js", 1, 2, GeneratedPosition.create(3, 7, "x"))
            .build();

    assertThat(index.get("a.js", 1, 2))
        .containsExactly(GeneratedPosition.create(5, 0), GeneratedPosition.create(3, 7, "x"))
        .inOrder();
    assertThat(index.positionCount()).isEqualTo(2);
  }

  @Test
  public void testMissingLocations() {
    PositionIndex index =
        PositionIndex.builder().add("a.js", 1, 2, GeneratedPosition.create(5, 0)).build();

    assertThat(index.get("a.js", 1, 3)).isEmpty();
    assertThat(index.get("a.js", 9, 2)).isEmpty();
    assertThat(index.get("b.js", 1, 2)).isEmpty();
    assertThat(index.getFile("b.js")).isNull();
  }

  @Test
  public void testDeclaredSourceWithoutPositions() {
    PositionIndex index = PositionIndex.builder().declareSource("a.js").build();

    assertThat(index.getSources()).containsExactly("a.js");
    assertThat(index.getFile("a.js")).isEqualTo(FileIndex.empty());
    assertThat(index.getFile("a.js").isEmpty()).isTrue();
  }

  @Test
  public void testEquality() {
    PositionIndex one =
        PositionIndex.builder().add("a.js", 0, 0, GeneratedPosition.create(1, 1, "f")).build();
    PositionIndex same =
        PositionIndex.builder().add("a.js", 0, 0, GeneratedPosition.create(1, 1, "f")).build();
    PositionIndex unnamed =
        PositionIndex.builder().add("a.js", 0, 0, GeneratedPosition.create(1, 1)).build();

    assertThat(one).isEqualTo(same);
    assertThat(one.hashCode()).isEqualTo(same.hashCode());
    assertThat(one).isNotEqualTo(unnamed);
  }
}
