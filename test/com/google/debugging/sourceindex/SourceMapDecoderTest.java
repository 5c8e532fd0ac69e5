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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapDecoderTest {

  private static final ImmutableList<String> SOURCES = ImmutableList.of("a.js", "b.js");
  private static final ImmutableList<String> NAMES = ImmutableList.of("x");

  @Test
  public void testDecode() throws Exception {
    PositionIndex index = SourceMapDecoder.decode("AAAAA,ICCE;ADCF,MCCKA", SOURCES, NAMES);

    PositionIndex expected =
        PositionIndex.builder()
            .add("a.js", 0, 0, GeneratedPosition.create(0, 0, "x"))
            .add("a.js", 2, 0, GeneratedPosition.create(1, 0))
            .add("b.js", 1, 2, GeneratedPosition.create(0, 4))
            .add("b.js", 3, 5, GeneratedPosition.create(1, 6, "x"))
            .build();
    assertThat(index).isEqualTo(expected);
  }

  @Test
  public void testDecodedSourcesPreserveFileOrder() throws Exception {
    ImmutableList<String> sources = ImmutableList.of("z.js", "m.js", "a.js");
    // Only a.js is mapped.
    PositionIndex index = SourceMapDecoder.decode("AEAA", sources, ImmutableList.of());

    assertThat(index.getSources()).containsExactlyElementsIn(sources).inOrder();
    assertThat(index.getFiles().keySet()).containsExactlyElementsIn(sources).inOrder();
    assertThat(index.getFile("z.js").isEmpty()).isTrue();
    assertThat(index.get("a.js", 0, 0)).containsExactly(GeneratedPosition.create(0, 0));
  }

  @Test
  public void testGeneratedColumnResetsAtEachLine() throws Exception {
    PositionIndex index = SourceMapDecoder.decode("CAAA;CACA", SOURCES, NAMES);

    assertThat(index.get("a.js", 0, 0)).containsExactly(GeneratedPosition.create(0, 1));
    assertThat(index.get("a.js", 1, 0)).containsExactly(GeneratedPosition.create(1, 1));
  }

  @Test
  public void testNameOnlyOnSegmentsWithFiveFields() throws Exception {
    PositionIndex index =
        SourceMapDecoder.decode("AAAAC,CAAA,CAAAA", SOURCES, ImmutableList.of("x", "y"));

    assertThat(index.get("a.js", 0, 0))
        .containsExactly(
            GeneratedPosition.create(0, 0, "y"),
            GeneratedPosition.create(0, 1),
            GeneratedPosition.create(0, 2, "y"))
        .inOrder();
  }

  @Test
  public void testBlankLinesAdvanceGeneratedLine() throws Exception {
    PositionIndex index = SourceMapDecoder.decode(";;AAAA;;", SOURCES, NAMES);

    assertThat(index.get("a.js", 0, 0)).containsExactly(GeneratedPosition.create(2, 0));
    assertThat(index.positionCount()).isEqualTo(1);
  }

  @Test
  public void testSingleFieldSegmentIsRejected() {
    MalformedMappingException e =
        assertThrows(
            MalformedMappingException.class,
            () -> SourceMapDecoder.decode("AAAA,C", SOURCES, NAMES));

    assertThat(e.getGeneratedLine()).isEqualTo(0);
    assertThat(e.getSegmentIndex()).isEqualTo(1);
    assertThat(e).hasMessageThat().contains("Unexpected number of values for segment: 1");
  }

  @Test
  public void testEmptyMappings() throws Exception {
    PositionIndex index = SourceMapDecoder.decode("", SOURCES, NAMES);

    assertThat(index.getSources()).containsExactlyElementsIn(SOURCES).inOrder();
    assertThat(index.positionCount()).isEqualTo(0);
  }

  @Test
  public void testDecodeSourceMapObject() throws Exception {
    SourceMapObject sourceMap =
        SourceMapObject.builder()
            .setFile("out.js")
            .setMappings("AAAAA,ICCE")
            .setSources(SOURCES)
            .setNames(NAMES)
            .build();

    PositionIndex index = SourceMapDecoder.decode(sourceMap);

    assertThat(index.get("a.js", 0, 0)).containsExactly(GeneratedPosition.create(0, 0, "x"));
    assertThat(index.get("b.js", 1, 2)).containsExactly(GeneratedPosition.create(0, 4));
  }

  @Test
  public void testInvalidCharacter() {
    MalformedVlqException e =
        assertThrows(
            MalformedVlqException.class,
            () -> SourceMapDecoder.decode("AAAA;AA!A", SOURCES, NAMES));
    assertThat(e).hasMessageThat().contains("Generated line 1");
  }

  @Test
  public void testTruncatedValue() {
    assertThrows(
        MalformedVlqException.class, () -> SourceMapDecoder.decode("AAAg", SOURCES, NAMES));
  }

  @Test
  public void testThreeFields() {
    MalformedMappingException e =
        assertThrows(
            MalformedMappingException.class,
            () -> SourceMapDecoder.decode(";AAAA,AAA", SOURCES, NAMES));
    assertThat(e.getGeneratedLine()).isEqualTo(1);
    assertThat(e.getSegmentIndex()).isEqualTo(1);
  }

  @Test
  public void testSixFields() {
    assertThrows(
        MalformedMappingException.class,
        () -> SourceMapDecoder.decode("AAAAAA", SOURCES, NAMES));
  }

  @Test
  public void testTwoFields() {
    assertThrows(
        MalformedMappingException.class, () -> SourceMapDecoder.decode("AA", SOURCES, NAMES));
  }

  @Test
  public void testEmptySegment() {
    assertThrows(
        MalformedMappingException.class,
        () -> SourceMapDecoder.decode("AAAA,,AAAA", SOURCES, NAMES));
    assertThrows(
        MalformedMappingException.class,
        () -> SourceMapDecoder.decode("AAAA,;AAAA", SOURCES, NAMES));
    assertThrows(
        MalformedMappingException.class, () -> SourceMapDecoder.decode("AAAA,", SOURCES, NAMES));
  }

  @Test
  public void testNegativeOriginalLine() {
    MalformedMappingException e =
        assertThrows(
            MalformedMappingException.class,
            () -> SourceMapDecoder.decode("AADA", SOURCES, NAMES));
    assertThat(e).hasMessageThat().contains("original line");
  }

  @Test
  public void testNegativeGeneratedColumn() {
    assertThrows(
        MalformedMappingException.class,
        () -> SourceMapDecoder.decode("CAAA,FAAA", SOURCES, NAMES));
  }

  @Test
  public void testSourceIndexOutOfRange() {
    MappingIndexOutOfRangeException e =
        assertThrows(
            MappingIndexOutOfRangeException.class,
            () -> SourceMapDecoder.decode("AAAA;AEAA", SOURCES, NAMES));
    assertThat(e.getGeneratedLine()).isEqualTo(1);
    assertThat(e).hasMessageThat().contains("source index 2");
  }

  @Test
  public void testNameIndexOutOfRange() {
    assertThrows(
        MappingIndexOutOfRangeException.class,
        () -> SourceMapDecoder.decode("AAAAC", SOURCES, NAMES));
  }

  @Test
  public void testNegativeSourceIndex() {
    assertThrows(
        MappingIndexOutOfRangeException.class,
        () -> SourceMapDecoder.decode("ADAA", SOURCES, NAMES));
  }
}
