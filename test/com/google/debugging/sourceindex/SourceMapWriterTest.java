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
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceMapWriterTest {

  private static final Gson GSON = new Gson();

  @Test
  public void testFieldOrder() {
    SourceMapObject sourceMap =
        SourceMapObject.builder()
            .setFile("out.js")
            .setLineCount(2)
            .setMappings("AAAA")
            .setSources(ImmutableList.of("a.js"))
            .setNames(ImmutableList.of("x"))
            .build();

    JsonObject json = GSON.fromJson(SourceMapWriter.toJson(sourceMap), JsonObject.class);

    assertThat(json.keySet())
        .containsExactly("version", "file", "sources", "lineCount", "mappings", "names")
        .inOrder();
    assertThat(json.get("version").getAsInt()).isEqualTo(3);
    assertThat(json.get("lineCount").getAsInt()).isEqualTo(2);
    assertThat(json.get("mappings").getAsString()).isEqualTo("AAAA");
  }

  @Test
  public void testAbsentFieldsAreLeftOut() {
    SourceMapObject sourceMap = SourceMapObject.builder().setMappings("").build();

    JsonObject json = GSON.fromJson(SourceMapWriter.toJson(sourceMap), JsonObject.class);

    assertThat(json.keySet()).containsExactly("version", "sources", "mappings", "names");
  }

  @Test
  public void testWriteThenParse() throws Exception {
    SourceMapObject sourceMap =
        SourceMapObject.builder()
            .setFile("out \"quoted\".js")
            .setMappings("AAAAA;;CACA")
            .setSources(ImmutableList.of("dir/a.js", "ü.js"))
            .setNames(ImmutableList.of("</script>"))
            .build();

    SourceMapObject parsed = SourceMapObjectParser.parse(SourceMapWriter.toJson(sourceMap));

    assertThat(parsed.getFile()).isEqualTo(sourceMap.getFile());
    assertThat(parsed.getMappings()).isEqualTo(sourceMap.getMappings());
    assertThat(parsed.getSources()).isEqualTo(sourceMap.getSources());
    assertThat(parsed.getNames()).isEqualTo(sourceMap.getNames());
    assertThat(parsed.hasLineCount()).isFalse();
  }
}
