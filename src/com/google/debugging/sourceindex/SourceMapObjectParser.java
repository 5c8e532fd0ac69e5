/*
 * Copyright 2016 The Closure Compiler Authors.
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

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.jspecify.annotations.Nullable;

/**
 * Reads a version 3 source map document with Gson. Only the fields the
 * position index needs are kept; "sourceRoot", "sourcesContent" and
 * extensions are ignored.
 */
public final class SourceMapObjectParser {

  private static final Gson GSON = new Gson();

  public static SourceMapObject parse(String contents) throws SourceMapParseException {
    SourceMapObject.Builder builder = SourceMapObject.builder();

    try {
      JsonObject sourceMapRoot = GSON.fromJson(contents, JsonObject.class);
      if (sourceMapRoot == null) {
        throw new SourceMapParseException("Source map is empty");
      }

      if (!sourceMapRoot.has("version")) {
        throw new SourceMapParseException("Missing version");
      }
      int version = sourceMapRoot.get("version").getAsInt();
      if (version != SourceMapObject.VERSION) {
        throw new SourceMapParseException("Unknown version: " + version);
      }
      if (sourceMapRoot.has("sections")) {
        throw new SourceMapParseException("Index maps with sections are not supported");
      }

      builder.setVersion(version);
      builder.setFile(getStringOrNull(sourceMapRoot, "file"));
      builder.setLineCount(
          sourceMapRoot.has("lineCount")
              ? sourceMapRoot.get("lineCount").getAsInt()
              : SourceMapObject.UNKNOWN_LINE_COUNT);

      String mappings = getStringOrNull(sourceMapRoot, "mappings");
      if (mappings == null) {
        throw new SourceMapParseException("Missing mappings");
      }
      builder.setMappings(mappings);

      if (!sourceMapRoot.has("sources")) {
        throw new SourceMapParseException("Missing sources");
      }
      builder.setSources(getStringList(sourceMapRoot.get("sources")));
      builder.setNames(
          sourceMapRoot.has("names")
              ? getStringList(sourceMapRoot.get("names"))
              : ImmutableList.of());
    } catch (JsonParseException
        | IllegalStateException
        | UnsupportedOperationException
        | NumberFormatException ex) {
      throw new SourceMapParseException("JSON parse exception: " + ex, ex);
    }

    return builder.build();
  }

  private static @Nullable String getStringOrNull(JsonObject object, String key) {
    JsonElement element = object.get(key);
    return element == null || element.isJsonNull() ? null : element.getAsString();
  }

  private static ImmutableList<String> getStringList(JsonElement element) {
    JsonArray array = element.getAsJsonArray();
    ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(array.size());
    for (JsonElement each : array) {
      result.add(each.getAsString());
    }
    return result.build();
  }

  private SourceMapObjectParser() {}
}
