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

import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a {@link SourceMapObject} as indented JSON, in the following field
 * order:
 *
 * <pre>
 * {
 *   "version": 3,
 *   "file": "out.js",
 *   "sources": ["foo.js", "bar.js"],
 *   "lineCount": 2,
 *   "mappings": "AAAA;;ACAAA,CAAC",
 *   "names": ["src", "maps"]
 * }
 * </pre>
 *
 * "file" and "lineCount" are left out when the document has no value for
 * them.
 */
public final class SourceMapWriter {

  private SourceMapWriter() {}

  /** Writes the document to {@code out}, flushing but not closing it. */
  public static void writeTo(SourceMapObject sourceMap, Writer out) throws IOException {
    JsonWriter jsonWriter = new JsonWriter(out);
    jsonWriter.setIndent("  ");
    jsonWriter.beginObject();
    jsonWriter.name("version").value(sourceMap.getVersion());
    if (sourceMap.getFile() != null) {
      jsonWriter.name("file").value(sourceMap.getFile());
    }
    writeStrings(jsonWriter.name("sources"), sourceMap.getSources());
    if (sourceMap.hasLineCount()) {
      jsonWriter.name("lineCount").value(sourceMap.getLineCount());
    }
    jsonWriter.name("mappings").value(sourceMap.getMappings());
    writeStrings(jsonWriter.name("names"), sourceMap.getNames());
    jsonWriter.endObject();
    jsonWriter.flush();
    out.write('\n');
    out.flush();
  }

  public static String toJson(SourceMapObject sourceMap) {
    StringWriter out = new StringWriter();
    try {
      writeTo(sourceMap, out);
    } catch (IOException e) {
      // StringWriter does not throw IOException.
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  private static void writeStrings(JsonWriter jsonWriter, List<String> values)
      throws IOException {
    jsonWriter.beginArray();
    for (String value : values) {
      jsonWriter.value(value);
    }
    jsonWriter.endArray();
  }
}
