/*
 * Copyright 2011 The Closure Compiler Authors.
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

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;

/**
 * A minimal builder for a source map JSON document.
 *
 * <p>This builder is designed and intended for tests. It does not check any invariants.
 */
final class TestJsonBuilder {

  private static final Gson GSON = new Gson();

  private final ImmutableMap.Builder<String, Object> internal = ImmutableMap.builder();

  static TestJsonBuilder create() {
    return new TestJsonBuilder();
  }

  TestJsonBuilder setVersion(int version) {
    internal.put("version", version);
    return this;
  }

  TestJsonBuilder setFile(String file) {
    internal.put("file", file);
    return this;
  }

  TestJsonBuilder setLineCount(int count) {
    internal.put("lineCount", count);
    return this;
  }

  TestJsonBuilder setMappings(String mappings) {
    internal.put("mappings", mappings);
    return this;
  }

  TestJsonBuilder setSourceRoot(String root) {
    internal.put("sourceRoot", root);
    return this;
  }

  TestJsonBuilder setSources(String... sources) {
    internal.put("sources", sources);
    return this;
  }

  TestJsonBuilder setNames(String... names) {
    internal.put("names", names);
    return this;
  }

  TestJsonBuilder setCustomProperty(String name, Object value) {
    internal.put(name, value);
    return this;
  }

  ImmutableMap<String, ?> build() {
    return internal.buildOrThrow();
  }

  String toJson() {
    return GSON.toJson(build());
  }

  private TestJsonBuilder() {}
}
