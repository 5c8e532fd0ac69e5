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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The fields of a version 3 source map document, as read from or written to
 * JSON.
 */
public final class SourceMapObject {
  /** The only supported value of the "version" field. */
  public static final int VERSION = 3;

  /** Returned by {@link #getLineCount} when the document has no line count. */
  public static final int UNKNOWN_LINE_COUNT = -1;

  private final int version;
  private final @Nullable String file;
  private final int lineCount;
  private final String mappings;
  private final ImmutableList<String> sources;
  private final ImmutableList<String> names;

  private SourceMapObject(Builder builder) {
    this.version = builder.version;
    this.file = builder.file;
    this.lineCount = builder.lineCount;
    this.mappings = checkNotNull(builder.mappings, "mappings");
    this.sources = builder.sources;
    this.names = builder.names;
  }

  public int getVersion() {
    return version;
  }

  /** The name of the generated file this map describes. */
  public @Nullable String getFile() {
    return file;
  }

  /**
   * The number of lines in the generated file, or {@link #UNKNOWN_LINE_COUNT}.
   */
  public int getLineCount() {
    return lineCount;
  }

  public boolean hasLineCount() {
    return lineCount != UNKNOWN_LINE_COUNT;
  }

  public String getMappings() {
    return mappings;
  }

  public ImmutableList<String> getSources() {
    return sources;
  }

  public ImmutableList<String> getNames() {
    return names;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return SourceMapWriter.toJson(this);
  }

  public static final class Builder {
    private int version = VERSION;
    private @Nullable String file;
    private int lineCount = UNKNOWN_LINE_COUNT;
    private @Nullable String mappings;
    private ImmutableList<String> sources = ImmutableList.of();
    private ImmutableList<String> names = ImmutableList.of();

    private Builder() {}

    public Builder setVersion(int version) {
      this.version = version;
      return this;
    }

    public Builder setFile(@Nullable String file) {
      this.file = file;
      return this;
    }

    public Builder setLineCount(int lineCount) {
      this.lineCount = lineCount;
      return this;
    }

    public Builder setMappings(String mappings) {
      this.mappings = mappings;
      return this;
    }

    public Builder setSources(List<String> sources) {
      this.sources = ImmutableList.copyOf(sources);
      return this;
    }

    public Builder setNames(List<String> names) {
      this.names = ImmutableList.copyOf(names);
      return this;
    }

    public SourceMapObject build() {
      return new SourceMapObject(this);
    }
  }
}
