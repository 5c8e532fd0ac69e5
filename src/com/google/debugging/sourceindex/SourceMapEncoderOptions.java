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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Options for {@link SourceMapEncoder}.
 */
public class SourceMapEncoderOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The name of the generated file, written to the "file" field. */
  private @Nullable String file = null;

  /**
   * The number of lines in the generated file, or
   * {@link SourceMapObject#UNKNOWN_LINE_COUNT} to leave "lineCount" out.
   */
  private int lineCount = SourceMapObject.UNKNOWN_LINE_COUNT;

  /** How source identifiers are written to the "sources" field. */
  private SourcePathMapping sourcePathMapping = SourcePathMappings.identity();

  public @Nullable String getFile() {
    return file;
  }

  public SourceMapEncoderOptions setFile(@Nullable String file) {
    this.file = file;
    return this;
  }

  public int getLineCount() {
    return lineCount;
  }

  public boolean hasLineCount() {
    return lineCount != SourceMapObject.UNKNOWN_LINE_COUNT;
  }

  public SourceMapEncoderOptions setLineCount(int lineCount) {
    checkArgument(
        lineCount >= 0 || lineCount == SourceMapObject.UNKNOWN_LINE_COUNT,
        "Invalid line count: %s", lineCount);
    this.lineCount = lineCount;
    return this;
  }

  public SourcePathMapping getSourcePathMapping() {
    return sourcePathMapping;
  }

  public SourceMapEncoderOptions setSourcePathMapping(SourcePathMapping sourcePathMapping) {
    this.sourcePathMapping = checkNotNull(sourcePathMapping);
    return this;
  }
}
