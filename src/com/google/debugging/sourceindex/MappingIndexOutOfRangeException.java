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

/**
 * A segment refers to a source or name index outside the {@code sources} or
 * {@code names} array of its source map.
 */
public final class MappingIndexOutOfRangeException extends SourceMapParseException {
  private static final long serialVersionUID = 1L;

  private final int generatedLine;

  public MappingIndexOutOfRangeException(
      String table, int index, int size, int generatedLine) {
    super(
        "Generated line " + generatedLine + ": " + table + " index " + index
            + " is out of range [0, " + size + ")");
    this.generatedLine = generatedLine;
  }

  public int getGeneratedLine() {
    return generatedLine;
  }
}
