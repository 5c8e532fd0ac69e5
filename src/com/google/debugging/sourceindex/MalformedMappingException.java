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
 * A mappings segment has the wrong number of fields or resolves to a
 * negative position.
 */
public final class MalformedMappingException extends SourceMapParseException {
  private static final long serialVersionUID = 1L;

  private final int generatedLine;
  private final int segmentIndex;

  public MalformedMappingException(String message, int generatedLine, int segmentIndex) {
    super("Generated line " + generatedLine + ", segment " + segmentIndex + ": " + message);
    this.generatedLine = generatedLine;
    this.segmentIndex = segmentIndex;
  }

  /** The 0-based generated line holding the offending segment. */
  public int getGeneratedLine() {
    return generatedLine;
  }

  /** The 0-based position of the offending segment within its line. */
  public int getSegmentIndex() {
    return segmentIndex;
  }
}
