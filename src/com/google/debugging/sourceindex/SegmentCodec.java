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

import java.io.IOException;

/**
 * Converts between relative segment fields, as they appear in a mappings
 * string, and absolute {@link Segment}s.
 *
 * <p>The fields, if present, are in the following order:
 * <ol>
 *   <li>the starting column in the current line of the generated file
 *   <li>the id of the original source file
 *   <li>the starting line in the original source
 *   <li>the starting column in the original source
 *   <li>the id of the original symbol name
 * </ol>
 * Each is relative to the last encountered value for that field.
 */
final class SegmentCodec {

  static final int UNNAMED_FIELD_COUNT = 4;
  static final int NAMED_FIELD_COUNT = 5;

  private SegmentCodec() {}

  /**
   * Reads the VLQ values of one segment, stopping before the next ',' or ';'.
   * At most {@code fields.length} values are stored; the returned count keeps
   * going past that so oversized segments can be reported.
   */
  static int readFields(StringCharIterator in, int[] fields) throws MalformedVlqException {
    int count = 0;
    while (!segmentComplete(in)) {
      int value = Base64VLQ.decode(in);
      if (count < fields.length) {
        fields[count] = value;
      }
      count++;
    }
    return count;
  }

  private static boolean segmentComplete(StringCharIterator in) {
    if (!in.hasNext()) {
      return true;
    }
    char c = in.peek();
    return c == ';' || c == ',';
  }

  /**
   * Combines relative fields with the running state. A four field segment has
   * no name, even if the state holds a name index from an earlier segment.
   */
  static Segment decodeSegment(int[] relative, int fieldCount, SegmentState previous) {
    checkArgument(
        fieldCount == UNNAMED_FIELD_COUNT || fieldCount == NAMED_FIELD_COUNT,
        "Unexpected number of values for segment: %s", fieldCount);
    int generatedColumn = relative[0] + previous.getGeneratedColumn();
    int sourceIndex = relative[1] + previous.getSourceIndex();
    int originalLine = relative[2] + previous.getOriginalLine();
    int originalColumn = relative[3] + previous.getOriginalColumn();
    if (fieldCount == NAMED_FIELD_COUNT) {
      return Segment.create(
          generatedColumn, sourceIndex, originalLine, originalColumn,
          relative[4] + previous.getNameIndex());
    }
    return Segment.create(generatedColumn, sourceIndex, originalLine, originalColumn);
  }

  /**
   * The pairwise differences between {@code current} and {@code previous}:
   * four values, or five when {@code current} has a name.
   */
  static int[] encodeOffset(Segment current, SegmentState previous) {
    int[] offset = new int[current.getFieldCount()];
    offset[0] = current.getGeneratedColumn() - previous.getGeneratedColumn();
    offset[1] = current.getSourceIndex() - previous.getSourceIndex();
    offset[2] = current.getOriginalLine() - previous.getOriginalLine();
    offset[3] = current.getOriginalColumn() - previous.getOriginalColumn();
    if (current.getNameIndex().isPresent()) {
      offset[4] = current.getNameIndex().getAsInt() - previous.getNameIndex();
    }
    return offset;
  }

  /** Writes {@code current} relative to {@code previous} as VLQ values. */
  static void appendSegment(Appendable out, Segment current, SegmentState previous)
      throws IOException {
    for (int value : encodeOffset(current, previous)) {
      Base64VLQ.encode(out, value);
    }
  }
}
