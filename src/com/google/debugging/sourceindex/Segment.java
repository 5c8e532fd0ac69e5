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

import com.google.auto.value.AutoValue;
import java.util.OptionalInt;

/**
 * One mapped segment of a mappings string, with every field resolved to its
 * absolute value. The name index is present only when the segment carried a
 * fifth field.
 */
@AutoValue
abstract class Segment {

  static Segment create(
      int generatedColumn, int sourceIndex, int originalLine, int originalColumn) {
    return new AutoValue_Segment(
        generatedColumn, sourceIndex, originalLine, originalColumn, OptionalInt.empty());
  }

  static Segment create(
      int generatedColumn, int sourceIndex, int originalLine, int originalColumn,
      int nameIndex) {
    return new AutoValue_Segment(
        generatedColumn, sourceIndex, originalLine, originalColumn, OptionalInt.of(nameIndex));
  }

  /** The starting column in the current line of the generated file. */
  abstract int getGeneratedColumn();

  /** The index of the original source file. */
  abstract int getSourceIndex();

  /** The 0-based line in the original source. */
  abstract int getOriginalLine();

  /** The 0-based column in the original source. */
  abstract int getOriginalColumn();

  /** The index of the original symbol name, if the segment has one. */
  abstract OptionalInt getNameIndex();

  /** The number of fields this segment occupies on the wire. */
  int getFieldCount() {
    return getNameIndex().isPresent() ? 5 : 4;
  }
}
