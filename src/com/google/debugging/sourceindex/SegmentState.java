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

/**
 * The running absolute values that relative segment fields are measured
 * against. Only the generated column restarts at each generated line; the
 * other fields carry over for the whole mappings string.
 */
@AutoValue
abstract class SegmentState {

  static final SegmentState INITIAL = create(0, 0, 0, 0, 0);

  static SegmentState create(
      int generatedColumn, int sourceIndex, int originalLine, int originalColumn,
      int nameIndex) {
    return new AutoValue_SegmentState(
        generatedColumn, sourceIndex, originalLine, originalColumn, nameIndex);
  }

  abstract int getGeneratedColumn();

  abstract int getSourceIndex();

  abstract int getOriginalLine();

  abstract int getOriginalColumn();

  abstract int getNameIndex();

  /** The state at the start of the next generated line. */
  SegmentState startLine() {
    return withGeneratedColumn(0);
  }

  SegmentState withGeneratedColumn(int generatedColumn) {
    return create(
        generatedColumn, getSourceIndex(), getOriginalLine(), getOriginalColumn(),
        getNameIndex());
  }

  /**
   * The state after {@code segment}. An unnamed segment leaves the name index
   * where the last named segment put it.
   */
  SegmentState advance(Segment segment) {
    return create(
        segment.getGeneratedColumn(),
        segment.getSourceIndex(),
        segment.getOriginalLine(),
        segment.getOriginalColumn(),
        segment.getNameIndex().orElse(getNameIndex()));
  }
}
