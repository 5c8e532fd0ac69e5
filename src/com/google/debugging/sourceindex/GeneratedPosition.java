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
import java.util.Optional;

/**
 * A place in the generated file that an original source location maps to.
 * Lines and columns are 0-based, as in the v3 format.
 */
@AutoValue
public abstract class GeneratedPosition {

  public static GeneratedPosition create(int line, int column) {
    return new AutoValue_GeneratedPosition(line, column, Optional.empty());
  }

  public static GeneratedPosition create(int line, int column, String name) {
    return new AutoValue_GeneratedPosition(line, column, Optional.of(name));
  }

  public static GeneratedPosition create(int line, int column, Optional<String> name) {
    return new AutoValue_GeneratedPosition(line, column, name);
  }

  /** The line in the generated file. */
  public abstract int getLine();

  /** The column on the generated line. */
  public abstract int getColumn();

  /** The original name of the symbol at this position, if any. */
  public abstract Optional<String> getName();
}
