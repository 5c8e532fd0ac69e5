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

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Maps a source identifier to the path written to the "sources" array of an
 * encoded source map.
 *
 * @see SourcePathMappings
 */
@FunctionalInterface
public interface SourcePathMapping extends Serializable {
  /**
   * @param sourcePath the source identifier held by the position index
   * @return the transformed path, or null if this mapping does not apply and
   *     the identifier should be written unchanged
   */
  @Nullable String map(String sourcePath);
}
