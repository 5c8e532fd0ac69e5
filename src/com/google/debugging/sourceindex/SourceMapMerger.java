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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Composes the source maps of two successive compilation steps.
 *
 * <p>The first map takes original sources to an intermediate file, for
 * example the output of a source level compiler. The second takes that
 * intermediate file to the final output, for example after whole program
 * optimization. The merged map keeps the original locations of the first map
 * and the final generated positions of the second.
 *
 * <p>An intermediate position the second map does not know about was removed
 * by the second step. It is dropped; the original location stays in the
 * result with whatever positions remain, possibly none.
 */
public final class SourceMapMerger {

  private static final Logger logger = Logger.getLogger(SourceMapMerger.class.getName());

  private SourceMapMerger() {}

  /**
   * @param first original sources ==> intermediate file positions
   * @param second intermediate file locations ==> final positions
   */
  public static PositionIndex merge(PositionIndex first, FileIndex second) {
    PositionIndex.Builder result = PositionIndex.builder();
    int dropped = 0;
    for (Map.Entry<String, FileIndex> file : first.getFiles().entrySet()) {
      String source = file.getKey();
      result.declareSource(source);
      for (Map.Entry<Integer, ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>>
          line : file.getValue().getLines().entrySet()) {
        for (Map.Entry<Integer, ImmutableList<GeneratedPosition>> column
            : line.getValue().entrySet()) {
          List<GeneratedPosition> merged = new ArrayList<>();
          for (GeneratedPosition intermediate : column.getValue()) {
            ImmutableList<GeneratedPosition> targets =
                second.get(intermediate.getLine(), intermediate.getColumn());
            if (targets.isEmpty()) {
              dropped++;
            }
            merged.addAll(targets);
          }
          result.addAll(source, line.getKey(), column.getKey(), merged);
        }
      }
    }
    logger.fine("Dropped " + dropped + " intermediate positions with no final position");
    return result.build();
  }

  /**
   * Merges with a second map that describes a single intermediate file. An
   * empty second map drops every position.
   *
   * @throws IllegalArgumentException if {@code second} has more than one
   *     source
   */
  public static PositionIndex merge(PositionIndex first, PositionIndex second) {
    ImmutableList<String> sources = second.getSources();
    checkArgument(
        sources.size() <= 1,
        "Expected a single intermediate source, found %s; name the intermediate source",
        sources);
    return merge(first, sources.isEmpty() ? FileIndex.empty() : second.getFile(sources.get(0)));
  }

  /**
   * Merges with the part of {@code second} that describes
   * {@code intermediateSource}. If {@code second} has no such source, every
   * position is dropped.
   */
  public static PositionIndex merge(
      PositionIndex first, PositionIndex second, String intermediateSource) {
    FileIndex file = second.getFile(intermediateSource);
    return merge(first, file == null ? FileIndex.empty() : file);
  }
}
