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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Functions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The decoded form of a source map, organized by original location:
 * source ==> original line ==> original column ==> generated positions.
 *
 * <p>Sources are ordered by rank, the position at which each first appeared
 * in the {@code sources} array it was read from, rather than lexically. The
 * encoder walks the index in this order, so re-encoding reproduces the input
 * {@code sources} array.
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public final class PositionIndex {

  private final ImmutableList<String> sources;
  private final ImmutableSortedMap<String, FileIndex> files;

  private PositionIndex(
      ImmutableList<String> sources, ImmutableSortedMap<String, FileIndex> files) {
    this.sources = sources;
    this.files = files;
  }

  /**
   * Returns a comparator ranking source names by their first appearance in
   * {@code sources}. Names not in the list sort after it, lexically, so
   * lookups of unknown sources simply miss.
   */
  public static Comparator<String> sourceOrdering(List<String> sources) {
    Map<String, Integer> ranks = new LinkedHashMap<>();
    for (String source : sources) {
      ranks.putIfAbsent(source, ranks.size());
    }
    return Ordering.<Integer>natural()
        .onResultOf(Functions.forMap(ImmutableMap.copyOf(ranks), Integer.MAX_VALUE))
        .compound(Ordering.<String>natural());
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The distinct sources in rank order. */
  public ImmutableList<String> getSources() {
    return sources;
  }

  /** Source ==> per-file index, iterated in rank order. */
  public ImmutableSortedMap<String, FileIndex> getFiles() {
    return files;
  }

  /** Returns the index of one source, or null if the source is unknown. */
  public @Nullable FileIndex getFile(String source) {
    return files.get(source);
  }

  /**
   * Returns the generated positions recorded for an original location, or an
   * empty list if there are none.
   */
  public ImmutableList<GeneratedPosition> get(String source, int line, int column) {
    FileIndex file = files.get(source);
    return file == null ? ImmutableList.of() : file.get(line, column);
  }

  /** The total number of generated positions held. */
  public int positionCount() {
    int count = 0;
    for (FileIndex file : files.values()) {
      count += file.positionCount();
    }
    return count;
  }

  /**
   * Two indexes are equal when they hold the same positions under the same
   * keys. Source order is compared separately, through {@link #getSources}.
   */
  @Override
  public boolean equals(Object o) {
    return o instanceof PositionIndex && files.equals(((PositionIndex) o).files);
  }

  @Override
  public int hashCode() {
    return files.hashCode();
  }

  @Override
  public String toString() {
    return files.toString();
  }

  /**
   * Collects positions per source. A source takes its rank the first time it
   * is declared or receives a position.
   */
  public static final class Builder {
    private final Map<String, FileIndex.Builder> files = new LinkedHashMap<>();

    private Builder() {}

    /** Gives {@code source} the next rank, if it does not have one yet. */
    public Builder declareSource(String source) {
      fileBuilder(source);
      return this;
    }

    public Builder declareSources(List<String> sources) {
      for (String source : sources) {
        declareSource(source);
      }
      return this;
    }

    /** Appends a generated position to the list at the original location. */
    public Builder add(String source, int line, int column, GeneratedPosition position) {
      fileBuilder(source).add(line, column, position);
      return this;
    }

    /**
     * Appends {@code positions} to the list at the original location, creating
     * the location even when {@code positions} is empty.
     */
    public Builder addAll(
        String source, int line, int column, List<GeneratedPosition> positions) {
      fileBuilder(source).addAll(line, column, positions);
      return this;
    }

    private FileIndex.Builder fileBuilder(String source) {
      checkNotNull(source);
      return files.computeIfAbsent(source, k -> FileIndex.builder());
    }

    public PositionIndex build() {
      ImmutableList<String> sources = ImmutableList.copyOf(files.keySet());
      ImmutableSortedMap.Builder<String, FileIndex> result =
          ImmutableSortedMap.orderedBy(sourceOrdering(sources));
      for (Map.Entry<String, FileIndex.Builder> entry : files.entrySet()) {
        result.put(entry.getKey(), entry.getValue().build());
      }
      return new PositionIndex(sources, result.build());
    }
  }
}
