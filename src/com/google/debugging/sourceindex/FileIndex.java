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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The positions of a single original file: original line to original column
 * to the generated positions that location was emitted at. Both levels are
 * ordered by their integer key.
 *
 * <p>A column holds a list because an optimizer may place one original
 * location at several generated locations. A column can also hold an empty
 * list, when every generated position it had was dropped by a merge.
 */
public final class FileIndex {

  private static final FileIndex EMPTY = new Builder().build();

  private final ImmutableSortedMap<Integer,
      ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>> lines;

  private FileIndex(
      ImmutableSortedMap<Integer,
          ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>> lines) {
    this.lines = lines;
  }

  public static FileIndex empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Original line ==> original column ==> generated positions. */
  public ImmutableSortedMap<Integer, ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>>
      getLines() {
    return lines;
  }

  /**
   * Returns the generated positions recorded for an original location, or an
   * empty list if there are none.
   */
  public ImmutableList<GeneratedPosition> get(int line, int column) {
    ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>> columns = lines.get(line);
    if (columns == null) {
      return ImmutableList.of();
    }
    ImmutableList<GeneratedPosition> positions = columns.get(column);
    return positions == null ? ImmutableList.of() : positions;
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  /** The total number of generated positions held. */
  public int positionCount() {
    int count = 0;
    for (ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>> columns
        : lines.values()) {
      for (ImmutableList<GeneratedPosition> positions : columns.values()) {
        count += positions.size();
      }
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FileIndex && lines.equals(((FileIndex) o).lines);
  }

  @Override
  public int hashCode() {
    return lines.hashCode();
  }

  @Override
  public String toString() {
    return lines.toString();
  }

  /** Accumulates positions in any order; {@link #build} sorts them. */
  public static final class Builder {
    private final TreeMap<Integer, TreeMap<Integer, List<GeneratedPosition>>> lines =
        new TreeMap<>();

    private Builder() {}

    /** Appends a generated position to the list at the original location. */
    public Builder add(int line, int column, GeneratedPosition position) {
      checkNotNull(position);
      positionsAt(line, column).add(position);
      return this;
    }

    /**
     * Appends all of {@code positions} to the list at the original location,
     * creating the location even when {@code positions} is empty.
     */
    public Builder addAll(int line, int column, List<GeneratedPosition> positions) {
      List<GeneratedPosition> target = positionsAt(line, column);
      for (GeneratedPosition position : positions) {
        target.add(checkNotNull(position));
      }
      return this;
    }

    private List<GeneratedPosition> positionsAt(int line, int column) {
      return lines
          .computeIfAbsent(line, k -> new TreeMap<>())
          .computeIfAbsent(column, k -> new ArrayList<>());
    }

    public FileIndex build() {
      ImmutableSortedMap.Builder<Integer,
          ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>> result =
          ImmutableSortedMap.naturalOrder();
      for (Map.Entry<Integer, TreeMap<Integer, List<GeneratedPosition>>> line
          : lines.entrySet()) {
        ImmutableSortedMap.Builder<Integer, ImmutableList<GeneratedPosition>> columns =
            ImmutableSortedMap.naturalOrder();
        for (Map.Entry<Integer, List<GeneratedPosition>> column : line.getValue().entrySet()) {
          columns.put(column.getKey(), ImmutableList.copyOf(column.getValue()));
        }
        result.put(line.getKey(), columns.build());
      }
      return new FileIndex(result.build());
    }
  }
}
