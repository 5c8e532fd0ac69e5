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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Encodes a {@link PositionIndex} as a version 3 source map.
 *
 * <p>The index is walked in source, original line, original column order.
 * Each generated position becomes a segment on its generated line; lines with
 * no segments are kept as empty groups so that line numbers never shift.
 * Within a line, segments are ordered by generated column. Names are numbered
 * in the order the walk first meets them, and sources in index order.
 *
 * <p>Because of that sort, decoding the output preserves the order of a
 * position list only when positions sharing a generated line were already
 * listed by increasing column.
 */
public final class SourceMapEncoder {

  private static final Logger logger = Logger.getLogger(SourceMapEncoder.class.getName());

  private static final Comparator<Segment> BY_GENERATED_COLUMN =
      Comparator.comparingInt(Segment::getGeneratedColumn);

  private SourceMapEncoder() {}

  /**
   * @throws InvalidPositionException if the index holds a negative coordinate
   *     or maps lines beyond {@link SourceMapEncoderOptions#getLineCount}
   */
  public static SourceMapObject encode(PositionIndex index, SourceMapEncoderOptions options) {
    validate(index, options);

    Map<String, Integer> originalNameMap = new LinkedHashMap<>();
    List<List<Segment>> lines = new ArrayList<>();

    int sourceIndex = 0;
    for (FileIndex file : index.getFiles().values()) {
      for (Map.Entry<Integer, ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>>
          line : file.getLines().entrySet()) {
        for (Map.Entry<Integer, ImmutableList<GeneratedPosition>> column
            : line.getValue().entrySet()) {
          for (GeneratedPosition position : column.getValue()) {
            Segment segment;
            if (position.getName().isPresent()) {
              segment = Segment.create(
                  position.getColumn(), sourceIndex, line.getKey(), column.getKey(),
                  getNameId(originalNameMap, position.getName().get()));
            } else {
              segment = Segment.create(
                  position.getColumn(), sourceIndex, line.getKey(), column.getKey());
            }
            segmentsOnLine(lines, position.getLine()).add(segment);
          }
        }
      }
      sourceIndex++;
    }

    String mappings = appendLineMappings(lines);

    ImmutableList.Builder<String> sources = ImmutableList.builder();
    SourcePathMapping sourcePathMapping = options.getSourcePathMapping();
    for (String source : index.getSources()) {
      String mapped = sourcePathMapping.map(source);
      sources.add(mapped != null ? mapped : source);
    }

    logger.fine(
        "Encoded " + index.positionCount() + " positions on " + lines.size()
            + " generated lines with " + originalNameMap.size() + " names");

    return SourceMapObject.builder()
        .setFile(options.getFile())
        .setLineCount(options.getLineCount())
        .setSources(sources.build())
        .setNames(ImmutableList.copyOf(originalNameMap.keySet()))
        .setMappings(mappings)
        .build();
  }

  /** Returns the segment list of a generated line, adding empty lines before it. */
  private static List<Segment> segmentsOnLine(List<List<Segment>> lines, int generatedLine) {
    while (lines.size() <= generatedLine) {
      lines.add(new ArrayList<>());
    }
    return lines.get(generatedLine);
  }

  private static int getNameId(Map<String, Integer> originalNameMap, String symbolName) {
    Integer index = originalNameMap.get(symbolName);
    if (index != null) {
      return index;
    }
    int originalNameIndex = originalNameMap.size();
    originalNameMap.put(symbolName, originalNameIndex);
    return originalNameIndex;
  }

  private static String appendLineMappings(List<List<Segment>> lines) {
    StringBuilder out = new StringBuilder();
    SegmentState previous = SegmentState.INITIAL;
    try {
      for (int i = 0; i < lines.size(); i++) {
        if (i > 0) {
          out.append(';');
        }
        previous = previous.startLine();
        List<Segment> segments = lines.get(i);
        segments.sort(BY_GENERATED_COLUMN);
        for (int j = 0; j < segments.size(); j++) {
          if (j > 0) {
            out.append(',');
          }
          Segment segment = segments.get(j);
          SegmentCodec.appendSegment(out, segment, previous);
          previous = previous.advance(segment);
        }
      }
    } catch (IOException e) {
      // Can't happen.
      throw new RuntimeException(e);
    }
    return out.toString();
  }

  /** Checks the whole index before anything is encoded. */
  private static void validate(PositionIndex index, SourceMapEncoderOptions options) {
    int lastGeneratedLine = -1;
    for (Map.Entry<String, FileIndex> file : index.getFiles().entrySet()) {
      for (Map.Entry<Integer, ImmutableSortedMap<Integer, ImmutableList<GeneratedPosition>>>
          line : file.getValue().getLines().entrySet()) {
        for (Map.Entry<Integer, ImmutableList<GeneratedPosition>> column
            : line.getValue().entrySet()) {
          if (line.getKey() < 0 || column.getKey() < 0) {
            throw new InvalidPositionException(
                "Negative original position " + file.getKey() + ":" + line.getKey() + ":"
                    + column.getKey());
          }
          for (GeneratedPosition position : column.getValue()) {
            if (position.getLine() < 0 || position.getColumn() < 0) {
              throw new InvalidPositionException(
                  "Negative generated position " + position + " for " + file.getKey() + ":"
                      + line.getKey() + ":" + column.getKey());
            }
            lastGeneratedLine = Math.max(lastGeneratedLine, position.getLine());
          }
        }
      }
    }
    if (options.hasLineCount() && lastGeneratedLine >= options.getLineCount()) {
      throw new InvalidPositionException(
          "Generated line " + lastGeneratedLine + " is beyond the line count "
              + options.getLineCount());
    }
  }
}
