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

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decodes the "mappings" field of a version 3 source map into a
 * {@link PositionIndex}.
 *
 * <p>Every entry of {@code sources} is present in the result, in order, even
 * if no segment refers to it. Every segment must carry 4 or 5 fields.
 */
public final class SourceMapDecoder {

  private static final Logger logger = Logger.getLogger(SourceMapDecoder.class.getName());

  private SourceMapDecoder() {}

  public static PositionIndex decode(SourceMapObject sourceMap) throws SourceMapParseException {
    return decode(sourceMap.getMappings(), sourceMap.getSources(), sourceMap.getNames());
  }

  /**
   * @param mappings the VLQ encoded mappings string
   * @param sources the source identifiers that source indices resolve to
   * @param names the symbol names that name indices resolve to
   * @throws MalformedVlqException if a value is not valid base64 VLQ
   * @throws MalformedMappingException if a segment has the wrong number of
   *     fields or resolves to a negative position
   * @throws MappingIndexOutOfRangeException if a segment refers past the end
   *     of {@code sources} or {@code names}
   */
  public static PositionIndex decode(String mappings, List<String> sources, List<String> names)
      throws SourceMapParseException {
    checkNotNull(mappings);
    checkNotNull(sources);
    checkNotNull(names);
    return new MappingBuilder(mappings, sources, names).build();
  }

  private static final class MappingBuilder {
    private final StringCharIterator content;
    private final List<String> sources;
    private final List<String> names;
    private final PositionIndex.Builder result = PositionIndex.builder();
    private final int[] fields = new int[SegmentCodec.NAMED_FIELD_COUNT];

    private int line = 0;
    private int segmentIndex = 0;
    private int segmentCount = 0;

    MappingBuilder(String mappings, List<String> sources, List<String> names) {
      this.content = new StringCharIterator(mappings);
      this.sources = sources;
      this.names = names;
    }

    PositionIndex build() throws SourceMapParseException {
      result.declareSources(sources);
      SegmentState state = SegmentState.INITIAL;
      while (content.hasNext()) {
        // ';' denotes a new line.
        if (tryConsumeToken(';')) {
          line++;
          segmentIndex = 0;
          state = state.startLine();
        } else {
          state = decodeSegment(state);
          segmentCount++;
          if (tryConsumeToken(',')) {
            segmentIndex++;
            if (!content.hasNext() || content.peek() == ';') {
              throw new MalformedMappingException("Empty segment", line, segmentIndex);
            }
          }
        }
      }
      logger.fine(
          "Decoded " + segmentCount + " segments on " + (line + 1) + " generated lines");
      return result.build();
    }

    private SegmentState decodeSegment(SegmentState state) throws SourceMapParseException {
      int fieldCount;
      try {
        fieldCount = SegmentCodec.readFields(content, fields);
      } catch (MalformedVlqException e) {
        throw new MalformedVlqException(
            "Generated line " + line + ", segment " + segmentIndex + ": " + e.getMessage(), e);
      }

      switch (fieldCount) {
        case 0:
          throw new MalformedMappingException("Empty segment", line, segmentIndex);

        case SegmentCodec.UNNAMED_FIELD_COUNT:
        case SegmentCodec.NAMED_FIELD_COUNT:
          Segment segment = SegmentCodec.decodeSegment(fields, fieldCount, state);
          addSegment(segment);
          return state.advance(segment);

        default:
          throw new MalformedMappingException(
              "Unexpected number of values for segment: " + fieldCount, line, segmentIndex);
      }
    }

    private void addSegment(Segment segment) throws SourceMapParseException {
      checkNotNegative(segment.getGeneratedColumn(), "generated column");
      checkNotNegative(segment.getOriginalLine(), "original line");
      checkNotNegative(segment.getOriginalColumn(), "original column");
      String source = resolve(sources, "source", segment.getSourceIndex());
      Optional<String> name = Optional.empty();
      if (segment.getNameIndex().isPresent()) {
        name = Optional.of(resolve(names, "name", segment.getNameIndex().getAsInt()));
      }
      result.add(
          source,
          segment.getOriginalLine(),
          segment.getOriginalColumn(),
          GeneratedPosition.create(line, segment.getGeneratedColumn(), name));
    }

    private String resolve(List<String> table, String tableName, int index)
        throws MappingIndexOutOfRangeException {
      if (index < 0 || index >= table.size()) {
        throw new MappingIndexOutOfRangeException(tableName, index, table.size(), line);
      }
      return table.get(index);
    }

    private void checkNotNegative(int value, String field) throws MalformedMappingException {
      if (value < 0) {
        throw new MalformedMappingException(
            "Negative " + field + ": " + value, line, segmentIndex);
      }
    }

    private boolean tryConsumeToken(char token) {
      if (content.hasNext() && content.peek() == token) {
        content.next();
        return true;
      }
      return false;
    }
  }
}
