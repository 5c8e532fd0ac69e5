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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Reads a source map, optionally composes it with the map of a later
 * compilation step, and writes the re-encoded result.
 *
 * <pre>
 * SourceMapTool --input app.js.map --compose_with app.min.js.map \
 *     --output app.min.js.map.merged
 * </pre>
 */
public final class SourceMapTool {

  private static final Logger logger = Logger.getLogger(SourceMapTool.class.getName());

  @Option(name = "--help",
      hidden = true,
      handler = BooleanOptionHandler.class,
      usage = "Show instructions for how to use the source map tool")
  private boolean displayHelp = false;

  @Option(name = "--input", usage = "The source map to read.")
  private String input = null;

  @Option(
      name = "--compose_with",
      usage = "A source map of a later compilation step whose sources include the file "
          + "--input describes. The result maps the sources of --input to the output of "
          + "this map.")
  private String composeWith = null;

  @Option(
      name = "--intermediate_source",
      usage = "The source of --compose_with that --input describes. Needed only when "
          + "--compose_with has more than one source.")
  private String intermediateSource = null;

  @Option(name = "--output", usage = "Where to write the result. Defaults to stdout.")
  private String output = null;

  @Option(name = "--file", usage = "The \"file\" field of the result.")
  private String file = null;

  @Option(name = "--line_count", usage = "The \"lineCount\" field of the result.")
  private int lineCount = SourceMapObject.UNKNOWN_LINE_COUNT;

  @Option(
      name = "--output_dir",
      usage = "Write sources relative to this directory.")
  private String outputDir = null;

  @Option(
      name = "--source_map_path",
      usage = "Used instead of --output_dir as the base of relative sources.")
  private String sourceMapPath = null;

  @Option(
      name = "--relative_path",
      usage = "A source=path pair giving the path of a source relative to --output_dir. "
          + "May be repeated. Sources without one are written as their file name.")
  private List<String> relativePaths = new ArrayList<>();

  @Option(
      name = "--basename_sources",
      usage = "Write only the file name of each source. Ignored with --output_dir.")
  private boolean basenameSources = false;

  @Option(name = "--verbose", usage = "Log statistics about each step.")
  private boolean verbose = false;

  /** Returns the process exit status. */
  @VisibleForTesting
  int doMain(String[] args, PrintStream out, PrintStream err) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return 1;
    }
    if (displayHelp) {
      parser.printUsage(out);
      return 0;
    }
    if (input == null) {
      err.println("--input must be provided");
      parser.printUsage(err);
      return 1;
    }

    if (verbose) {
      Logger.getLogger("com.google.debugging.sourceindex").setLevel(Level.FINE);
    }

    try {
      String json = SourceMapWriter.toJson(run());
      if (output == null) {
        out.print(json);
      } else {
        Files.asCharSink(new File(output), UTF_8).write(json);
        logger.info("Wrote " + output);
      }
      return 0;
    } catch (SourceMapParseException | IOException | IllegalArgumentException e) {
      err.println("ERROR - " + e.getMessage());
      return 1;
    }
  }

  private SourceMapObject run() throws SourceMapParseException, IOException {
    SourceMapObject inputMap = read(input);
    PositionIndex index = SourceMapDecoder.decode(inputMap);
    SourceMapObject target = inputMap;

    if (composeWith != null) {
      SourceMapObject laterMap = read(composeWith);
      PositionIndex later = SourceMapDecoder.decode(laterMap);
      index = intermediateSource != null
          ? SourceMapMerger.merge(index, later, intermediateSource)
          : SourceMapMerger.merge(index, later);
      target = laterMap;
    }

    SourceMapEncoderOptions options = new SourceMapEncoderOptions()
        .setFile(file != null ? file : target.getFile())
        .setLineCount(
            lineCount != SourceMapObject.UNKNOWN_LINE_COUNT ? lineCount : target.getLineCount());
    if (outputDir != null) {
      options.setSourcePathMapping(
          SourcePathMappings.relativeTo(outputDir, sourceMapPath, parseRelativePaths()));
    } else if (basenameSources) {
      options.setSourcePathMapping(SourcePathMappings.basename());
    }
    return SourceMapEncoder.encode(index, options);
  }

  private ImmutableMap<String, String> parseRelativePaths() {
    ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
    for (String pair : relativePaths) {
      List<String> parts = Splitter.on('=').limit(2).splitToList(pair);
      checkArgument(
          parts.size() == 2 && !parts.get(0).isEmpty(),
          "--relative_path expects source=path, got %s",
          pair);
      result.put(parts.get(0), parts.get(1));
    }
    return result.buildOrThrow();
  }

  private static SourceMapObject read(String path) throws SourceMapParseException, IOException {
    logger.fine("Reading " + path);
    return SourceMapObjectParser.parse(Files.asCharSource(new File(path), UTF_8).read());
  }

  public static void main(String[] args) {
    System.exit(new SourceMapTool().doMain(args, System.out, System.err));
  }
}
