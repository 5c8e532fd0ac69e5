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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** Common {@link SourcePathMapping} strategies. */
public final class SourcePathMappings {

  private static final String JAR_SEPARATOR = ".jar!";

  private SourcePathMappings() {}

  /** Writes every source identifier unchanged. */
  public static SourcePathMapping identity() {
    return Identity.INSTANCE;
  }

  /** Writes the last '/' separated segment of each source identifier. */
  public static SourcePathMapping basename() {
    return Basename.INSTANCE;
  }

  /**
   * Writes source paths relative to where the compiled output lives.
   *
   * <p>A path inside a jar ({@code lib.jar!/goog/base.js}) becomes the base
   * followed by the part after the jar. Any other path becomes the base, a
   * '/', and its entry in {@code relativePaths}, or its basename if it has
   * none. The base is {@code sourceMapPath} when given, otherwise
   * {@code outputDir}.
   */
  public static SourcePathMapping relativeTo(
      String outputDir, @Nullable String sourceMapPath, Map<String, String> relativePaths) {
    return new RelativeToOutput(
        sourceMapPath != null ? sourceMapPath : checkNotNull(outputDir),
        ImmutableMap.copyOf(relativePaths));
  }

  /**
   * Replaces a leading {@code prefix} with {@code replacement}. Paths without
   * the prefix are not mapped.
   */
  public static SourcePathMapping prefix(String prefix, String replacement) {
    return new PrefixMapping(checkNotNull(prefix), checkNotNull(replacement));
  }

  /** Applies the first of {@code mappings} that maps a path. */
  public static SourcePathMapping firstMatch(List<? extends SourcePathMapping> mappings) {
    return new FirstMatch(ImmutableList.copyOf(mappings));
  }

  static String basenameOf(String path) {
    return path.substring(path.lastIndexOf('/') + 1);
  }

  private enum Identity implements SourcePathMapping {
    INSTANCE;

    @Override
    public String map(String sourcePath) {
      return sourcePath;
    }
  }

  private enum Basename implements SourcePathMapping {
    INSTANCE;

    @Override
    public String map(String sourcePath) {
      return basenameOf(sourcePath);
    }
  }

  private static final class RelativeToOutput implements SourcePathMapping {
    private static final long serialVersionUID = 1L;

    private final String base;
    private final ImmutableMap<String, String> relativePaths;

    RelativeToOutput(String base, ImmutableMap<String, String> relativePaths) {
      this.base = base;
      this.relativePaths = relativePaths;
    }

    @Override
    public String map(String sourcePath) {
      int jar = sourcePath.indexOf(JAR_SEPARATOR + "/");
      if (jar >= 0) {
        return base + sourcePath.substring(jar + JAR_SEPARATOR.length());
      }
      String relative = relativePaths.get(sourcePath);
      return base + "/" + (relative != null ? relative : basenameOf(sourcePath));
    }
  }

  private static final class PrefixMapping implements SourcePathMapping {
    private static final long serialVersionUID = 1L;

    private final String prefix;
    private final String replacement;

    PrefixMapping(String prefix, String replacement) {
      this.prefix = prefix;
      this.replacement = replacement;
    }

    @Override
    public @Nullable String map(String sourcePath) {
      if (sourcePath.startsWith(prefix)) {
        return replacement + sourcePath.substring(prefix.length());
      }
      return null;
    }

    @Override
    public String toString() {
      return "(" + prefix + "|" + replacement + ")";
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof PrefixMapping) {
        PrefixMapping that = (PrefixMapping) other;
        return that.prefix.equals(prefix) && that.replacement.equals(replacement);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(prefix, replacement);
    }
  }

  private static final class FirstMatch implements SourcePathMapping {
    private static final long serialVersionUID = 1L;

    private final ImmutableList<SourcePathMapping> mappings;

    FirstMatch(ImmutableList<SourcePathMapping> mappings) {
      this.mappings = mappings;
    }

    @Override
    public @Nullable String map(String sourcePath) {
      for (SourcePathMapping mapping : mappings) {
        String mapped = mapping.map(sourcePath);
        if (mapped != null) {
          return mapped;
        }
      }
      return null;
    }
  }
}
