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

import com.google.debugging.sourceindex.Base64VLQ.CharIterator;

/**
 * A implementation of the Base64VLQ CharIterator used for decoding the
 * mappings encoded in the JSON string.
 */
final class StringCharIterator implements CharIterator {
  private final String content;
  private final int length;
  private int current = 0;

  StringCharIterator(String content) {
    this.content = content;
    this.length = content.length();
  }

  @Override
  public char next() {
    return content.charAt(current++);
  }

  char peek() {
    return content.charAt(current);
  }

  @Override
  public boolean hasNext() {
    return current < length;
  }

  /** The number of characters consumed so far. */
  int position() {
    return current;
  }
}
