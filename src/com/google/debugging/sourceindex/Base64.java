/*
 * Copyright 2011 The Closure Compiler Authors.
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

import java.util.Arrays;

/**
 * The base64 digit alphabet used by source map v3 mappings.
 */
final class Base64 {

  // This is a utility class
  private Base64() {}

  /** Returned by {@link #fromBase64} for characters outside the alphabet. */
  static final int INVALID = -1;

  /**
   *  A map used to convert integer values in the range 0-63 to their base64
   *  values.
   */
  private static final String BASE64_MAP =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZ" +
      "abcdefghijklmnopqrstuvwxyz" +
      "0123456789+/";

  /**
   * A map used to convert base64 character into integer values.
   */
  private static final int[] BASE64_DECODE_MAP = new int[128];
  static {
      Arrays.fill(BASE64_DECODE_MAP, INVALID);
      for (int i = 0; i < BASE64_MAP.length(); i++) {
        BASE64_DECODE_MAP[BASE64_MAP.charAt(i)] = i;
      }
  }

  /**
   * @param value A value in the range of 0-63.
   * @return a base64 digit.
   */
  static char toBase64(int value) {
    if (value < 0 || value > 63) {
      throw new IllegalArgumentException("value out of range:" + value);
    }
    return BASE64_MAP.charAt(value);
  }

  /**
   * @param c A character that may be a base64 digit.
   * @return A value in the range of 0-63, or {@link #INVALID}.
   */
  static int fromBase64(char c) {
    return c < BASE64_DECODE_MAP.length ? BASE64_DECODE_MAP[c] : INVALID;
  }
}
