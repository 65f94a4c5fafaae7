/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.profiler.format;

/**
 * Layout of the input stream.
 */
public enum InputFormat {
  /** Delimited text with one record per line. */
  CSV,
  /** One JSON object per line (JSON Lines). */
  JSON_LINES,
  /** A single top-level JSON array of objects. */
  JSON_ARRAY;

  public boolean isJson() {
    return this != CSV;
  }

  /**
   * Detects the format from the first non-whitespace byte of a sample.
   *
   * <p>{@code '{'} selects JSON Lines, {@code '['} a JSON array and anything
   * else delimited text. A leading UTF-8 byte order mark is skipped.
   *
   * @param sample Leading bytes of the input
   * @param length Number of valid bytes in {@code sample}
   */
  public static InputFormat detect(byte[] sample, int length) {
    int i = 0;
    if (length >= 3 && (sample[0] & 0xFF) == 0xEF && (sample[1] & 0xFF) == 0xBB
        && (sample[2] & 0xFF) == 0xBF) {
      i = 3;
    }
    for (; i < length; i++) {
      byte b = sample[i];
      if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
        continue;
      }
      if (b == '{') {
        return JSON_LINES;
      }
      if (b == '[') {
        return JSON_ARRAY;
      }
      return CSV;
    }
    return CSV;
  }
}
