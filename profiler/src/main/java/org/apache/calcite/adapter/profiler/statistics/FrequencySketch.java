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
package org.apache.calcite.adapter.profiler.statistics;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Count-min frequency sketch.
 *
 * <p>A {@code depth x width} table of counters; each row is addressed by a
 * different hash of the value. Collisions can only inflate a counter, so the
 * minimum across rows is an upper bound on the true count.
 */
public class FrequencySketch {
  private static final HashFunction HASH = Hashing.murmur3_128();

  private final int width;
  private final int depth;
  private final long[][] counters;

  public FrequencySketch(int width, int depth) {
    if (width < 1 || depth < 1) {
      throw new IllegalArgumentException("width and depth must be positive");
    }
    this.width = width;
    this.depth = depth;
    this.counters = new long[depth][width];
  }

  /**
   * Increments the counters of a value.
   *
   * @return The estimated count after the increment
   */
  public long add(String value) {
    ByteBuffer hash = ByteBuffer.wrap(HASH.hashString(value, StandardCharsets.UTF_8).asBytes())
        .order(ByteOrder.LITTLE_ENDIAN);
    long h1 = hash.getLong(0);
    long h2 = hash.getLong(8);
    long estimate = Long.MAX_VALUE;
    for (int row = 0; row < depth; row++) {
      int column = bucket(h1, h2, row);
      long count = ++counters[row][column];
      estimate = Math.min(estimate, count);
    }
    return estimate;
  }

  /**
   * Returns the estimated count of a value.
   */
  public long estimate(String value) {
    ByteBuffer hash = ByteBuffer.wrap(HASH.hashString(value, StandardCharsets.UTF_8).asBytes())
        .order(ByteOrder.LITTLE_ENDIAN);
    long h1 = hash.getLong(0);
    long h2 = hash.getLong(8);
    long estimate = Long.MAX_VALUE;
    for (int row = 0; row < depth; row++) {
      estimate = Math.min(estimate, counters[row][bucket(h1, h2, row)]);
    }
    return estimate;
  }

  private int bucket(long h1, long h2, int row) {
    long combined = h1 + (row + 1) * (h2 | 1L);
    return (int) Math.floorMod(combined, (long) width);
  }

  /**
   * Returns the size of the counter table, which never changes.
   */
  public long sizeInBytes() {
    return (long) width * depth * Long.BYTES;
  }
}
