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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * HyperLogLog distinct-count sketch.
 *
 * <p>Uses 2^p one-byte registers. Each value is hashed to 64 bits with
 * Murmur3; the top p bits select a register and the register keeps the largest
 * rank (trailing zeros of the remaining bits, plus one) seen. The estimate is
 * the bias-corrected harmonic mean of the registers with linear counting for
 * small cardinalities. Standard error is about 1.04 / sqrt(2^p).
 */
public class HyperLogLogSketch {
  private static final HashFunction HASH = Hashing.murmur3_128();

  private final int precision;
  private final int registerCount;
  private final byte[] registers;
  private final double alphaMM;

  public HyperLogLogSketch(int precision) {
    if (precision < 4 || precision > 18) {
      throw new IllegalArgumentException("precision must be between 4 and 18: " + precision);
    }
    this.precision = precision;
    this.registerCount = 1 << precision;
    this.registers = new byte[registerCount];
    this.alphaMM = alpha(registerCount) * registerCount * registerCount;
  }

  /**
   * Adds a value.
   */
  public void add(String value) {
    addHash(HASH.hashString(value, StandardCharsets.UTF_8).asLong());
  }

  void addHash(long hash) {
    int index = (int) (hash >>> (64 - precision));
    long remaining = hash & ((1L << (64 - precision)) - 1);
    int rank = Math.min(Long.numberOfTrailingZeros(remaining), 64 - precision) + 1;
    if (rank > registers[index]) {
      registers[index] = (byte) rank;
    }
  }

  /**
   * Returns the estimated number of distinct values added.
   */
  public long getEstimate() {
    double sum = 0;
    int zeros = 0;
    for (byte register : registers) {
      sum += Math.scalb(1.0, -register);
      if (register == 0) {
        zeros++;
      }
    }
    double raw = alphaMM / sum;
    if (raw <= 2.5 * registerCount && zeros != 0) {
      // Small range correction
      return Math.round(registerCount * Math.log(registerCount / (double) zeros));
    }
    return Math.round(raw);
  }

  /**
   * Merges another sketch of the same precision into this one.
   */
  public void merge(HyperLogLogSketch other) {
    if (other.precision != precision) {
      throw new IllegalArgumentException(
          "Cannot merge sketches with different precision: " + precision + " vs " + other.precision);
    }
    for (int i = 0; i < registerCount; i++) {
      registers[i] = (byte) Math.max(registers[i], other.registers[i]);
    }
  }

  public void clear() {
    Arrays.fill(registers, (byte) 0);
  }

  public int getPrecision() {
    return precision;
  }

  /**
   * Returns the size of the register array, which never changes.
   */
  public int sizeInBytes() {
    return registerCount;
  }

  private static double alpha(int m) {
    switch (m) {
    case 16:
      return 0.673;
    case 32:
      return 0.697;
    case 64:
      return 0.709;
    default:
      return 0.7213 / (1 + 1.079 / m);
    }
  }
}
