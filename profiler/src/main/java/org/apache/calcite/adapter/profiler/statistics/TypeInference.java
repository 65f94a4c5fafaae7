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

import org.apache.calcite.adapter.profiler.value.DataType;
import org.apache.calcite.adapter.profiler.value.FieldDecoder;
import org.apache.calcite.adapter.profiler.value.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Sample-window type vote of one column.
 *
 * <p>Non-missing values are classified, counted per candidate type and kept so
 * they can be replayed once the type is locked. The window is ready once it has
 * seen {@code windowSize} records and at least one non-missing value.
 */
public class TypeInference {
  private final int windowSize;
  private final double threshold;
  private final Map<DataType, Integer> votes = new EnumMap<>(DataType.class);
  private final List<Value> pending = new ArrayList<>();
  private int records;

  public TypeInference(int windowSize, double threshold) {
    this.windowSize = windowSize;
    this.threshold = threshold;
  }

  /**
   * Records one classified value, missing or not.
   */
  public void observe(Value value) {
    records++;
    if (!value.isMissing()) {
      votes.merge(FieldDecoder.candidateType(value), 1, Integer::sum);
      pending.add(value);
    }
  }

  public boolean isReady() {
    return records >= windowSize && !pending.isEmpty();
  }

  /**
   * Returns the values retained for replay, in arrival order, and clears them.
   */
  public List<Value> drain() {
    List<Value> values = new ArrayList<>(pending);
    pending.clear();
    return values;
  }

  public int getPendingCount() {
    return pending.size();
  }

  /**
   * Decides the column type from the votes so far.
   */
  public DataType decide() {
    return decide(votes, threshold);
  }

  /**
   * Applies the locking rule: Integer, then Numeric (Integer and Numeric votes
   * together), Boolean, Date, DateTime (Date and DateTime votes together), and
   * String each win when their share is strictly greater than the threshold;
   * otherwise Mixed. No votes at all gives Empty.
   */
  public static DataType decide(Map<DataType, Integer> votes, double threshold) {
    int total = 0;
    for (int count : votes.values()) {
      total += count;
    }
    if (total == 0) {
      return DataType.EMPTY;
    }
    int integers = votes.getOrDefault(DataType.INTEGER, 0);
    int numerics = votes.getOrDefault(DataType.NUMERIC, 0);
    int booleans = votes.getOrDefault(DataType.BOOLEAN, 0);
    int dates = votes.getOrDefault(DataType.DATE, 0);
    int dateTimes = votes.getOrDefault(DataType.DATETIME, 0);
    int strings = votes.getOrDefault(DataType.STRING, 0);

    if (exceeds(integers, total, threshold)) {
      return DataType.INTEGER;
    }
    if (exceeds(integers + numerics, total, threshold)) {
      return DataType.NUMERIC;
    }
    if (exceeds(booleans, total, threshold)) {
      return DataType.BOOLEAN;
    }
    if (exceeds(dates, total, threshold)) {
      return DataType.DATE;
    }
    if (exceeds(dates + dateTimes, total, threshold)) {
      return DataType.DATETIME;
    }
    if (exceeds(strings, total, threshold)) {
      return DataType.STRING;
    }
    return DataType.MIXED;
  }

  private static boolean exceeds(int count, int total, double threshold) {
    return (double) count / total > threshold;
  }
}
