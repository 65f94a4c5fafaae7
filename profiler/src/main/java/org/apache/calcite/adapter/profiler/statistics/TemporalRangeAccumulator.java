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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDateTime;

/**
 * Earliest and latest value of a Date or DateTime column.
 */
public class TemporalRangeAccumulator {
  private @Nullable LocalDateTime min;
  private @Nullable LocalDateTime max;

  public void add(LocalDateTime value) {
    if (min == null || value.isBefore(min)) {
      min = value;
    }
    if (max == null || value.isAfter(max)) {
      max = value;
    }
  }

  public @Nullable LocalDateTime getMin() {
    return min;
  }

  public @Nullable LocalDateTime getMax() {
    return max;
  }
}
