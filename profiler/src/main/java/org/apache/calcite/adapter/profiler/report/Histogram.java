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
package org.apache.calcite.adapter.profiler.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Equal-width histogram over {@code [min, max]} of a numeric column.
 */
public final class Histogram {
  private final List<HistogramBin> bins;

  public Histogram(List<HistogramBin> bins) {
    this.bins = ImmutableList.copyOf(bins);
  }

  @JsonProperty("bins")
  public List<HistogramBin> getBins() {
    return bins;
  }

  /**
   * Returns the sum of all bin counts.
   */
  @JsonIgnore
  public long getTotalCount() {
    long total = 0;
    for (HistogramBin bin : bins) {
      total += bin.getCount();
    }
    return total;
  }
}
