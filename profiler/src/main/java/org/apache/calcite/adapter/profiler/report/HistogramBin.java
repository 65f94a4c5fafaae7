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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One equal-width histogram bin.
 */
@JsonPropertyOrder({"rangeStart", "rangeEnd", "count"})
public final class HistogramBin {
  private final double rangeStart;
  private final double rangeEnd;
  private final long count;

  public HistogramBin(double rangeStart, double rangeEnd, long count) {
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
    this.count = count;
  }

  @JsonProperty("rangeStart")
  public double getRangeStart() {
    return rangeStart;
  }

  @JsonProperty("rangeEnd")
  public double getRangeEnd() {
    return rangeEnd;
  }

  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  @Override public String toString() {
    return "[" + rangeStart + ", " + rangeEnd + "): " + count;
  }
}
