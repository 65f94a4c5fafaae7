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
 * Element counts of the JSON arrays found in a column.
 */
@JsonPropertyOrder({"count", "minLength", "maxLength", "avgLength"})
public final class ArrayStats {
  private final long count;
  private final int minLength;
  private final int maxLength;
  private final double avgLength;

  public ArrayStats(long count, int minLength, int maxLength, double avgLength) {
    this.count = count;
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.avgLength = avgLength;
  }

  /** Number of records in which the column held an array. */
  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  @JsonProperty("minLength")
  public int getMinLength() {
    return minLength;
  }

  @JsonProperty("maxLength")
  public int getMaxLength() {
    return maxLength;
  }

  @JsonProperty("avgLength")
  public double getAvgLength() {
    return avgLength;
  }
}
