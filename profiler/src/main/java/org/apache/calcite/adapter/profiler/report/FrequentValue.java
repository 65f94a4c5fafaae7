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
 * A frequent value with its estimated count.
 */
@JsonPropertyOrder({"value", "count", "percentage"})
public final class FrequentValue {
  private final String value;
  private final long count;
  private final double percentage;

  public FrequentValue(String value, long count, double percentage) {
    this.value = value;
    this.count = count;
    this.percentage = percentage;
  }

  @JsonProperty("value")
  public String getValue() {
    return value;
  }

  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  /**
   * Returns the count as a percentage of the column's categorical values.
   */
  @JsonProperty("percentage")
  public double getPercentage() {
    return percentage;
  }

  @Override public String toString() {
    return value + "=" + count;
  }
}
