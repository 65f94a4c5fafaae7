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
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Top values of a categorical column.
 */
public final class CategoricalStats {
  private final List<FrequentValue> topValues;

  public CategoricalStats(List<FrequentValue> topValues) {
    this.topValues = ImmutableList.copyOf(topValues);
  }

  /**
   * Returns the most frequent values, by count descending then value.
   */
  @JsonProperty("topValues")
  public List<FrequentValue> getTopValues() {
    return topValues;
  }
}
