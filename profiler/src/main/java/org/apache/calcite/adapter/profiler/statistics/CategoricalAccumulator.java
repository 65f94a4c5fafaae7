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

import java.util.List;

/**
 * Frequency sketch feeding a top-K heap for categorical columns.
 */
public class CategoricalAccumulator {
  private final FrequencySketch frequencies;
  private final TopKTracker topK;
  private long observations;

  public CategoricalAccumulator(int topKWidth, int sketchWidth, int sketchDepth) {
    this.frequencies = new FrequencySketch(sketchWidth, sketchDepth);
    this.topK = new TopKTracker(topKWidth);
  }

  public void add(String value) {
    observations++;
    topK.offer(value, frequencies.add(value));
  }

  /**
   * Returns the number of values added; the denominator of top value
   * percentages.
   */
  public long getObservations() {
    return observations;
  }

  public List<TopKTracker.Entry> getTopValues() {
    return topK.getTop();
  }

  public long sizeInBytes() {
    return frequencies.sizeInBytes();
  }
}
