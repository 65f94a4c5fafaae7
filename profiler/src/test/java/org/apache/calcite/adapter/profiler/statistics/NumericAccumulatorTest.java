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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link NumericAccumulator}.
 */
@Tag("unit")
public class NumericAccumulatorTest {

  @Test void testConstantValues() {
    NumericAccumulator acc = new NumericAccumulator(100);
    for (int i = 0; i < 4; i++) {
      acc.add(5);
    }
    assertEquals(4, acc.getCount());
    assertEquals(5.0, acc.getMean(), 0.0);
    assertEquals(0.0, acc.getVariance(), 0.0);
    assertEquals(0.0, acc.getStdDev(), 0.0);
    assertEquals(0.0, acc.getSkewness(), 0.0);
    assertEquals(0.0, acc.getKurtosis(), 0.0);
    assertEquals(5.0, acc.getMin(), 0.0);
    assertEquals(5.0, acc.getMax(), 0.0);
    assertEquals(20.0, acc.getSum(), 0.0);
  }

  @Test void testMoments() {
    NumericAccumulator acc = new NumericAccumulator(100);
    for (int i = 1; i <= 5; i++) {
      acc.add(i);
    }
    assertEquals(3.0, acc.getMean(), 1e-12);
    assertEquals(2.5, acc.getVariance(), 1e-12);
    assertEquals(Math.sqrt(2.5), acc.getStdDev(), 1e-12);
    assertEquals(0.0, acc.getSkewness(), 1e-12);
    assertEquals(1.7, acc.getKurtosis(), 1e-12);
  }

  @Test void testSkewedDistribution() {
    NumericAccumulator acc = new NumericAccumulator(100);
    acc.add(1);
    acc.add(1);
    acc.add(1);
    acc.add(10);
    assertTrue(acc.getSkewness() > 0);
  }

  @Test void testSingleValue() {
    NumericAccumulator acc = new NumericAccumulator(100);
    acc.add(-2.5);
    assertEquals(-2.5, acc.getMean(), 0.0);
    assertEquals(0.0, acc.getVariance(), 0.0);
    assertEquals(-2.5, acc.getQuantiles().quantile(0.5), 0.0);
  }

  @Test void testLargeOffsetIsNumericallyStable() {
    NumericAccumulator acc = new NumericAccumulator(100);
    double[] values = {1e9 + 4, 1e9 + 7, 1e9 + 13, 1e9 + 16};
    for (double value : values) {
      acc.add(value);
    }
    assertEquals(1e9 + 10, acc.getMean(), 1e-6);
    assertEquals(30.0, acc.getVariance(), 1e-6);
  }
}
