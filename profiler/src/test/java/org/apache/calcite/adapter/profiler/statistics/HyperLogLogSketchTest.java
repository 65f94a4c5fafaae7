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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HyperLogLogSketch}.
 */
@Tag("unit")
public class HyperLogLogSketchTest {

  @Test void testDistinctWithinThreePercent() {
    HyperLogLogSketch sketch = new HyperLogLogSketch(14);
    for (int i = 0; i < 50_000; i++) {
      sketch.add("value-" + i);
    }
    long estimate = sketch.getEstimate();
    assertTrue(Math.abs(estimate - 50_000) <= 1_500, "estimate: " + estimate);
  }

  @Test void testConstantColumn() {
    HyperLogLogSketch sketch = new HyperLogLogSketch(14);
    for (int i = 0; i < 10_000; i++) {
      sketch.add("same");
    }
    assertEquals(1, sketch.getEstimate());
  }

  @Test void testEmpty() {
    assertEquals(0, new HyperLogLogSketch(10).getEstimate());
  }

  @Test void testMerge() {
    HyperLogLogSketch left = new HyperLogLogSketch(12);
    HyperLogLogSketch right = new HyperLogLogSketch(12);
    for (int i = 0; i < 1000; i++) {
      left.add("a" + i);
      right.add("b" + i);
    }
    left.merge(right);
    assertTrue(Math.abs(left.getEstimate() - 2000) <= 100, "estimate: " + left.getEstimate());
    assertThrows(IllegalArgumentException.class, () -> left.merge(new HyperLogLogSketch(10)));
    left.clear();
    assertEquals(0, left.getEstimate());
  }

  @Test void testPrecisionBounds() {
    assertThrows(IllegalArgumentException.class, () -> new HyperLogLogSketch(3));
    assertThrows(IllegalArgumentException.class, () -> new HyperLogLogSketch(19));
    assertEquals(1 << 14, new HyperLogLogSketch(14).sizeInBytes());
  }
}
