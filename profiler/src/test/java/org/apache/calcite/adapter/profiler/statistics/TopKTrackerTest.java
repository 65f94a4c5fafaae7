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

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TopKTracker}, {@link FrequencySketch} and
 * {@link CategoricalAccumulator}.
 */
@Tag("unit")
public class TopKTrackerTest {

  @Test void testKeepsMostFrequent() {
    TopKTracker tracker = new TopKTracker(2);
    tracker.offer("a", 1);
    tracker.offer("b", 1);
    tracker.offer("c", 1);
    assertEquals(2, tracker.size());
    tracker.offer("c", 5);
    List<TopKTracker.Entry> top = tracker.getTop();
    assertEquals("c", top.get(0).getValue());
    assertEquals(5, top.get(0).getCount());
    assertEquals(2, top.size());
  }

  @Test void testUpdatesExistingMember() {
    TopKTracker tracker = new TopKTracker(3);
    tracker.offer("x", 1);
    tracker.offer("x", 2);
    tracker.offer("x", 3);
    assertEquals(1, tracker.size());
    assertEquals(3, tracker.getTop().get(0).getCount());
  }

  @Test void testReportOrderBreaksTiesByValue() {
    TopKTracker tracker = new TopKTracker(3);
    tracker.offer("b", 2);
    tracker.offer("a", 2);
    tracker.offer("c", 4);
    List<TopKTracker.Entry> top = tracker.getTop();
    assertEquals("c", top.get(0).getValue());
    assertEquals("a", top.get(1).getValue());
    assertEquals("b", top.get(2).getValue());
  }

  @Test void testFrequencySketchNeverUnderestimates() {
    FrequencySketch sketch = new FrequencySketch(256, 4);
    for (int i = 0; i < 2000; i++) {
      sketch.add("v" + (i % 50));
    }
    for (int i = 0; i < 50; i++) {
      assertTrue(sketch.estimate("v" + i) >= 40);
    }
    assertEquals(0, new FrequencySketch(64, 2).estimate("missing"));
    assertEquals(256L * 4 * Long.BYTES, sketch.sizeInBytes());
  }

  @Test void testSkewedCategoriesSurface() {
    CategoricalAccumulator acc = new CategoricalAccumulator(3, 1024, 4);
    for (int i = 0; i < 1000; i++) {
      acc.add("common");
      if (i % 2 == 0) {
        acc.add("frequent");
      }
      if (i % 10 == 0) {
        acc.add("occasional");
      }
      acc.add("rare-" + i);
    }
    List<TopKTracker.Entry> top = acc.getTopValues();
    assertEquals(3, top.size());
    assertEquals("common", top.get(0).getValue());
    assertEquals("frequent", top.get(1).getValue());
    assertEquals("occasional", top.get(2).getValue());
    assertEquals(2600, acc.getObservations());
  }
}
