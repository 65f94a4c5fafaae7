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

import org.apache.calcite.adapter.profiler.value.DataType;
import org.apache.calcite.adapter.profiler.value.FieldDecoder;
import org.apache.calcite.adapter.profiler.value.Value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TypeInference}.
 */
@Tag("unit")
public class TypeInferenceTest {

  private static Map<DataType, Integer> votes(Object... pairs) {
    Map<DataType, Integer> votes = new EnumMap<>(DataType.class);
    for (int i = 0; i < pairs.length; i += 2) {
      votes.put((DataType) pairs[i], (Integer) pairs[i + 1]);
    }
    return votes;
  }

  @Test void testLockingRule() {
    assertEquals(DataType.INTEGER, TypeInference.decide(votes(DataType.INTEGER, 9,
        DataType.STRING, 1), 0.8));
    assertEquals(DataType.NUMERIC, TypeInference.decide(votes(DataType.INTEGER, 5,
        DataType.NUMERIC, 4, DataType.STRING, 1), 0.8));
    assertEquals(DataType.BOOLEAN, TypeInference.decide(votes(DataType.BOOLEAN, 10), 0.8));
    assertEquals(DataType.DATE, TypeInference.decide(votes(DataType.DATE, 9,
        DataType.DATETIME, 1), 0.8));
    assertEquals(DataType.DATETIME, TypeInference.decide(votes(DataType.DATE, 5,
        DataType.DATETIME, 5), 0.8));
    assertEquals(DataType.STRING, TypeInference.decide(votes(DataType.STRING, 10), 0.8));
    assertEquals(DataType.MIXED, TypeInference.decide(votes(DataType.INTEGER, 5,
        DataType.STRING, 5), 0.8));
    assertEquals(DataType.EMPTY, TypeInference.decide(votes(), 0.8));
  }

  @Test void testThresholdIsStrict() {
    assertEquals(DataType.MIXED, TypeInference.decide(votes(DataType.INTEGER, 8,
        DataType.STRING, 2), 0.8));
  }

  @Test void testWindowReadiness() {
    FieldDecoder decoder = new FieldDecoder();
    TypeInference inference = new TypeInference(3, 0.8);
    inference.observe(Value.missing());
    inference.observe(Value.missing());
    inference.observe(Value.missing());
    assertFalse(inference.isReady());
    inference.observe(decoder.classify("4"));
    assertTrue(inference.isReady());
    assertEquals(DataType.INTEGER, inference.decide());

    List<Value> replay = inference.drain();
    assertEquals(1, replay.size());
    assertEquals(0, inference.getPendingCount());
  }
}
