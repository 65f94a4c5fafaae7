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
package org.apache.calcite.adapter.profiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ProfilerConfig}.
 */
@Tag("unit")
public class ProfilerConfigTest {

  @Test void testDefaults() {
    ProfilerConfig config = ProfilerConfig.defaults();
    assertEquals(1000, config.getSampleWindowSize());
    assertEquals(0.8, config.getTypeMajorityThreshold(), 0.0);
    assertEquals(14, config.getCardinalityRegisterBits());
    assertEquals(10, config.getTopKWidth());
    assertEquals(64 * 1024, config.getSniffSampleBytes());
    assertTrue(config.getNullEquivalents().contains("N/A"));
  }

  @Test void testLoadYaml() throws IOException {
    String yaml = "sampleWindowSize: 50\n"
        + "typeMajorityThreshold: 0.9\n"
        + "topKWidth: 5\n"
        + "chunkSizeBytes: 4096\n"
        + "nullEquivalents:\n"
        + "  - missing\n"
        + "  - '-'\n";
    ProfilerConfig config = ProfilerConfig.load(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    assertEquals(50, config.getSampleWindowSize());
    assertEquals(0.9, config.getTypeMajorityThreshold(), 0.0);
    assertEquals(5, config.getTopKWidth());
    assertEquals(4096, config.getChunkSizeBytes());
    assertTrue(config.getNullEquivalents().contains("MISSING"));
    assertTrue(config.getNullEquivalents().contains("-"));
    assertFalse(config.getNullEquivalents().contains("NA"));
    assertEquals(200, config.getQuantileSketchCapacity());
  }

  @Test void testToBuilderKeepsValues() {
    ProfilerConfig config = ProfilerConfig.builder().maxColumns(7).build();
    ProfilerConfig copy = config.toBuilder().chunkSizeBytes(10).build();
    assertEquals(7, copy.getMaxColumns());
    assertEquals(10, copy.getChunkSizeBytes());
  }

  @Test void testValidation() {
    assertThrows(IllegalArgumentException.class,
        () -> ProfilerConfig.builder().sampleWindowSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProfilerConfig.builder().typeMajorityThreshold(1.0).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProfilerConfig.builder().cardinalityRegisterBits(20).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProfilerConfig.builder().histogramMinBins(20).histogramMaxBins(10).build());
  }

  @Test void testWrongValueTypeNamesKey() {
    String yaml = "topKWidth: 5\n"
        + "sampleWindowSize: abc\n";
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> ProfilerConfig.load(
            new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    assertTrue(e.getMessage().contains("sampleWindowSize"), e.getMessage());

    Map<String, Object> map = new HashMap<>();
    map.put("nullEquivalents", "NA");
    e = assertThrows(IllegalArgumentException.class, () -> ProfilerConfig.fromMap(map));
    assertTrue(e.getMessage().contains("nullEquivalents"), e.getMessage());
  }
}
