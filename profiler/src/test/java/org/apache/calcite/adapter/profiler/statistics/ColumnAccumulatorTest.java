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

import org.apache.calcite.adapter.profiler.ProfilerConfig;
import org.apache.calcite.adapter.profiler.value.DataType;
import org.apache.calcite.adapter.profiler.value.FieldDecoder;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ColumnAccumulator}.
 */
@Tag("unit")
public class ColumnAccumulatorTest {

  private final ProfilerConfig config = ProfilerConfig.defaults();
  private final FieldDecoder decoder = new FieldDecoder(config.getNullEquivalents());

  private ColumnAccumulator column(String name) {
    return new ColumnAccumulator(0, name, config, decoder);
  }

  @Test void testMissingness() {
    ColumnAccumulator column = column("x");
    column.add("1");
    column.add("");
    column.add("3");
    column.add(null);
    column.add("5");
    column.closeWindow();

    assertEquals(DataType.INTEGER, column.getType());
    assertEquals(5, column.getCount());
    assertEquals(2, column.getMissingCount());
    NumericAccumulator numeric = column.getNumeric();
    assertNotNull(numeric);
    assertEquals(3, numeric.getCount());
    assertEquals(3.0, numeric.getMean(), 0.0);
  }

  @Test void testLocksWhenWindowFillsAndCountsNonConforming() {
    ProfilerConfig small = ProfilerConfig.builder().sampleWindowSize(10).build();
    ColumnAccumulator column = new ColumnAccumulator(0, "n", small, decoder);
    for (int i = 0; i < 10; i++) {
      column.add(String.valueOf(i));
    }
    assertTrue(column.isLocked());
    assertEquals(DataType.INTEGER, column.getType());

    column.add("not a number");
    column.add("2.5");
    column.add("11");
    assertEquals(2, column.getNonConformingCount());
    assertEquals(11, column.getConformingCount());
    assertEquals(11, column.getNumeric().getCount());
    assertEquals(13.0, column.getDistinctEstimate(), 1.0);
  }

  @Test void testIntegersAndFloatsLockAsNumeric() {
    ColumnAccumulator column = column("price");
    column.add("1");
    column.add("2.5");
    column.add("3");
    column.add("4.25");
    column.closeWindow();
    assertEquals(DataType.NUMERIC, column.getType());
    assertEquals(0, column.getNonConformingCount());
    assertEquals(10.75, column.getNumeric().getSum(), 1e-12);
  }

  @Test void testBooleanCategoriesAreNormalized() {
    ColumnAccumulator column = column("flag");
    column.add("T");
    column.add("true");
    column.add("f");
    column.closeWindow();
    assertEquals(DataType.BOOLEAN, column.getType());
    CategoricalAccumulator categorical = column.getCategorical();
    assertNotNull(categorical);
    assertEquals("true", categorical.getTopValues().get(0).getValue());
    assertEquals(2, categorical.getTopValues().get(0).getCount());
  }

  @Test void testBooleanDistinctEstimateMatchesTopValues() {
    ColumnAccumulator column = column("flag");
    column.add("True");
    column.add("true");
    column.add("T");
    column.add("TRUE");
    column.closeWindow();
    assertEquals(DataType.BOOLEAN, column.getType());
    assertEquals(1, column.getDistinctEstimate());
    assertEquals(1, column.getCategorical().getTopValues().size());
    assertEquals(4, column.getCategorical().getTopValues().get(0).getCount());
  }

  @Test void testDateColumnTracksRange() {
    ColumnAccumulator column = column("day");
    column.add("2024-03-01");
    column.add("2023-12-31");
    column.add("2024-01-15");
    column.closeWindow();
    assertEquals(DataType.DATE, column.getType());
    assertEquals(2023, column.getTemporal().getMin().getYear());
    assertEquals(3, column.getTemporal().getMax().getMonthValue());
    assertNotNull(column.getCategorical());
  }

  @Test void testAllMissingColumnIsEmpty() {
    ColumnAccumulator column = column("blank");
    column.add("");
    column.add("NA");
    column.closeWindow();
    assertEquals(DataType.EMPTY, column.getType());
    assertEquals(0, column.getDistinctEstimate());
    assertTrue(column.getStringShape().isEmpty());
    assertNull(column.getNumeric());
  }

  @Test void testHintedTypeLocksImmediately() {
    ColumnAccumulator column = new ColumnAccumulator(1, "code", config, decoder,
        DataType.STRING);
    assertTrue(column.isLocked());
    column.add("007");
    assertEquals(1, column.getConformingCount());
    assertEquals("007", column.getCategorical().getTopValues().get(0).getValue());
  }

  @Test void testBackFilledMissing() {
    ColumnAccumulator column = column("late");
    column.addMissing(4);
    column.add("x");
    assertEquals(5, column.getCount());
    assertEquals(4, column.getMissingCount());
    assertFalse(column.isLocked());
  }

  @Test void testMemoryIsIndependentOfRowCount() {
    ColumnAccumulator small = column("a");
    for (int i = 0; i < 1_000; i++) {
      small.add(String.valueOf(i));
    }
    ColumnAccumulator large = column("a");
    for (int i = 0; i < 1_000_000; i++) {
      large.add(String.valueOf(i));
    }
    assertEquals(small.sizeInBytes(), large.sizeInBytes());
    assertEquals(config.getPiiSampleSize(), large.getPatternSample().size());
  }
}
