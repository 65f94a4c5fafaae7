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
import org.apache.calcite.adapter.profiler.value.Value;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * All statistical state of one column.
 *
 * <p>Every non-missing value feeds the string shape and the pattern sample
 * immediately. Typed state (numeric, categorical, temporal) and the
 * cardinality sketch are fed when the type locks; values seen while the sample
 * window was open are replayed into them at that point. The cardinality sketch
 * hashes the same key the categorical state counts, so a Boolean column has at
 * most two distinct values. After locking, values are only coerced; a value
 * that does not conform is counted and hashed by its text.
 *
 * <p>Memory is bounded by the configuration, not by the number of values:
 * sketches are allocated at full size up front and the replay buffer and
 * pattern sample have fixed limits.
 */
public class ColumnAccumulator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ColumnAccumulator.class);

  private final int ordinal;
  private final String name;
  private final ProfilerConfig config;
  private final FieldDecoder decoder;
  private final HyperLogLogSketch cardinality;
  private final StringShapeAccumulator stringShape = new StringShapeAccumulator();
  private final List<String> patternSample = new ArrayList<>();

  private DataType type = DataType.UNKNOWN;
  private @Nullable TypeInference inference;
  private @Nullable NumericAccumulator numeric;
  private @Nullable CategoricalAccumulator categorical;
  private @Nullable TemporalRangeAccumulator temporal;
  private @Nullable ArrayLengthAccumulator arrayLengths;

  private long count;
  private long missingCount;
  private long conformingCount;
  private long nonConformingCount;

  /**
   * Creates an accumulator whose type is inferred from the sample window.
   */
  public ColumnAccumulator(int ordinal, String name, ProfilerConfig config, FieldDecoder decoder) {
    this(ordinal, name, config, decoder, null);
  }

  /**
   * Creates an accumulator.
   *
   * @param hintedType Type to lock immediately, skipping the sample window;
   *     null to infer it
   */
  public ColumnAccumulator(int ordinal, String name, ProfilerConfig config, FieldDecoder decoder,
      @Nullable DataType hintedType) {
    this.ordinal = ordinal;
    this.name = name;
    this.config = config;
    this.decoder = decoder;
    this.cardinality = new HyperLogLogSketch(config.getCardinalityRegisterBits());
    if (hintedType != null && hintedType != DataType.UNKNOWN && hintedType != DataType.EMPTY) {
      lock(hintedType);
    } else {
      this.inference = new TypeInference(config.getSampleWindowSize(),
          config.getTypeMajorityThreshold());
    }
  }

  /**
   * Folds one raw token into the column.
   *
   * @param raw Token, or null when the record has no value for this column
   */
  public void add(@Nullable String raw) {
    count++;
    Value value = decoder.classify(raw);
    if (value.isMissing()) {
      missingCount++;
      if (inference != null) {
        inference.observe(value);
      }
      return;
    }

    String text = value.text();
    stringShape.add(text);
    if (patternSample.size() < config.getPiiSampleSize()) {
      patternSample.add(text);
    }

    TypeInference window = inference;
    if (window != null) {
      window.observe(value);
      if (window.isReady()) {
        closeWindow();
      }
      return;
    }
    fold(value);
  }

  /**
   * Records the element count of a JSON array whose flattened text was just
   * added to this column.
   */
  public void addArrayLength(int length) {
    ArrayLengthAccumulator lengths = arrayLengths;
    if (lengths == null) {
      lengths = new ArrayLengthAccumulator();
      arrayLengths = lengths;
    }
    lengths.add(length);
  }

  /**
   * Records {@code n} missing values, used when a column is discovered after
   * earlier records were already processed.
   */
  public void addMissing(long n) {
    count += n;
    missingCount += n;
  }

  /**
   * Locks the type if the sample window is still open. A column that never saw
   * a value locks as {@link DataType#EMPTY}.
   */
  public void closeWindow() {
    TypeInference window = inference;
    if (window == null) {
      return;
    }
    DataType decided = window.decide();
    List<Value> replay = window.drain();
    inference = null;
    lock(decided);
    LOGGER.debug("Column '{}' locked as {} after {} sampled values", name,
        decided.getDisplayName(), replay.size());
    for (Value value : replay) {
      fold(value);
    }
  }

  private void lock(DataType lockedType) {
    this.type = lockedType;
    if (lockedType.isNumeric()) {
      numeric = new NumericAccumulator(config.getQuantileSketchCapacity());
    }
    if (lockedType.isCategorical()) {
      categorical = new CategoricalAccumulator(config.getTopKWidth(),
          config.getFrequencySketchWidth(), config.getFrequencySketchDepth());
    }
    if (lockedType.isTemporal()) {
      temporal = new TemporalRangeAccumulator();
    }
  }

  private void fold(Value value) {
    Value coerced = decoder.coerce(value, type);
    if (coerced == null) {
      nonConformingCount++;
      cardinality.add(value.text());
      return;
    }
    conformingCount++;
    cardinality.add(categoryKey(coerced));
    if (numeric != null) {
      numeric.add(coerced.asDouble());
    }
    if (categorical != null) {
      categorical.add(categoryKey(coerced));
    }
    if (temporal != null && coerced instanceof Value.TemporalValue) {
      temporal.add(((Value.TemporalValue) coerced).temporalValue());
    }
  }

  private static String categoryKey(Value value) {
    if (value instanceof Value.BoolValue) {
      return String.valueOf(((Value.BoolValue) value).booleanValue());
    }
    return value.text();
  }

  public int getOrdinal() {
    return ordinal;
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the current type; {@link DataType#UNKNOWN} while the window is
   * open.
   */
  public DataType getType() {
    return type;
  }

  public ColumnSchema getSchema() {
    return new ColumnSchema(ordinal, name, type);
  }

  public boolean isLocked() {
    return inference == null;
  }

  public long getCount() {
    return count;
  }

  public long getMissingCount() {
    return missingCount;
  }

  public long getNonMissingCount() {
    return count - missingCount;
  }

  public long getConformingCount() {
    return conformingCount;
  }

  public long getNonConformingCount() {
    return nonConformingCount;
  }

  public long getDistinctEstimate() {
    return getNonMissingCount() == 0 ? 0 : cardinality.getEstimate();
  }

  public @Nullable NumericAccumulator getNumeric() {
    return numeric;
  }

  public @Nullable CategoricalAccumulator getCategorical() {
    return categorical;
  }

  public @Nullable TemporalRangeAccumulator getTemporal() {
    return temporal;
  }

  /**
   * Returns the array statistics, or null when the column never held a JSON
   * array.
   */
  public @Nullable ArrayLengthAccumulator getArrayLengths() {
    return arrayLengths;
  }

  public StringShapeAccumulator getStringShape() {
    return stringShape;
  }

  /**
   * Returns the first non-missing values, used for pattern detection.
   */
  public List<String> getPatternSample() {
    return ImmutableList.copyOf(patternSample);
  }

  /**
   * Returns the bytes held by sketches and bounded buffers. Independent of the
   * number of values added.
   */
  public long sizeInBytes() {
    long size = cardinality.sizeInBytes();
    if (numeric != null) {
      size += numeric.sizeInBytes();
    }
    if (categorical != null) {
      size += categorical.sizeInBytes();
    }
    return size;
  }
}
