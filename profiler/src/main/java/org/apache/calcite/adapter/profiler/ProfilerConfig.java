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

import org.apache.calcite.adapter.profiler.util.NullEquivalents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tuning constants for a profiling session.
 *
 * <p>Every approximate algorithm trades accuracy for a fixed memory footprint;
 * the knobs below choose that trade-off. All values are fixed for the lifetime
 * of a session.
 *
 * <ul>
 *   <li>{@code sampleWindowSize} - records inspected before a column's type is
 *   locked. Larger windows make inference more robust and cost one retained
 *   value per column per record.</li>
 *   <li>{@code typeMajorityThreshold} - share a candidate type must exceed to
 *   win the vote; otherwise the column is {@code MIXED}.</li>
 *   <li>{@code quantileSketchCapacity} - t-digest compression. Centroid count
 *   grows linearly with it; 200 keeps tail quantiles well under 1% error.</li>
 *   <li>{@code cardinalityRegisterBits} - HyperLogLog precision p. Uses 2^p
 *   bytes; standard error is about 1.04 / sqrt(2^p) (0.8% at p = 14).</li>
 *   <li>{@code topKWidth} - number of frequent values tracked exactly.</li>
 *   <li>{@code frequencySketchWidth}, {@code frequencySketchDepth} - size of the
 *   count-min table feeding the top-K heap; wider means fewer collisions.</li>
 * </ul>
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * sampleWindowSize: 1000
 * typeMajorityThreshold: 0.8
 * quantileSketchCapacity: 200
 * cardinalityRegisterBits: 14
 * topKWidth: 10
 * nullEquivalents: [NULL, NA, "N/A"]
 * }</pre>
 */
public class ProfilerConfig {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final int sampleWindowSize;
  private final double typeMajorityThreshold;
  private final int quantileSketchCapacity;
  private final int cardinalityRegisterBits;
  private final int topKWidth;
  private final int frequencySketchWidth;
  private final int frequencySketchDepth;
  private final int sniffSampleBytes;
  private final int maxRecordBytes;
  private final int histogramMinBins;
  private final int histogramMaxBins;
  private final int maxColumns;
  private final int maxJsonDepth;
  private final int piiSampleSize;
  private final int chunkSizeBytes;
  private final Set<String> nullEquivalents;

  private ProfilerConfig(Builder builder) {
    this.sampleWindowSize = builder.sampleWindowSize;
    this.typeMajorityThreshold = builder.typeMajorityThreshold;
    this.quantileSketchCapacity = builder.quantileSketchCapacity;
    this.cardinalityRegisterBits = builder.cardinalityRegisterBits;
    this.topKWidth = builder.topKWidth;
    this.frequencySketchWidth = builder.frequencySketchWidth;
    this.frequencySketchDepth = builder.frequencySketchDepth;
    this.sniffSampleBytes = builder.sniffSampleBytes;
    this.maxRecordBytes = builder.maxRecordBytes;
    this.histogramMinBins = builder.histogramMinBins;
    this.histogramMaxBins = builder.histogramMaxBins;
    this.maxColumns = builder.maxColumns;
    this.maxJsonDepth = builder.maxJsonDepth;
    this.piiSampleSize = builder.piiSampleSize;
    this.chunkSizeBytes = builder.chunkSizeBytes;
    this.nullEquivalents = NullEquivalents.normalize(builder.nullEquivalents);
  }

  /**
   * Returns a configuration with every default.
   */
  public static ProfilerConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder for ProfilerConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder initialized from this configuration.
   */
  public Builder toBuilder() {
    return builder()
        .sampleWindowSize(sampleWindowSize)
        .typeMajorityThreshold(typeMajorityThreshold)
        .quantileSketchCapacity(quantileSketchCapacity)
        .cardinalityRegisterBits(cardinalityRegisterBits)
        .topKWidth(topKWidth)
        .frequencySketchWidth(frequencySketchWidth)
        .frequencySketchDepth(frequencySketchDepth)
        .sniffSampleBytes(sniffSampleBytes)
        .maxRecordBytes(maxRecordBytes)
        .histogramMinBins(histogramMinBins)
        .histogramMaxBins(histogramMaxBins)
        .maxColumns(maxColumns)
        .maxJsonDepth(maxJsonDepth)
        .piiSampleSize(piiSampleSize)
        .chunkSizeBytes(chunkSizeBytes)
        .nullEquivalents(nullEquivalents);
  }

  /**
   * Reads a configuration from a YAML (or JSON) document.
   *
   * @param inputStream Stream holding the document
   * @return Parsed configuration; absent keys keep their defaults
   * @throws IOException If the document cannot be parsed
   */
  public static ProfilerConfig load(InputStream inputStream) throws IOException {
    @SuppressWarnings("unchecked")
    Map<String, Object> map = YAML_MAPPER.readValue(inputStream, Map.class);
    return fromMap(map);
  }

  /**
   * Creates a ProfilerConfig from a YAML/JSON map. Absent keys keep their
   * defaults.
   *
   * @throws IllegalArgumentException if a value has the wrong type or is out
   *     of range
   */
  public static ProfilerConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Number value = number(map, "sampleWindowSize");
    if (value != null) {
      builder.sampleWindowSize(value.intValue());
    }
    value = number(map, "typeMajorityThreshold");
    if (value != null) {
      builder.typeMajorityThreshold(value.doubleValue());
    }
    value = number(map, "quantileSketchCapacity");
    if (value != null) {
      builder.quantileSketchCapacity(value.intValue());
    }
    value = number(map, "cardinalityRegisterBits");
    if (value != null) {
      builder.cardinalityRegisterBits(value.intValue());
    }
    value = number(map, "topKWidth");
    if (value != null) {
      builder.topKWidth(value.intValue());
    }
    value = number(map, "frequencySketchWidth");
    if (value != null) {
      builder.frequencySketchWidth(value.intValue());
    }
    value = number(map, "frequencySketchDepth");
    if (value != null) {
      builder.frequencySketchDepth(value.intValue());
    }
    value = number(map, "sniffSampleBytes");
    if (value != null) {
      builder.sniffSampleBytes(value.intValue());
    }
    value = number(map, "maxRecordBytes");
    if (value != null) {
      builder.maxRecordBytes(value.intValue());
    }
    value = number(map, "histogramMinBins");
    if (value != null) {
      builder.histogramMinBins(value.intValue());
    }
    value = number(map, "histogramMaxBins");
    if (value != null) {
      builder.histogramMaxBins(value.intValue());
    }
    value = number(map, "maxColumns");
    if (value != null) {
      builder.maxColumns(value.intValue());
    }
    value = number(map, "maxJsonDepth");
    if (value != null) {
      builder.maxJsonDepth(value.intValue());
    }
    value = number(map, "piiSampleSize");
    if (value != null) {
      builder.piiSampleSize(value.intValue());
    }
    value = number(map, "chunkSizeBytes");
    if (value != null) {
      builder.chunkSizeBytes(value.intValue());
    }
    Object markers = map.get("nullEquivalents");
    if (markers != null) {
      if (!(markers instanceof List)) {
        throw new IllegalArgumentException("nullEquivalents must be a list, got: "
            + markers);
      }
      List<String> list = new ArrayList<>();
      for (Object marker : (List<?>) markers) {
        list.add(String.valueOf(marker));
      }
      builder.nullEquivalents(list);
    }
    return builder.build();
  }

  private static @Nullable Number number(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null || value instanceof Number) {
      return (Number) value;
    }
    throw new IllegalArgumentException(key + " must be a number, got: " + value);
  }

  public int getSampleWindowSize() {
    return sampleWindowSize;
  }

  public double getTypeMajorityThreshold() {
    return typeMajorityThreshold;
  }

  public int getQuantileSketchCapacity() {
    return quantileSketchCapacity;
  }

  public int getCardinalityRegisterBits() {
    return cardinalityRegisterBits;
  }

  public int getTopKWidth() {
    return topKWidth;
  }

  public int getFrequencySketchWidth() {
    return frequencySketchWidth;
  }

  public int getFrequencySketchDepth() {
    return frequencySketchDepth;
  }

  public int getSniffSampleBytes() {
    return sniffSampleBytes;
  }

  public int getMaxRecordBytes() {
    return maxRecordBytes;
  }

  public int getHistogramMinBins() {
    return histogramMinBins;
  }

  public int getHistogramMaxBins() {
    return histogramMaxBins;
  }

  public int getMaxColumns() {
    return maxColumns;
  }

  public int getMaxJsonDepth() {
    return maxJsonDepth;
  }

  public int getPiiSampleSize() {
    return piiSampleSize;
  }

  /**
   * Returns the read size used by file-backed chunk sources.
   */
  public int getChunkSizeBytes() {
    return chunkSizeBytes;
  }

  /**
   * Returns the upper-case markers treated as missing values.
   */
  public Set<String> getNullEquivalents() {
    return nullEquivalents;
  }

  @Override public String toString() {
    return String.format("ProfilerConfig{sampleWindowSize=%d, typeMajorityThreshold=%s, "
            + "quantileSketchCapacity=%d, cardinalityRegisterBits=%d, topKWidth=%d}",
        sampleWindowSize, typeMajorityThreshold, quantileSketchCapacity,
        cardinalityRegisterBits, topKWidth);
  }

  /**
   * Builder for ProfilerConfig.
   */
  public static class Builder {
    private int sampleWindowSize = 1000;
    private double typeMajorityThreshold = 0.8;
    private int quantileSketchCapacity = 200;
    private int cardinalityRegisterBits = 14;
    private int topKWidth = 10;
    private int frequencySketchWidth = 4096;
    private int frequencySketchDepth = 4;
    private int sniffSampleBytes = 64 * 1024;
    private int maxRecordBytes = 16 * 1024 * 1024;
    private int histogramMinBins = 10;
    private int histogramMaxBins = 50;
    private int maxColumns = 500;
    private int maxJsonDepth = 3;
    private int piiSampleSize = 100;
    private int chunkSizeBytes = 1024 * 1024;
    private Collection<String> nullEquivalents = NullEquivalents.DEFAULT_NULL_EQUIVALENTS;

    public Builder sampleWindowSize(int sampleWindowSize) {
      this.sampleWindowSize = sampleWindowSize;
      return this;
    }

    public Builder typeMajorityThreshold(double typeMajorityThreshold) {
      this.typeMajorityThreshold = typeMajorityThreshold;
      return this;
    }

    public Builder quantileSketchCapacity(int quantileSketchCapacity) {
      this.quantileSketchCapacity = quantileSketchCapacity;
      return this;
    }

    public Builder cardinalityRegisterBits(int cardinalityRegisterBits) {
      this.cardinalityRegisterBits = cardinalityRegisterBits;
      return this;
    }

    public Builder topKWidth(int topKWidth) {
      this.topKWidth = topKWidth;
      return this;
    }

    public Builder frequencySketchWidth(int frequencySketchWidth) {
      this.frequencySketchWidth = frequencySketchWidth;
      return this;
    }

    public Builder frequencySketchDepth(int frequencySketchDepth) {
      this.frequencySketchDepth = frequencySketchDepth;
      return this;
    }

    public Builder sniffSampleBytes(int sniffSampleBytes) {
      this.sniffSampleBytes = sniffSampleBytes;
      return this;
    }

    public Builder maxRecordBytes(int maxRecordBytes) {
      this.maxRecordBytes = maxRecordBytes;
      return this;
    }

    public Builder histogramMinBins(int histogramMinBins) {
      this.histogramMinBins = histogramMinBins;
      return this;
    }

    public Builder histogramMaxBins(int histogramMaxBins) {
      this.histogramMaxBins = histogramMaxBins;
      return this;
    }

    public Builder maxColumns(int maxColumns) {
      this.maxColumns = maxColumns;
      return this;
    }

    public Builder maxJsonDepth(int maxJsonDepth) {
      this.maxJsonDepth = maxJsonDepth;
      return this;
    }

    public Builder piiSampleSize(int piiSampleSize) {
      this.piiSampleSize = piiSampleSize;
      return this;
    }

    public Builder chunkSizeBytes(int chunkSizeBytes) {
      this.chunkSizeBytes = chunkSizeBytes;
      return this;
    }

    public Builder nullEquivalents(Collection<String> nullEquivalents) {
      this.nullEquivalents = nullEquivalents;
      return this;
    }

    public ProfilerConfig build() {
      if (sampleWindowSize < 1) {
        throw new IllegalArgumentException("sampleWindowSize must be positive");
      }
      if (typeMajorityThreshold < 0.5 || typeMajorityThreshold >= 1.0) {
        throw new IllegalArgumentException(
            "typeMajorityThreshold must be in [0.5, 1.0): " + typeMajorityThreshold);
      }
      if (quantileSketchCapacity < 10) {
        throw new IllegalArgumentException("quantileSketchCapacity must be at least 10");
      }
      if (cardinalityRegisterBits < 4 || cardinalityRegisterBits > 18) {
        throw new IllegalArgumentException(
            "cardinalityRegisterBits must be between 4 and 18: " + cardinalityRegisterBits);
      }
      if (topKWidth < 1) {
        throw new IllegalArgumentException("topKWidth must be positive");
      }
      if (frequencySketchWidth < 1 || frequencySketchDepth < 1) {
        throw new IllegalArgumentException("Frequency sketch dimensions must be positive");
      }
      if (sniffSampleBytes < 1 || maxRecordBytes < 1 || chunkSizeBytes < 1) {
        throw new IllegalArgumentException("Byte limits must be positive");
      }
      if (histogramMinBins < 1 || histogramMaxBins < histogramMinBins) {
        throw new IllegalArgumentException("Histogram bin bounds are invalid: "
            + histogramMinBins + ".." + histogramMaxBins);
      }
      if (maxColumns < 1) {
        throw new IllegalArgumentException("maxColumns must be positive");
      }
      if (maxJsonDepth < 0 || piiSampleSize < 0) {
        throw new IllegalArgumentException("maxJsonDepth and piiSampleSize must not be negative");
      }
      if (nullEquivalents == null) {
        throw new IllegalArgumentException("nullEquivalents is required");
      }
      return new ProfilerConfig(this);
    }
  }
}
