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

import org.apache.calcite.adapter.profiler.quality.QualityMetrics;
import org.apache.calcite.adapter.profiler.value.DataType;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Final statistics of one column.
 *
 * <p>Sections that do not apply to the column's type are null and left out of
 * the serialized form; a numeric column with no present values has no
 * numeric statistics rather than zeros.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"inferredType", "count", "missingCount", "distinctEstimate",
    "nonConformingCount", "numericStats", "categoricalStats", "stringStats", "temporalStats",
    "arrayStats", "histogram", "quality"})
public final class ColumnProfile {
  private final String name;
  private final int ordinal;
  private final DataType inferredType;
  private final long count;
  private final long missingCount;
  private final long distinctEstimate;
  private final long nonConformingCount;
  private final @Nullable NumericStats numericStats;
  private final @Nullable CategoricalStats categoricalStats;
  private final @Nullable StringStats stringStats;
  private final @Nullable TemporalStats temporalStats;
  private final @Nullable ArrayStats arrayStats;
  private final @Nullable Histogram histogram;
  private final @Nullable QualityMetrics quality;

  private ColumnProfile(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.ordinal = builder.ordinal;
    this.inferredType = Objects.requireNonNull(builder.inferredType, "inferredType");
    this.count = builder.count;
    this.missingCount = builder.missingCount;
    this.distinctEstimate = builder.distinctEstimate;
    this.nonConformingCount = builder.nonConformingCount;
    this.numericStats = builder.numericStats;
    this.categoricalStats = builder.categoricalStats;
    this.stringStats = builder.stringStats;
    this.temporalStats = builder.temporalStats;
    this.arrayStats = builder.arrayStats;
    this.histogram = builder.histogram;
    this.quality = builder.quality;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the column name; the key of this profile in the report.
   */
  @JsonIgnore
  public String getName() {
    return name;
  }

  @JsonIgnore
  public int getOrdinal() {
    return ordinal;
  }

  @JsonIgnore
  public DataType getInferredType() {
    return inferredType;
  }

  @JsonProperty("inferredType")
  public String getInferredTypeName() {
    return inferredType.getDisplayName();
  }

  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  @JsonProperty("missingCount")
  public long getMissingCount() {
    return missingCount;
  }

  @JsonProperty("distinctEstimate")
  public long getDistinctEstimate() {
    return distinctEstimate;
  }

  /**
   * Returns the number of present values that did not conform to the
   * inferred type.
   */
  @JsonProperty("nonConformingCount")
  public long getNonConformingCount() {
    return nonConformingCount;
  }

  @JsonProperty("numericStats")
  public @Nullable NumericStats getNumericStats() {
    return numericStats;
  }

  @JsonProperty("categoricalStats")
  public @Nullable CategoricalStats getCategoricalStats() {
    return categoricalStats;
  }

  @JsonProperty("stringStats")
  public @Nullable StringStats getStringStats() {
    return stringStats;
  }

  @JsonProperty("temporalStats")
  public @Nullable TemporalStats getTemporalStats() {
    return temporalStats;
  }

  @JsonProperty("arrayStats")
  public @Nullable ArrayStats getArrayStats() {
    return arrayStats;
  }

  @JsonProperty("histogram")
  public @Nullable Histogram getHistogram() {
    return histogram;
  }

  @JsonProperty("quality")
  public @Nullable QualityMetrics getQuality() {
    return quality;
  }

  @Override public String toString() {
    return "ColumnProfile{" + name + ", " + inferredType.getDisplayName()
        + ", count=" + count + ", missing=" + missingCount + "}";
  }

  /**
   * Builder for ColumnProfile.
   */
  public static class Builder {
    private String name;
    private int ordinal;
    private DataType inferredType;
    private long count;
    private long missingCount;
    private long distinctEstimate;
    private long nonConformingCount;
    private @Nullable NumericStats numericStats;
    private @Nullable CategoricalStats categoricalStats;
    private @Nullable StringStats stringStats;
    private @Nullable TemporalStats temporalStats;
    private @Nullable ArrayStats arrayStats;
    private @Nullable Histogram histogram;
    private @Nullable QualityMetrics quality;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder ordinal(int ordinal) {
      this.ordinal = ordinal;
      return this;
    }

    public Builder inferredType(DataType inferredType) {
      this.inferredType = inferredType;
      return this;
    }

    public Builder count(long count) {
      this.count = count;
      return this;
    }

    public Builder missingCount(long missingCount) {
      this.missingCount = missingCount;
      return this;
    }

    public Builder distinctEstimate(long distinctEstimate) {
      this.distinctEstimate = distinctEstimate;
      return this;
    }

    public Builder nonConformingCount(long nonConformingCount) {
      this.nonConformingCount = nonConformingCount;
      return this;
    }

    public Builder numericStats(@Nullable NumericStats numericStats) {
      this.numericStats = numericStats;
      return this;
    }

    public Builder categoricalStats(@Nullable CategoricalStats categoricalStats) {
      this.categoricalStats = categoricalStats;
      return this;
    }

    public Builder stringStats(@Nullable StringStats stringStats) {
      this.stringStats = stringStats;
      return this;
    }

    public Builder temporalStats(@Nullable TemporalStats temporalStats) {
      this.temporalStats = temporalStats;
      return this;
    }

    public Builder arrayStats(@Nullable ArrayStats arrayStats) {
      this.arrayStats = arrayStats;
      return this;
    }

    public Builder histogram(@Nullable Histogram histogram) {
      this.histogram = histogram;
      return this;
    }

    public Builder quality(@Nullable QualityMetrics quality) {
      this.quality = quality;
      return this;
    }

    public ColumnProfile build() {
      if (name == null) {
        throw new IllegalArgumentException("Column name is required");
      }
      if (inferredType == null || inferredType == DataType.UNKNOWN) {
        throw new IllegalArgumentException("Column '" + name + "' has no inferred type");
      }
      return new ColumnProfile(this);
    }
  }
}
