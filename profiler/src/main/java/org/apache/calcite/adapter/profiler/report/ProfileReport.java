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

import org.apache.calcite.adapter.profiler.format.InputFormat;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable result of a completed profiling session.
 *
 * <p>Holds one {@link ColumnProfile} per column, in column order, and the
 * session metadata. Created once by {@link ReportMaterializer} and never
 * changed afterwards.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * ProfileReport report = host.completion().get();
 * ColumnProfile amount = report.getColumn("amount");
 * if (amount.getNumericStats() != null) {
 *   System.out.println("median " + amount.getNumericStats().getP50());
 * }
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"totalRows", "elapsedMs", "bytesProcessed", "format", "delimiter",
    "hasHeader", "fieldCountMismatches", "malformedRecords", "columns"})
public final class ProfileReport {
  private final long totalRows;
  private final long elapsedMs;
  private final long bytesProcessed;
  private final InputFormat format;
  private final @Nullable Character delimiter;
  private final boolean hasHeader;
  private final long fieldCountMismatches;
  private final long malformedRecords;
  private final Map<String, ColumnProfile> columns;

  private ProfileReport(Builder builder) {
    this.totalRows = builder.totalRows;
    this.elapsedMs = builder.elapsedMs;
    this.bytesProcessed = builder.bytesProcessed;
    this.format = builder.format;
    this.delimiter = builder.delimiter;
    this.hasHeader = builder.hasHeader;
    this.fieldCountMismatches = builder.fieldCountMismatches;
    this.malformedRecords = builder.malformedRecords;
    this.columns = builder.columns.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the number of data records profiled, excluding a header row.
   */
  @JsonProperty("totalRows")
  public long getTotalRows() {
    return totalRows;
  }

  @JsonProperty("elapsedMs")
  public long getElapsedMs() {
    return elapsedMs;
  }

  @JsonProperty("bytesProcessed")
  public long getBytesProcessed() {
    return bytesProcessed;
  }

  @JsonIgnore
  public InputFormat getFormat() {
    return format;
  }

  @JsonProperty("format")
  public String getFormatName() {
    return format.name().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the field delimiter, or null for JSON input.
   */
  @JsonIgnore
  public @Nullable Character getDelimiter() {
    return delimiter;
  }

  @JsonProperty("delimiter")
  public @Nullable String getDelimiterText() {
    return delimiter == null ? null : String.valueOf(delimiter);
  }

  @JsonProperty("hasHeader")
  public boolean hasHeader() {
    return hasHeader;
  }

  /**
   * Returns the number of delimited records whose field count differed from
   * the schema.
   */
  @JsonProperty("fieldCountMismatches")
  public long getFieldCountMismatches() {
    return fieldCountMismatches;
  }

  /**
   * Returns the number of JSON records that were not objects or not valid
   * JSON.
   */
  @JsonProperty("malformedRecords")
  public long getMalformedRecords() {
    return malformedRecords;
  }

  @JsonProperty("columns")
  public Map<String, ColumnProfile> getColumns() {
    return columns;
  }

  /**
   * Returns the columns in order.
   */
  @JsonIgnore
  public List<ColumnProfile> getColumnList() {
    return new ArrayList<>(columns.values());
  }

  /**
   * Returns the profile of a column, or null if there is no such column.
   */
  public @Nullable ColumnProfile getColumn(String name) {
    return columns.get(name);
  }

  @Override public String toString() {
    return "ProfileReport{rows=" + totalRows + ", columns=" + columns.keySet()
        + ", elapsedMs=" + elapsedMs + "}";
  }

  /**
   * Builder for ProfileReport.
   */
  public static class Builder {
    private long totalRows;
    private long elapsedMs;
    private long bytesProcessed;
    private InputFormat format = InputFormat.CSV;
    private @Nullable Character delimiter;
    private boolean hasHeader;
    private long fieldCountMismatches;
    private long malformedRecords;
    private final ImmutableMap.Builder<String, ColumnProfile> columns = ImmutableMap.builder();

    public Builder totalRows(long totalRows) {
      this.totalRows = totalRows;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public Builder bytesProcessed(long bytesProcessed) {
      this.bytesProcessed = bytesProcessed;
      return this;
    }

    public Builder format(InputFormat format) {
      this.format = format;
      return this;
    }

    public Builder delimiter(@Nullable Character delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder hasHeader(boolean hasHeader) {
      this.hasHeader = hasHeader;
      return this;
    }

    public Builder fieldCountMismatches(long fieldCountMismatches) {
      this.fieldCountMismatches = fieldCountMismatches;
      return this;
    }

    public Builder malformedRecords(long malformedRecords) {
      this.malformedRecords = malformedRecords;
      return this;
    }

    public Builder addColumn(ColumnProfile column) {
      columns.put(column.getName(), column);
      return this;
    }

    public ProfileReport build() {
      return new ProfileReport(this);
    }
  }
}
