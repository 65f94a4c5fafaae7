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
package org.apache.calcite.adapter.profiler.session;

import org.apache.calcite.adapter.profiler.format.InputFormat;
import org.apache.calcite.adapter.profiler.format.csv.DelimiterSniffer;
import org.apache.calcite.adapter.profiler.value.DataType;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Optional knowledge about the input passed to {@link ProfileSession#start}.
 *
 * <p>Any hint left unset is detected: the format from the first byte, the
 * delimiter and header by sniffing, and column types by the sample window.
 */
public final class SchemaHints {
  private static final SchemaHints NONE = builder().build();

  private final @Nullable InputFormat format;
  private final @Nullable Character delimiter;
  private final @Nullable Boolean hasHeader;
  private final Map<String, DataType> columnTypes;

  private SchemaHints(Builder builder) {
    this.format = builder.format;
    this.delimiter = builder.delimiter;
    this.hasHeader = builder.hasHeader;
    this.columnTypes = ImmutableMap.copyOf(builder.columnTypes);
  }

  public static SchemaHints none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates hints from a YAML/JSON map with optional keys {@code format}
   * ({@code csv}, {@code json_lines}, {@code json_array}), {@code delimiter},
   * {@code hasHeader} and {@code columnTypes} (column name to type name).
   */
  public static SchemaHints fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    Object value = map.get("format");
    if (value != null) {
      builder.format(InputFormat.valueOf(value.toString().trim().toUpperCase(Locale.ROOT)));
    }
    value = map.get("delimiter");
    if (value != null) {
      String text = value.toString();
      builder.delimiter("\\t".equals(text) ? '\t' : text.charAt(0));
    }
    value = map.get("hasHeader");
    if (value instanceof Boolean) {
      builder.hasHeader((Boolean) value);
    }
    value = map.get("columnTypes");
    if (value instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        DataType type = DataType.of(String.valueOf(entry.getValue()));
        if (type == null) {
          throw new IllegalArgumentException("Unknown type '" + entry.getValue()
              + "' for column '" + entry.getKey() + "'");
        }
        builder.columnType(String.valueOf(entry.getKey()), type);
      }
    }
    return builder.build();
  }

  public @Nullable InputFormat getFormat() {
    return format;
  }

  public @Nullable Character getDelimiter() {
    return delimiter;
  }

  public @Nullable Boolean getHasHeader() {
    return hasHeader;
  }

  /**
   * Returns types to lock up front, by column name.
   */
  public Map<String, DataType> getColumnTypes() {
    return columnTypes;
  }

  public @Nullable DataType getColumnType(String column) {
    return columnTypes.get(column);
  }

  @Override public String toString() {
    return "SchemaHints{format=" + format + ", delimiter=" + delimiter
        + ", hasHeader=" + hasHeader + ", columnTypes=" + columnTypes + "}";
  }

  /**
   * Builder for SchemaHints.
   */
  public static class Builder {
    private @Nullable InputFormat format;
    private @Nullable Character delimiter;
    private @Nullable Boolean hasHeader;
    private final Map<String, DataType> columnTypes = new LinkedHashMap<>();

    public Builder format(@Nullable InputFormat format) {
      this.format = format;
      return this;
    }

    public Builder delimiter(@Nullable Character delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder hasHeader(@Nullable Boolean hasHeader) {
      this.hasHeader = hasHeader;
      return this;
    }

    public Builder columnType(String column, DataType type) {
      this.columnTypes.put(column, type);
      return this;
    }

    public SchemaHints build() {
      if (delimiter != null && !DelimiterSniffer.CANDIDATES.contains(delimiter)) {
        throw new IllegalArgumentException("Unsupported delimiter: '" + delimiter + "'");
      }
      for (Map.Entry<String, DataType> entry : columnTypes.entrySet()) {
        DataType type = entry.getValue();
        if (type == DataType.UNKNOWN || type == DataType.EMPTY) {
          throw new IllegalArgumentException("Column '" + entry.getKey()
              + "' cannot be hinted as " + type.getDisplayName());
        }
      }
      return new SchemaHints(this);
    }
  }
}
