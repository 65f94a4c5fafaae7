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
package org.apache.calcite.adapter.profiler.value;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Inferred type of a column.
 *
 * <p>{@link #UNKNOWN} only exists while a column's sample window is open; a
 * finished report never contains it.
 */
public enum DataType {
  INTEGER("Integer"),
  NUMERIC("Numeric"),
  BOOLEAN("Boolean"),
  DATE("Date"),
  DATETIME("DateTime"),
  STRING("String"),
  MIXED("Mixed"),
  EMPTY("Empty"),
  UNKNOWN("Unknown");

  private static final Map<String, DataType> MAP;

  static {
    ImmutableMap.Builder<String, DataType> builder = ImmutableMap.builder();
    for (DataType value : values()) {
      builder.put(value.displayName.toLowerCase(Locale.ROOT), value);
    }
    // Aliases accepted in schema hints
    builder.put("int", INTEGER);
    builder.put("long", INTEGER);
    builder.put("double", NUMERIC);
    builder.put("float", NUMERIC);
    builder.put("bool", BOOLEAN);
    builder.put("timestamp", DATETIME);
    builder.put("varchar", STRING);
    MAP = builder.build();
  }

  private final String displayName;

  DataType(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the name used in serialized reports, e.g. {@code "Integer"}.
   */
  public String getDisplayName() {
    return displayName;
  }

  /**
   * Returns whether values of this type feed the numeric accumulators.
   */
  public boolean isNumeric() {
    return this == INTEGER || this == NUMERIC;
  }

  /**
   * Returns whether values of this type feed the frequency sketch and top-K.
   */
  public boolean isCategorical() {
    return this == STRING || this == BOOLEAN || this == MIXED || this == DATE;
  }

  public boolean isTemporal() {
    return this == DATE || this == DATETIME;
  }

  /**
   * Looks up a type by display name or alias, case-insensitively.
   */
  public static @Nullable DataType of(String name) {
    return MAP.get(name.trim().toLowerCase(Locale.ROOT));
  }
}
