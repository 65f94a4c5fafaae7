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

import java.util.Objects;

/**
 * Position, name and type of a discovered column.
 *
 * <p>Immutable. The type is {@link DataType#UNKNOWN} while the column's sample
 * window is open.
 */
public final class ColumnSchema {
  private final int ordinal;
  private final String name;
  private final DataType type;

  public ColumnSchema(int ordinal, String name, DataType type) {
    this.ordinal = ordinal;
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
  }

  /**
   * Returns the name synthesized for a headerless column, {@code col_N}
   * counting from 1.
   */
  public static String syntheticName(int ordinal) {
    return "col_" + (ordinal + 1);
  }

  public int getOrdinal() {
    return ordinal;
  }

  public String getName() {
    return name;
  }

  public DataType getType() {
    return type;
  }

  public ColumnSchema withType(DataType type) {
    return new ColumnSchema(ordinal, name, type);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnSchema)) {
      return false;
    }
    ColumnSchema that = (ColumnSchema) o;
    return ordinal == that.ordinal && name.equals(that.name) && type == that.type;
  }

  @Override public int hashCode() {
    return Objects.hash(ordinal, name, type);
  }

  @Override public String toString() {
    return name + "#" + ordinal + ":" + type.getDisplayName();
  }
}
