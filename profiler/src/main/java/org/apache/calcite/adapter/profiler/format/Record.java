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
package org.apache.calcite.adapter.profiler.format;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One logical row reconstructed from one or more chunks.
 *
 * <p>Delimited records are positional: {@link #getNames()} is null and the
 * values line up with the schema's ordinals. JSON records are keyed: names and
 * values are parallel lists of flattened keys and their raw tokens (a null
 * token is a JSON {@code null}) plus the element counts of the arrays among
 * them. A malformed record carries no values and is only counted.
 */
public final class Record {
  private final long index;
  private final List<@Nullable String> values;
  private final @Nullable List<String> names;
  private final Map<String, Integer> arrayLengths;
  private final boolean malformed;

  private Record(long index, List<@Nullable String> values, @Nullable List<String> names,
      Map<String, Integer> arrayLengths, boolean malformed) {
    this.index = index;
    this.values = values;
    this.names = names;
    this.arrayLengths = arrayLengths;
    this.malformed = malformed;
  }

  /**
   * Creates a positional record.
   */
  public static Record of(long index, List<String> values) {
    return new Record(index, ImmutableList.copyOf(values), null, ImmutableMap.of(), false);
  }

  /**
   * Creates a keyed record; {@code values} may hold nulls.
   */
  public static Record keyed(long index, List<String> names, List<@Nullable String> values) {
    return keyed(index, names, values, ImmutableMap.of());
  }

  /**
   * Creates a keyed record whose array-valued keys have the given element
   * counts.
   */
  public static Record keyed(long index, List<String> names, List<@Nullable String> values,
      Map<String, Integer> arrayLengths) {
    if (names.size() != values.size()) {
      throw new IllegalArgumentException("names and values differ in size");
    }
    return new Record(index, Collections.unmodifiableList(new ArrayList<>(values)),
        ImmutableList.copyOf(names), ImmutableMap.copyOf(arrayLengths), false);
  }

  /**
   * Creates a record that could not be decoded.
   */
  public static Record malformed(long index) {
    return new Record(index, ImmutableList.of(), null, ImmutableMap.of(), true);
  }

  /**
   * Returns the zero-based position of this record in the stream.
   */
  public long getIndex() {
    return index;
  }

  public List<@Nullable String> getValues() {
    return values;
  }

  public @Nullable List<String> getNames() {
    return names;
  }

  /**
   * Returns the element count of each array-valued key; empty for delimited
   * records.
   */
  public Map<String, Integer> getArrayLengths() {
    return arrayLengths;
  }

  public int size() {
    return values.size();
  }

  public boolean isKeyed() {
    return names != null;
  }

  public boolean isMalformed() {
    return malformed;
  }

  @Override public String toString() {
    if (malformed) {
      return "Record#" + index + "(malformed)";
    }
    return "Record#" + index + (names == null ? values : names + "=" + values);
  }
}
