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

import org.apache.calcite.adapter.profiler.util.NullEquivalents;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts raw field tokens into typed {@link Value}s.
 *
 * <p>{@link #classify(String)} runs the type tests in order of restrictiveness
 * (missing, Boolean, Integer, Numeric, Date, DateTime, String) and is used while
 * a column's sample window is open. {@link #coerce(Value, DataType)} is used
 * once the column type is locked; it returns null for a value that does not
 * conform to the locked type. Neither method throws for bad data.
 */
public class FieldDecoder {

  private static final Map<String, Boolean> BOOLEAN_LITERALS = ImmutableMap.<String, Boolean>builder()
      .put("true", true)
      .put("false", false)
      .put("t", true)
      .put("f", false)
      .build();

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");

  private static final Pattern NUMERIC_PATTERN =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private final Set<String> nullEquivalents;

  public FieldDecoder() {
    this(NullEquivalents.DEFAULT_NULL_EQUIVALENTS);
  }

  /**
   * Creates a decoder.
   *
   * @param nullEquivalents Upper-case tokens treated as missing
   */
  public FieldDecoder(Set<String> nullEquivalents) {
    this.nullEquivalents = nullEquivalents;
  }

  /**
   * Classifies a raw token against every candidate type.
   *
   * @param raw Raw token, or null when the field is absent
   * @return The most restrictive matching value; never null
   */
  public Value classify(@Nullable String raw) {
    if (NullEquivalents.isMissing(raw, nullEquivalents)) {
      return Value.missing();
    }
    String text = raw.trim();

    Boolean bool = BOOLEAN_LITERALS.get(text.toLowerCase(Locale.ROOT));
    if (bool != null) {
      return Value.ofBoolean(bool, text);
    }

    if (INTEGER_PATTERN.matcher(text).matches()) {
      try {
        return Value.ofLong(Long.parseLong(text), text);
      } catch (NumberFormatException e) {
        // Too large for 64 bits, still a number
        return Value.ofDouble(Double.parseDouble(text), text);
      }
    }

    if (NUMERIC_PATTERN.matcher(text).matches()) {
      return Value.ofDouble(Double.parseDouble(text), text);
    }

    LocalDate date = TemporalParser.parseDate(text);
    if (date != null) {
      return Value.ofTemporal(date.atStartOfDay(), true, text);
    }

    LocalDateTime dateTime = TemporalParser.parseDateTime(text);
    if (dateTime != null) {
      return Value.ofTemporal(dateTime, false, text);
    }

    return Value.ofText(text);
  }

  /**
   * Coerces a classified value to a locked column type.
   *
   * @param classified Result of {@link #classify(String)}; must not be missing
   * @param type Locked column type
   * @return The coerced value, or null if the value does not conform
   */
  public @Nullable Value coerce(Value classified, DataType type) {
    switch (type) {
    case INTEGER:
      return classified.kind() == Value.Kind.INT ? classified : null;
    case NUMERIC:
      if (classified.kind() == Value.Kind.INT) {
        return Value.ofDouble(classified.asDouble(), classified.text());
      }
      return classified.kind() == Value.Kind.FLOAT ? classified : null;
    case BOOLEAN:
      return classified.kind() == Value.Kind.BOOL ? classified : null;
    case DATE:
      if (classified instanceof Value.TemporalValue
          && ((Value.TemporalValue) classified).isDateOnly()) {
        return classified;
      }
      return null;
    case DATETIME:
      return classified.kind() == Value.Kind.TEMPORAL ? classified : null;
    case STRING:
      return classified.kind() == Value.Kind.TEXT ? classified : Value.ofText(classified.text());
    case MIXED:
      return classified;
    default:
      return null;
    }
  }

  /**
   * Decodes a raw token straight to a locked column type.
   *
   * @return {@link Value#missing()} for a missing token, the coerced value, or
   *     null when the token does not conform
   */
  public @Nullable Value decode(@Nullable String raw, DataType type) {
    Value classified = classify(raw);
    if (classified.isMissing()) {
      return classified;
    }
    return coerce(classified, type);
  }

  /**
   * Returns the candidate type a classified value votes for during the sample
   * window.
   */
  public static DataType candidateType(Value value) {
    switch (value.kind()) {
    case BOOL:
      return DataType.BOOLEAN;
    case INT:
      return DataType.INTEGER;
    case FLOAT:
      return DataType.NUMERIC;
    case TEMPORAL:
      return ((Value.TemporalValue) value).isDateOnly() ? DataType.DATE : DataType.DATETIME;
    case TEXT:
      return DataType.STRING;
    default:
      return DataType.EMPTY;
    }
  }
}
