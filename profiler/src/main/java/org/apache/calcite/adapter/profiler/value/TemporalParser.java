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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

/**
 * Recognizes the fixed set of accepted date and date-time layouts.
 *
 * <p>Dates: {@code yyyy-MM-dd}, {@code yyyy/MM/dd}, {@code MM/dd/yyyy},
 * {@code dd/MM/yyyy} and {@code dd.MM.yyyy} (month-first wins when both
 * readings are valid). Date-times: ISO-8601 local date-times with {@code T} or
 * a space separator, optional seconds and fraction, and ISO-8601 date-times
 * with an offset or {@code Z}, which are normalized to UTC.
 */
final class TemporalParser {

  private static final List<DateTimeFormatter> DATE_FORMATS = ImmutableList.of(
      strict("uuuu-MM-dd"),
      strict("uuuu/MM/dd"),
      strict("MM/dd/uuuu"),
      strict("dd/MM/uuuu"),
      strict("dd.MM.uuuu"));

  private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral(' ')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .toFormatter()
      .withResolverStyle(ResolverStyle.STRICT);

  private TemporalParser() {
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }

  /**
   * Parses a date, or returns null when no date layout matches.
   */
  static @Nullable LocalDate parseDate(String text) {
    int length = text.length();
    if (length < 8 || length > 10 || !Character.isDigit(text.charAt(0))) {
      return null;
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(text, format);
      } catch (DateTimeParseException e) {
        // try the next layout
      }
    }
    return null;
  }

  /**
   * Parses a date-time, or returns null when no date-time layout matches.
   */
  static @Nullable LocalDateTime parseDateTime(String text) {
    int length = text.length();
    if (length < 16 || length > 40 || !Character.isDigit(text.charAt(0))) {
      return null;
    }
    char separator = text.charAt(10);
    if (separator == 'T') {
      try {
        return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
      } catch (DateTimeParseException e) {
        // may carry an offset
      }
      try {
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .withOffsetSameInstant(ZoneOffset.UTC)
            .toLocalDateTime();
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    if (separator == ' ') {
      try {
        return LocalDateTime.parse(text, SPACE_SEPARATED);
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    return null;
  }
}
