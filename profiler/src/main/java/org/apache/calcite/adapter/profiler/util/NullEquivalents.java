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
package org.apache.calcite.adapter.profiler.util;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a raw field token counts as a missing value.
 */
public final class NullEquivalents {

  /**
   * Default set of markers that are considered equivalent to a missing value.
   * These are checked case-insensitively.
   */
  public static final Set<String> DEFAULT_NULL_EQUIVALENTS =
      ImmutableSet.of("NULL", "NA", "N/A", "NONE", "NIL");

  private NullEquivalents() {
    // Utility class
  }

  /**
   * Normalizes a collection of markers to the upper-case form used for lookups.
   */
  public static Set<String> normalize(Collection<String> markers) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String marker : markers) {
      builder.add(marker.trim().toUpperCase(Locale.ROOT));
    }
    return builder.build();
  }

  /**
   * Check if a token represents a missing value using the default markers.
   *
   * @param value The raw token, may be null
   * @return true if the token is null, blank, or a null marker
   */
  public static boolean isMissing(@Nullable String value) {
    return isMissing(value, DEFAULT_NULL_EQUIVALENTS);
  }

  /**
   * Check if a token represents a missing value using a custom set of markers.
   *
   * @param value The raw token, may be null
   * @param nullEquivalents Upper-case markers that represent a missing value
   * @return true if the token is null, blank, or a null marker
   */
  public static boolean isMissing(@Nullable String value, Set<String> nullEquivalents) {
    if (value == null) {
      return true;
    }

    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    return nullEquivalents.contains(trimmed.toUpperCase(Locale.ROOT));
  }
}
