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
package org.apache.calcite.adapter.profiler.quality;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects PII patterns in a sample of column values.
 *
 * <p>A type is reported when at least 30% of the sample (and at least one
 * value) matches it. Types are checked from most to least sensitive, so a
 * column matching both SSN and phone patterns is reported as SSN.
 *
 * <p>The column name is a secondary signal. A name suggesting a date of birth
 * halves the share dates need; postal codes are reported only when the name
 * suggests them; and when no content pattern matches, the type suggested by
 * the name is reported on its own.
 */
public final class PiiDetector {
  private static final Pattern EMAIL =
      Pattern.compile("(?i)\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b");
  private static final Pattern PHONE =
      Pattern.compile("(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");
  private static final Pattern SSN = Pattern.compile("^\\d{3}-\\d{2}-\\d{4}$");
  private static final Pattern CREDIT_CARD =
      Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4,7}\\b");
  private static final Pattern IP_ADDRESS =
      Pattern.compile("\\b(?:[0-9]{1,3}\\.){3}[0-9]{1,3}\\b");
  private static final Pattern DATE_OF_BIRTH =
      Pattern.compile("\\b(?:19|20)\\d{2}[-/](?:0[1-9]|1[0-2])[-/](?:0[1-9]|[12]\\d|3[01])\\b");
  private static final Pattern US_POSTAL_CODE = Pattern.compile("\\b\\d{5}(?:-\\d{4})?\\b");
  private static final Pattern CANADIAN_POSTAL_CODE =
      Pattern.compile("(?i)\\b[A-Z]\\d[A-Z]\\s?\\d[A-Z]\\d\\b");

  private static final String[] IP_NAME_HINTS = {"ip_address", "ipaddress", "ip_addr",
      "client_ip", "user_ip", "server_ip", "source_ip", "dest_ip", "remote_ip"};

  private PiiDetector() {
  }

  /**
   * Returns the most sensitive PII type matched by the sample, or null.
   */
  public static @Nullable PiiType detect(List<String> sample) {
    return detect(sample, null);
  }

  /**
   * Returns the most sensitive PII type matched by the sample, falling back to
   * the type suggested by the column name.
   *
   * @param sample Non-missing values
   * @param columnName Column name, or null to use content alone
   */
  public static @Nullable PiiType detect(List<String> sample, @Nullable String columnName) {
    PiiType hint = columnName == null ? null : fromColumnName(columnName);
    PiiType found = detectInValues(sample, hint);
    return found != null ? found : hint;
  }

  /**
   * Returns the PII type matched by the sample's content, or null; the name
   * hint only adjusts the date of birth and postal code rules.
   */
  public static @Nullable PiiType detectInValues(List<String> sample, @Nullable PiiType hint) {
    if (sample.isEmpty()) {
      return null;
    }
    Map<PiiType, Integer> matches = new EnumMap<>(PiiType.class);
    for (String value : sample) {
      String trimmed = value.trim();
      if (trimmed.length() == 11 && SSN.matcher(trimmed).matches()) {
        matches.merge(PiiType.SSN, 1, Integer::sum);
      }
      if (trimmed.length() > 13 && CREDIT_CARD.matcher(trimmed).find()) {
        matches.merge(PiiType.CREDIT_CARD, 1, Integer::sum);
      }
      if (EMAIL.matcher(trimmed).find()) {
        matches.merge(PiiType.EMAIL, 1, Integer::sum);
      }
      if (PHONE.matcher(trimmed).find()) {
        matches.merge(PiiType.PHONE, 1, Integer::sum);
      }
      if (IP_ADDRESS.matcher(trimmed).find()) {
        matches.merge(PiiType.IP_ADDRESS, 1, Integer::sum);
      }
      if (DATE_OF_BIRTH.matcher(trimmed).find()) {
        matches.merge(PiiType.DATE_OF_BIRTH, 1, Integer::sum);
      }
      if (US_POSTAL_CODE.matcher(trimmed).find()
          || CANADIAN_POSTAL_CODE.matcher(trimmed).find()) {
        matches.merge(PiiType.POSTAL_CODE, 1, Integer::sum);
      }
    }

    // 30%, rounded up
    int threshold = Math.max(1, (sample.size() * 3 + 9) / 10);
    // Enum order runs from most to least sensitive
    for (PiiType type : PiiType.values()) {
      int needed = threshold;
      if (type == PiiType.DATE_OF_BIRTH && hint == PiiType.DATE_OF_BIRTH) {
        needed = Math.max(1, threshold / 2);
      } else if (type == PiiType.POSTAL_CODE && hint != PiiType.POSTAL_CODE) {
        continue;
      }
      if (matches.getOrDefault(type, 0) >= needed) {
        return type;
      }
    }
    return null;
  }

  /**
   * Returns the PII type a column name suggests, or null.
   */
  public static @Nullable PiiType fromColumnName(String columnName) {
    String name = columnName.toLowerCase(Locale.ROOT);
    if (name.contains("email") || name.contains("e_mail") || name.contains("e-mail")) {
      return PiiType.EMAIL;
    }
    if (name.contains("phone") || name.contains("mobile") || name.contains("cell")
        || name.contains("tel") || name.contains("fax")) {
      return PiiType.PHONE;
    }
    if (name.contains("ssn") || name.contains("social_security")
        || name.contains("socialsecurity") || name.contains("social-security")) {
      return PiiType.SSN;
    }
    // Before the address check: "ip_address" contains "address"
    if (name.equals("ip")) {
      return PiiType.IP_ADDRESS;
    }
    for (String ipHint : IP_NAME_HINTS) {
      if (name.contains(ipHint)) {
        return PiiType.IP_ADDRESS;
      }
    }
    if (name.contains("address") || name.contains("street") || name.contains("zip")
        || name.contains("postal") || name.contains("postcode")) {
      return PiiType.POSTAL_CODE;
    }
    if (name.contains("dob") || name.contains("birth")) {
      return PiiType.DATE_OF_BIRTH;
    }
    return null;
  }
}
