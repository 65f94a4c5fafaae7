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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of personally identifiable information recognized in column values.
 */
public enum PiiType {
  SSN("SSN", Severity.ERROR),
  CREDIT_CARD("credit card", Severity.ERROR),
  EMAIL("email", Severity.WARNING),
  PHONE("phone number", Severity.WARNING),
  IP_ADDRESS("IP address", Severity.WARNING),
  DATE_OF_BIRTH("date of birth", Severity.WARNING),
  POSTAL_CODE("postal code", Severity.INFO);

  private final String label;
  private final Severity severity;

  PiiType(String label, Severity severity) {
    this.label = label;
    this.severity = severity;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public Severity getSeverity() {
    return severity;
  }
}
