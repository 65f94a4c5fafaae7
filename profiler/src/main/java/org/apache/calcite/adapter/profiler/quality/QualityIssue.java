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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A data quality finding for one column.
 */
@JsonPropertyOrder({"id", "message", "severity"})
public final class QualityIssue {
  private final String id;
  private final String message;
  private final Severity severity;

  public QualityIssue(String id, String message, Severity severity) {
    this.id = Objects.requireNonNull(id, "id");
    this.message = Objects.requireNonNull(message, "message");
    this.severity = Objects.requireNonNull(severity, "severity");
  }

  /**
   * Returns a stable identifier of the form {@code <column>_<check>}.
   */
  @JsonProperty("id")
  public String getId() {
    return id;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @JsonProperty("severity")
  public Severity getSeverity() {
    return severity;
  }

  @Override public String toString() {
    return severity + " " + id + ": " + message;
  }
}
