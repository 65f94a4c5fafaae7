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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Quality scores and findings of one column.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"completeness", "uniqueness", "typeConsistency", "piiType", "issues"})
public final class QualityMetrics {
  private final double completeness;
  private final double uniqueness;
  private final double typeConsistency;
  private final @Nullable PiiType piiType;
  private final List<QualityIssue> issues;

  public QualityMetrics(double completeness, double uniqueness, double typeConsistency,
      @Nullable PiiType piiType, List<QualityIssue> issues) {
    this.completeness = completeness;
    this.uniqueness = uniqueness;
    this.typeConsistency = typeConsistency;
    this.piiType = piiType;
    this.issues = ImmutableList.copyOf(issues);
  }

  /**
   * Returns the share of values that are present; 1.0 for an empty column.
   */
  @JsonProperty("completeness")
  public double getCompleteness() {
    return completeness;
  }

  /**
   * Returns the estimated share of distinct values among present values.
   */
  @JsonProperty("uniqueness")
  public double getUniqueness() {
    return uniqueness;
  }

  /**
   * Returns the share of present values that conform to the inferred type.
   */
  @JsonProperty("typeConsistency")
  public double getTypeConsistency() {
    return typeConsistency;
  }

  @JsonProperty("piiType")
  public @Nullable PiiType getPiiType() {
    return piiType;
  }

  @JsonProperty("issues")
  public List<QualityIssue> getIssues() {
    return issues;
  }

  /**
   * Returns whether any issue has the given severity.
   */
  public boolean hasIssue(Severity severity) {
    for (QualityIssue issue : issues) {
      if (issue.getSeverity() == severity) {
        return true;
      }
    }
    return false;
  }
}
