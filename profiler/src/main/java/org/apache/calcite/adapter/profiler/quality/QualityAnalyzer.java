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

import org.apache.calcite.adapter.profiler.statistics.ColumnAccumulator;
import org.apache.calcite.adapter.profiler.value.DataType;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives quality metrics and issues from a column's final state.
 */
public final class QualityAnalyzer {

  private QualityAnalyzer() {
  }

  public static QualityMetrics analyze(ColumnAccumulator column) {
    String name = column.getName();
    long count = column.getCount();
    long present = column.getNonMissingCount();

    double completeness = count == 0 ? 1.0 : (double) present / count;
    double uniqueness = present == 0
        ? 1.0
        : Math.min(1.0, (double) column.getDistinctEstimate() / present);
    double typeConsistency = present == 0
        ? 1.0
        : (double) column.getConformingCount() / present;

    List<QualityIssue> issues = new ArrayList<>();
    checkCompleteness(name, completeness, issues);

    if (present > 1 && column.getDistinctEstimate() == 1) {
      issues.add(new QualityIssue(name + "_constant_column",
          "Column has only one unique value (constant)", Severity.WARNING));
    }
    if (column.getType() == DataType.STRING && uniqueness > 0.9) {
      issues.add(new QualityIssue(name + "_high_cardinality",
          String.format(Locale.ROOT,
              "High cardinality: %.1f%% unique values (potential identifier or free text)",
              uniqueness * 100), Severity.INFO));
    }
    if (column.getNonConformingCount() > 0) {
      issues.add(new QualityIssue(name + "_type_consistency",
          String.format(Locale.ROOT, "%d values (%.1f%%) do not conform to type %s",
              column.getNonConformingCount(), (1 - typeConsistency) * 100,
              column.getType().getDisplayName()), Severity.WARNING));
    }

    PiiType piiType = detectPii(column);
    if (piiType != null) {
      issues.add(new QualityIssue(name + "_pii_" + piiType.name().toLowerCase(Locale.ROOT),
          "Column appears to contain " + piiType.getLabel() + " values",
          piiType.getSeverity()));
    }
    return new QualityMetrics(completeness, uniqueness, typeConsistency, piiType, issues);
  }

  /**
   * Text columns are matched by content with the column name as a fallback.
   * Typed columns (numbers, dates, booleans) are only checked when their name
   * suggests PII, and then need a content match: a {@code zip} integer column
   * or a {@code birth_date} date column.
   */
  private static @Nullable PiiType detectPii(ColumnAccumulator column) {
    DataType type = column.getType();
    if (type == DataType.STRING || type == DataType.MIXED) {
      return PiiDetector.detect(column.getPatternSample(), column.getName());
    }
    PiiType hint = PiiDetector.fromColumnName(column.getName());
    if (hint == null) {
      return null;
    }
    return PiiDetector.detectInValues(column.getPatternSample(), hint);
  }

  private static void checkCompleteness(String name, double completeness,
      List<QualityIssue> issues) {
    if (completeness < 0.5) {
      issues.add(new QualityIssue(name + "_completeness_critical",
          String.format(Locale.ROOT, "Critical: Only %.1f%% of values are present",
              completeness * 100), Severity.ERROR));
    } else if (completeness < 0.9) {
      issues.add(new QualityIssue(name + "_completeness_warning",
          String.format(Locale.ROOT, "Completeness is %.1f%% (below 90%% threshold)",
              completeness * 100), Severity.WARNING));
    } else if (completeness < 1.0) {
      issues.add(new QualityIssue(name + "_completeness_info",
          String.format(Locale.ROOT, "Completeness is %.1f%%", completeness * 100),
          Severity.INFO));
    }
  }
}
