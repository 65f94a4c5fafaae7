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

import org.apache.calcite.adapter.profiler.ProfilerConfig;
import org.apache.calcite.adapter.profiler.statistics.ColumnAccumulator;
import org.apache.calcite.adapter.profiler.value.FieldDecoder;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link QualityAnalyzer}.
 */
@Tag("unit")
public class QualityAnalyzerTest {

  private static ColumnAccumulator column(String name, String... values) {
    ProfilerConfig config = ProfilerConfig.defaults();
    ColumnAccumulator column = new ColumnAccumulator(0, name, config,
        new FieldDecoder(config.getNullEquivalents()));
    for (String value : values) {
      column.add(value);
    }
    column.closeWindow();
    return column;
  }

  private static boolean hasIssue(QualityMetrics metrics, String id) {
    return metrics.getIssues().stream().anyMatch(issue -> issue.getId().equals(id));
  }

  @Test void testCompleteColumnHasNoIssues() {
    QualityMetrics metrics = QualityAnalyzer.analyze(column("id", "1", "2", "3"));
    assertEquals(1.0, metrics.getCompleteness(), 0.0);
    assertEquals(1.0, metrics.getTypeConsistency(), 0.0);
    assertTrue(metrics.getIssues().isEmpty());
    assertNull(metrics.getPiiType());
  }

  @Test void testCompletenessLevels() {
    QualityMetrics critical = QualityAnalyzer.analyze(column("c", "1", "", "", ""));
    assertTrue(hasIssue(critical, "c_completeness_critical"));
    assertTrue(critical.hasIssue(Severity.ERROR));

    QualityMetrics warning = QualityAnalyzer.analyze(column("w", "1", "2", "3", "4", ""));
    assertTrue(hasIssue(warning, "w_completeness_warning"));
    assertFalse(warning.hasIssue(Severity.ERROR));

    String[] mostlyPresent = new String[20];
    for (int i = 0; i < 19; i++) {
      mostlyPresent[i] = String.valueOf(i);
    }
    mostlyPresent[19] = "";
    QualityMetrics info = QualityAnalyzer.analyze(column("i", mostlyPresent));
    assertTrue(hasIssue(info, "i_completeness_info"));
  }

  @Test void testConstantColumn() {
    QualityMetrics metrics = QualityAnalyzer.analyze(column("k", "x", "x", "x"));
    assertTrue(hasIssue(metrics, "k_constant_column"));
    assertEquals(1.0 / 3, metrics.getUniqueness(), 1e-9);
  }

  @Test void testHighCardinalityString() {
    QualityMetrics metrics = QualityAnalyzer.analyze(column("s", "a", "b", "c", "d"));
    assertTrue(hasIssue(metrics, "s_high_cardinality"));
    assertTrue(metrics.hasIssue(Severity.INFO));
  }

  @Test void testTypeConsistency() {
    String[] values = new String[10];
    for (int i = 0; i < 9; i++) {
      values[i] = String.valueOf(i);
    }
    values[9] = "oops";
    QualityMetrics metrics = QualityAnalyzer.analyze(column("t", values));
    assertEquals(0.9, metrics.getTypeConsistency(), 1e-9);
    assertTrue(hasIssue(metrics, "t_type_consistency"));
  }

  @Test void testPiiOnlyForTextColumns() {
    QualityMetrics email = QualityAnalyzer.analyze(
        column("e", "alice@example.com", "bob@example.org", "carol@example.net"));
    assertEquals(PiiType.EMAIL, email.getPiiType());
    assertTrue(hasIssue(email, "e_pii_email"));

    QualityMetrics numbers = QualityAnalyzer.analyze(column("n", "5551234567", "5559876543"));
    assertNull(numbers.getPiiType());
  }

  @Test void testTypedColumnsNeedNameAndContent() {
    QualityMetrics zip = QualityAnalyzer.analyze(column("zip", "90210", "10001", "60601"));
    assertEquals(PiiType.POSTAL_CODE, zip.getPiiType());
    assertTrue(zip.hasIssue(Severity.INFO));

    QualityMetrics birth = QualityAnalyzer.analyze(
        column("birth_date", "1990-05-01", "1985-12-31", "2001-07-04"));
    assertEquals(PiiType.DATE_OF_BIRTH, birth.getPiiType());
    assertTrue(hasIssue(birth, "birth_date_pii_date_of_birth"));

    QualityMetrics joined = QualityAnalyzer.analyze(
        column("joined", "1990-05-01", "1985-12-31", "2001-07-04"));
    assertNull(joined.getPiiType());

    QualityMetrics phoneCodes = QualityAnalyzer.analyze(column("phone_ext", "12", "34"));
    assertNull(phoneCodes.getPiiType());
  }
}
