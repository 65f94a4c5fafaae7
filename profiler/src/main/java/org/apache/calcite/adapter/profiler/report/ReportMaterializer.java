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
package org.apache.calcite.adapter.profiler.report;

import org.apache.calcite.adapter.profiler.ProfilerConfig;
import org.apache.calcite.adapter.profiler.quality.QualityAnalyzer;
import org.apache.calcite.adapter.profiler.statistics.ArrayLengthAccumulator;
import org.apache.calcite.adapter.profiler.statistics.CategoricalAccumulator;
import org.apache.calcite.adapter.profiler.statistics.ColumnAccumulator;
import org.apache.calcite.adapter.profiler.statistics.NumericAccumulator;
import org.apache.calcite.adapter.profiler.statistics.QuantileSketch;
import org.apache.calcite.adapter.profiler.statistics.TemporalRangeAccumulator;
import org.apache.calcite.adapter.profiler.statistics.TopKTracker;
import org.apache.calcite.adapter.profiler.value.DataType;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every column accumulator once and produces the immutable report.
 *
 * <p>Histograms are derived here, not accumulated: equal-width bins over
 * {@code [min, max]}, {@code ceil(log2(n) + 1)} of them clamped to the
 * configured bounds, with per-bin mass read from the quantile sketch's CDF.
 * Cumulative counts are rounded so the bins always sum to the numeric count.
 */
public class ReportMaterializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReportMaterializer.class);

  private final ProfilerConfig config;

  public ReportMaterializer(ProfilerConfig config) {
    this.config = config;
  }

  /**
   * Builds the report.
   *
   * @param metadata Builder already holding the session metadata
   * @param columns Accumulators in column order; their windows must be closed
   * @return The finished report
   */
  public ProfileReport materialize(ProfileReport.Builder metadata,
      List<ColumnAccumulator> columns) {
    for (ColumnAccumulator column : columns) {
      metadata.addColumn(materializeColumn(column));
    }
    ProfileReport report = metadata.build();
    LOGGER.debug("Materialized {}", report);
    return report;
  }

  ColumnProfile materializeColumn(ColumnAccumulator column) {
    if (!column.isLocked()) {
      throw new IllegalStateException("Column '" + column.getName() + "' is still sampling");
    }
    ColumnProfile.Builder builder = ColumnProfile.builder()
        .name(column.getName())
        .ordinal(column.getOrdinal())
        .inferredType(column.getType())
        .count(column.getCount())
        .missingCount(column.getMissingCount())
        .distinctEstimate(column.getDistinctEstimate())
        .nonConformingCount(column.getNonConformingCount())
        .quality(QualityAnalyzer.analyze(column));

    NumericAccumulator numeric = column.getNumeric();
    if (numeric != null && numeric.getCount() > 0) {
      builder.numericStats(numericStats(numeric));
      builder.histogram(histogram(numeric));
    }

    CategoricalAccumulator categorical = column.getCategorical();
    if (categorical != null && categorical.getObservations() > 0) {
      builder.categoricalStats(categoricalStats(categorical));
    }

    if (!column.getStringShape().isEmpty()) {
      builder.stringStats(new StringStats(column.getStringShape().getMinLength(),
          column.getStringShape().getMaxLength()));
    }

    TemporalRangeAccumulator temporal = column.getTemporal();
    if (temporal != null && temporal.getMin() != null && temporal.getMax() != null) {
      boolean dateOnly = column.getType() == DataType.DATE;
      builder.temporalStats(new TemporalStats(format(temporal.getMin(), dateOnly),
          format(temporal.getMax(), dateOnly)));
    }

    ArrayLengthAccumulator arrays = column.getArrayLengths();
    if (arrays != null) {
      builder.arrayStats(new ArrayStats(arrays.getCount(), arrays.getMinLength(),
          arrays.getMaxLength(), arrays.getAverageLength()));
    }
    return builder.build();
  }

  private static NumericStats numericStats(NumericAccumulator numeric) {
    QuantileSketch quantiles = numeric.getQuantiles();
    return NumericStats.builder()
        .mean(numeric.getMean())
        .stdDev(numeric.getStdDev())
        .variance(numeric.getVariance())
        .skewness(numeric.getSkewness())
        .kurtosis(numeric.getKurtosis())
        .min(numeric.getMin())
        .max(numeric.getMax())
        .sum(numeric.getSum())
        .percentiles(quantiles.quantile(0.25), quantiles.quantile(0.50),
            quantiles.quantile(0.75), quantiles.quantile(0.90), quantiles.quantile(0.95),
            quantiles.quantile(0.99))
        .build();
  }

  private static CategoricalStats categoricalStats(CategoricalAccumulator categorical) {
    List<FrequentValue> values = new ArrayList<>();
    double observations = categorical.getObservations();
    for (TopKTracker.Entry entry : categorical.getTopValues()) {
      values.add(new FrequentValue(entry.getValue(), entry.getCount(),
          entry.getCount() / observations * 100));
    }
    return new CategoricalStats(values);
  }

  /**
   * Returns the number of bins for {@code n} values.
   */
  int binCount(long n) {
    int bins = (int) Math.ceil(Math.log(n) / Math.log(2) + 1);
    return Math.max(config.getHistogramMinBins(), Math.min(config.getHistogramMaxBins(), bins));
  }

  Histogram histogram(NumericAccumulator numeric) {
    long n = numeric.getCount();
    double min = numeric.getMin();
    double max = numeric.getMax();
    List<HistogramBin> bins = new ArrayList<>();
    if (min == max) {
      bins.add(new HistogramBin(min, max, n));
      return new Histogram(bins);
    }

    int binCount = binCount(n);
    double width = (max - min) / binCount;
    QuantileSketch quantiles = numeric.getQuantiles();
    long previous = 0;
    for (int i = 1; i <= binCount; i++) {
      double start = min + (i - 1) * width;
      double end = i == binCount ? max : min + i * width;
      long cumulative = i == binCount ? n : Math.round(n * quantiles.cdf(end));
      cumulative = Math.max(previous, Math.min(n, cumulative));
      bins.add(new HistogramBin(start, end, cumulative - previous));
      previous = cumulative;
    }
    return new Histogram(bins);
  }

  private static String format(@Nullable LocalDateTime value, boolean dateOnly) {
    if (value == null) {
      return "";
    }
    return dateOnly ? value.toLocalDate().toString() : value.toString();
  }
}
