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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Moments, extremes and quantiles of a numeric column.
 */
@JsonPropertyOrder({"mean", "stdDev", "variance", "skewness", "kurtosis", "min", "max", "sum",
    "p25", "p50", "p75", "p90", "p95", "p99"})
public final class NumericStats {
  private final double mean;
  private final double stdDev;
  private final double variance;
  private final double skewness;
  private final double kurtosis;
  private final double min;
  private final double max;
  private final double sum;
  private final double p25;
  private final double p50;
  private final double p75;
  private final double p90;
  private final double p95;
  private final double p99;

  private NumericStats(Builder builder) {
    this.mean = builder.mean;
    this.stdDev = builder.stdDev;
    this.variance = builder.variance;
    this.skewness = builder.skewness;
    this.kurtosis = builder.kurtosis;
    this.min = builder.min;
    this.max = builder.max;
    this.sum = builder.sum;
    this.p25 = builder.p25;
    this.p50 = builder.p50;
    this.p75 = builder.p75;
    this.p90 = builder.p90;
    this.p95 = builder.p95;
    this.p99 = builder.p99;
  }

  public static Builder builder() {
    return new Builder();
  }

  @JsonProperty("mean")
  public double getMean() {
    return mean;
  }

  @JsonProperty("stdDev")
  public double getStdDev() {
    return stdDev;
  }

  /**
   * Returns the sample variance.
   */
  @JsonProperty("variance")
  public double getVariance() {
    return variance;
  }

  @JsonProperty("skewness")
  public double getSkewness() {
    return skewness;
  }

  /**
   * Returns the (non-excess) kurtosis; 3 for a normal distribution.
   */
  @JsonProperty("kurtosis")
  public double getKurtosis() {
    return kurtosis;
  }

  @JsonProperty("min")
  public double getMin() {
    return min;
  }

  @JsonProperty("max")
  public double getMax() {
    return max;
  }

  @JsonProperty("sum")
  public double getSum() {
    return sum;
  }

  @JsonProperty("p25")
  public double getP25() {
    return p25;
  }

  @JsonProperty("p50")
  public double getP50() {
    return p50;
  }

  @JsonProperty("p75")
  public double getP75() {
    return p75;
  }

  @JsonProperty("p90")
  public double getP90() {
    return p90;
  }

  @JsonProperty("p95")
  public double getP95() {
    return p95;
  }

  @JsonProperty("p99")
  public double getP99() {
    return p99;
  }

  /**
   * Builder for NumericStats.
   */
  public static class Builder {
    private double mean;
    private double stdDev;
    private double variance;
    private double skewness;
    private double kurtosis;
    private double min;
    private double max;
    private double sum;
    private double p25;
    private double p50;
    private double p75;
    private double p90;
    private double p95;
    private double p99;

    public Builder mean(double mean) {
      this.mean = mean;
      return this;
    }

    public Builder stdDev(double stdDev) {
      this.stdDev = stdDev;
      return this;
    }

    public Builder variance(double variance) {
      this.variance = variance;
      return this;
    }

    public Builder skewness(double skewness) {
      this.skewness = skewness;
      return this;
    }

    public Builder kurtosis(double kurtosis) {
      this.kurtosis = kurtosis;
      return this;
    }

    public Builder min(double min) {
      this.min = min;
      return this;
    }

    public Builder max(double max) {
      this.max = max;
      return this;
    }

    public Builder sum(double sum) {
      this.sum = sum;
      return this;
    }

    /**
     * Sets p25, p50, p75, p90, p95 and p99, in that order.
     */
    public Builder percentiles(double p25, double p50, double p75, double p90, double p95,
        double p99) {
      this.p25 = p25;
      this.p50 = p50;
      this.p75 = p75;
      this.p90 = p90;
      this.p95 = p95;
      this.p99 = p99;
      return this;
    }

    public NumericStats build() {
      return new NumericStats(this);
    }
  }
}
