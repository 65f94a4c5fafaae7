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
package org.apache.calcite.adapter.profiler.statistics;

/**
 * Single-pass numeric moments, extremes and quantiles.
 *
 * <p>Mean and the second, third and fourth central moment sums are updated
 * with Welford's recurrence and its higher-order extension, which stays
 * numerically stable for large-magnitude, low-variance data where naive
 * power sums lose precision.
 */
public class NumericAccumulator {
  private final QuantileSketch quantiles;

  private long n;
  private double mean;
  private double m2;
  private double m3;
  private double m4;
  private double sum;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;

  public NumericAccumulator(int quantileSketchCapacity) {
    this.quantiles = new QuantileSketch(quantileSketchCapacity);
  }

  /**
   * Folds one value into the moments and the quantile sketch.
   */
  public void add(double x) {
    long previous = n;
    n++;
    double delta = x - mean;
    double deltaN = delta / n;
    double deltaN2 = deltaN * deltaN;
    double term1 = delta * deltaN * previous;
    mean += deltaN;
    m4 += term1 * deltaN2 * ((double) n * n - 3.0 * n + 3) + 6 * deltaN2 * m2 - 4 * deltaN * m3;
    m3 += term1 * deltaN * (n - 2) - 3 * deltaN * m2;
    m2 += term1;

    sum += x;
    min = Math.min(min, x);
    max = Math.max(max, x);
    quantiles.add(x);
  }

  public long getCount() {
    return n;
  }

  public double getMean() {
    return mean;
  }

  /**
   * Returns the sample variance {@code M2 / (n - 1)}; 0 for fewer than two
   * values.
   */
  public double getVariance() {
    return n > 1 ? m2 / (n - 1) : 0;
  }

  public double getStdDev() {
    return Math.sqrt(getVariance());
  }

  /**
   * Returns {@code (M3 / n) / (M2 / n)^1.5}, or 0 when all values are equal.
   */
  public double getSkewness() {
    if (n == 0 || m2 == 0) {
      return 0;
    }
    return (m3 / n) / Math.pow(m2 / n, 1.5);
  }

  /**
   * Returns the non-excess kurtosis {@code (M4 / n) / (M2 / n)^2}, or 0 when
   * all values are equal.
   */
  public double getKurtosis() {
    if (n == 0 || m2 == 0) {
      return 0;
    }
    double variance = m2 / n;
    return (m4 / n) / (variance * variance);
  }

  public double getSum() {
    return sum;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public QuantileSketch getQuantiles() {
    return quantiles;
  }

  public long sizeInBytes() {
    return quantiles.sizeInBytes() + 8 * Double.BYTES;
  }
}
