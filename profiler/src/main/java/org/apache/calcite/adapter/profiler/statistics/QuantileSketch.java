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

import java.util.Arrays;

/**
 * Merging t-digest for streaming quantile estimation.
 *
 * <p>Incoming values are collected in a fixed-size buffer; when it fills, the
 * buffer and the existing centroids are sorted together and merged in one
 * sweep. The arcsine scale function {@code k(q) = d / (2 pi) * asin(2q - 1)}
 * allows a centroid to span at most one unit of {@code k}, so centroids are
 * small near q = 0 and q = 1 and wide around the median. The number of
 * centroids never exceeds {@code compression + 2}, so memory is fixed at
 * construction. Exact minimum and maximum are kept for interpolation at the
 * ends.
 */
public class QuantileSketch {
  private final double compression;

  private final double[] means;
  private final double[] weights;
  private int centroidCount;

  private final double[] buffer;
  private int bufferCount;

  // merge scratch space, sized for centroids plus a full buffer
  private final double[] mergeMeans;
  private final double[] mergeWeights;
  private final Integer[] order;

  private double totalWeight;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;

  public QuantileSketch(int compression) {
    if (compression < 10) {
      throw new IllegalArgumentException("compression must be at least 10: " + compression);
    }
    this.compression = compression;
    int capacity = compression + 10;
    this.means = new double[capacity];
    this.weights = new double[capacity];
    this.buffer = new double[compression * 5];
    this.mergeMeans = new double[capacity + buffer.length];
    this.mergeWeights = new double[capacity + buffer.length];
    this.order = new Integer[capacity + buffer.length];
  }

  /**
   * Adds a value. NaN is ignored.
   */
  public void add(double x) {
    if (Double.isNaN(x)) {
      return;
    }
    if (bufferCount == buffer.length) {
      merge();
    }
    buffer[bufferCount++] = x;
    totalWeight++;
    min = Math.min(min, x);
    max = Math.max(max, x);
  }

  /**
   * Returns the number of values added.
   */
  public long size() {
    return (long) totalWeight;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  /**
   * Returns the number of centroids after all buffered values are merged.
   */
  public int centroidCount() {
    merge();
    return centroidCount;
  }

  /**
   * Estimates the value at quantile {@code q}.
   *
   * @param q Quantile in [0, 1]
   * @return The estimate, or NaN if the sketch is empty
   */
  public double quantile(double q) {
    if (q < 0 || q > 1) {
      throw new IllegalArgumentException("q must be in [0, 1]: " + q);
    }
    merge();
    if (centroidCount == 0) {
      return Double.NaN;
    }
    if (centroidCount == 1 || min == max) {
      return means[0];
    }
    double index = q * totalWeight;
    if (index <= 0) {
      return min;
    }
    if (index >= totalWeight) {
      return max;
    }

    double firstHalf = weights[0] / 2;
    if (index < firstHalf) {
      return min + (index / firstHalf) * (means[0] - min);
    }
    int last = centroidCount - 1;
    double lastHalf = weights[last] / 2;
    if (index > totalWeight - lastHalf) {
      return max - ((totalWeight - index) / lastHalf) * (max - means[last]);
    }

    double weightSoFar = firstHalf;
    for (int i = 0; i < last; i++) {
      double step = (weights[i] + weights[i + 1]) / 2;
      if (weightSoFar + step >= index) {
        double fraction = (index - weightSoFar) / step;
        return means[i] + fraction * (means[i + 1] - means[i]);
      }
      weightSoFar += step;
    }
    return means[last];
  }

  /**
   * Estimates the fraction of values less than or equal to {@code x}.
   *
   * @return A value in [0, 1], or NaN if the sketch is empty
   */
  public double cdf(double x) {
    merge();
    if (centroidCount == 0) {
      return Double.NaN;
    }
    if (x < min) {
      return 0;
    }
    if (x >= max) {
      return 1;
    }
    if (x < means[0]) {
      double span = means[0] - min;
      double mass = span <= 0 ? 0 : (x - min) / span * weights[0] / 2;
      return mass / totalWeight;
    }

    double weightSoFar = 0;
    int last = centroidCount - 1;
    for (int i = 0; i < last; i++) {
      if (x < means[i + 1]) {
        double span = means[i + 1] - means[i];
        double left = weightSoFar + weights[i] / 2;
        double mass = span <= 0
            ? left
            : left + (x - means[i]) / span * (weights[i] + weights[i + 1]) / 2;
        return Math.min(1, mass / totalWeight);
      }
      weightSoFar += weights[i];
    }
    double span = max - means[last];
    double left = totalWeight - weights[last] / 2;
    double mass = span <= 0 ? totalWeight : left + (x - means[last]) / span * weights[last] / 2;
    return Math.min(1, mass / totalWeight);
  }

  /**
   * Returns the allocated size of all arrays, which never changes.
   */
  public long sizeInBytes() {
    return (long) Double.BYTES
        * (means.length + weights.length + buffer.length + mergeMeans.length + mergeWeights.length)
        + (long) Integer.BYTES * order.length;
  }

  private void merge() {
    if (bufferCount == 0) {
      return;
    }
    int n = 0;
    for (int i = 0; i < centroidCount; i++) {
      mergeMeans[n] = means[i];
      mergeWeights[n] = weights[i];
      n++;
    }
    for (int i = 0; i < bufferCount; i++) {
      mergeMeans[n] = buffer[i];
      mergeWeights[n] = 1;
      n++;
    }
    bufferCount = 0;

    for (int i = 0; i < n; i++) {
      order[i] = i;
    }
    Arrays.sort(order, 0, n, (a, b) -> Double.compare(mergeMeans[a], mergeMeans[b]));

    centroidCount = 0;
    double weightSoFar = 0;
    double limit = totalWeight * inverseScale(scale(0) + 1);
    int first = order[0];
    double currentMean = mergeMeans[first];
    double currentWeight = mergeWeights[first];
    for (int j = 1; j < n; j++) {
      int idx = order[j];
      double proposed = currentWeight + mergeWeights[idx];
      if (weightSoFar + proposed <= limit) {
        currentWeight = proposed;
        currentMean += (mergeMeans[idx] - currentMean) * mergeWeights[idx] / currentWeight;
      } else {
        weightSoFar += currentWeight;
        emit(currentMean, currentWeight);
        limit = totalWeight * inverseScale(scale(weightSoFar / totalWeight) + 1);
        currentMean = mergeMeans[idx];
        currentWeight = mergeWeights[idx];
      }
    }
    emit(currentMean, currentWeight);
  }

  private void emit(double mean, double weight) {
    if (centroidCount == means.length) {
      // Merge into the last centroid rather than growing
      int last = centroidCount - 1;
      double combined = weights[last] + weight;
      means[last] += (mean - means[last]) * weight / combined;
      weights[last] = combined;
      return;
    }
    means[centroidCount] = mean;
    weights[centroidCount] = weight;
    centroidCount++;
  }

  private double scale(double q) {
    return compression / (2 * Math.PI) * Math.asin(2 * q - 1);
  }

  private double inverseScale(double k) {
    double bounded = Math.max(-compression / 4, Math.min(compression / 4, k));
    return (Math.sin(bounded * 2 * Math.PI / compression) + 1) / 2;
  }
}
