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
 * Element counts of the JSON arrays seen in a column: how many arrays, and
 * their minimum, maximum and average length.
 */
public class ArrayLengthAccumulator {
  private long count;
  private int minLength;
  private int maxLength;
  private long totalLength;

  public void add(int length) {
    if (count == 0) {
      minLength = length;
      maxLength = length;
    } else {
      minLength = Math.min(minLength, length);
      maxLength = Math.max(maxLength, length);
    }
    totalLength += length;
    count++;
  }

  public long getCount() {
    return count;
  }

  public int getMinLength() {
    return minLength;
  }

  public int getMaxLength() {
    return maxLength;
  }

  public double getAverageLength() {
    return count == 0 ? 0.0 : (double) totalLength / count;
  }
}
