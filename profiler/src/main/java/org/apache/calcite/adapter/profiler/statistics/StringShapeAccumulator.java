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
 * Minimum and maximum length, in code points, of a column's values.
 */
public class StringShapeAccumulator {
  private int minLength = Integer.MAX_VALUE;
  private int maxLength = -1;

  public void add(String text) {
    int length = text.codePointCount(0, text.length());
    minLength = Math.min(minLength, length);
    maxLength = Math.max(maxLength, length);
  }

  public boolean isEmpty() {
    return maxLength < 0;
  }

  public int getMinLength() {
    return isEmpty() ? 0 : minLength;
  }

  public int getMaxLength() {
    return isEmpty() ? 0 : maxLength;
  }
}
