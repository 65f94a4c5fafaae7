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
package org.apache.calcite.adapter.profiler.format.csv;

/**
 * Outcome of delimiter sniffing.
 */
public final class SniffResult {
  private final char delimiter;
  private final boolean hasHeader;
  private final int fieldCount;

  public SniffResult(char delimiter, boolean hasHeader, int fieldCount) {
    this.delimiter = delimiter;
    this.hasHeader = hasHeader;
    this.fieldCount = fieldCount;
  }

  public char getDelimiter() {
    return delimiter;
  }

  /**
   * Returns whether the first line is guessed to be a header row.
   */
  public boolean hasHeader() {
    return hasHeader;
  }

  /**
   * Returns the modal number of fields per line in the sample.
   */
  public int getFieldCount() {
    return fieldCount;
  }

  /**
   * Returns a copy with the header guess replaced.
   */
  public SniffResult withHeader(boolean hasHeader) {
    return new SniffResult(delimiter, hasHeader, fieldCount);
  }

  @Override public String toString() {
    return "SniffResult{delimiter='" + (delimiter == '\t' ? "\\t" : String.valueOf(delimiter))
        + "', hasHeader=" + hasHeader + ", fieldCount=" + fieldCount + "}";
  }
}
