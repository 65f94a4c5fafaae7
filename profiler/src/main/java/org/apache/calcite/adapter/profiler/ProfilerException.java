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
package org.apache.calcite.adapter.profiler;

/**
 * Indicates that profiling failed with a fatal condition.
 *
 * <p>Carries the {@link ErrorKind} and, where known, the index of the offending
 * record so a caller can render a specific message.
 */
public class ProfilerException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Record index used when the offending record is not known. */
  public static final long UNKNOWN_RECORD = -1L;

  private final ErrorKind kind;
  private final long recordIndex;

  public ProfilerException(ErrorKind kind, String message) {
    this(kind, message, UNKNOWN_RECORD);
  }

  public ProfilerException(ErrorKind kind, String message, long recordIndex) {
    super(message);
    this.kind = kind;
    this.recordIndex = recordIndex;
  }

  public ProfilerException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.recordIndex = UNKNOWN_RECORD;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Returns the zero-based index of the offending record, or
   * {@link #UNKNOWN_RECORD}.
   */
  public long getRecordIndex() {
    return recordIndex;
  }
}
