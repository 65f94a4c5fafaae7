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
package org.apache.calcite.adapter.profiler.session;

import org.apache.calcite.adapter.profiler.ErrorKind;
import org.apache.calcite.adapter.profiler.ProfilerException;

import java.util.Objects;

/**
 * Structured description of the fatal condition that failed a session.
 *
 * <p>Fatal errors are never recoverable: a new session must be started to
 * retry.
 */
public final class SessionError {
  private final ErrorKind kind;
  private final String message;
  private final long recordIndex;

  public SessionError(ErrorKind kind, String message, long recordIndex) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.message = Objects.requireNonNull(message, "message");
    this.recordIndex = recordIndex;
  }

  public static SessionError of(ProfilerException e) {
    String message = e.getMessage() == null ? e.getKind().name() : e.getMessage();
    return new SessionError(e.getKind(), message, e.getRecordIndex());
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  /**
   * Returns the index of the offending record, or
   * {@link ProfilerException#UNKNOWN_RECORD}.
   */
  public long getRecordIndex() {
    return recordIndex;
  }

  public boolean isRecoverable() {
    return false;
  }

  /**
   * Converts back to an exception, for callers that wait on a future.
   */
  public ProfilerException toException() {
    return new ProfilerException(kind, message, recordIndex);
  }

  @Override public String toString() {
    return kind + ": " + message
        + (recordIndex == ProfilerException.UNKNOWN_RECORD ? "" : " (record " + recordIndex + ")");
  }
}
