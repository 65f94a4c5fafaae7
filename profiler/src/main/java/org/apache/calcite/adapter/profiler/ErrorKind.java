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
 * Stable discriminator for every condition a profiling session can report.
 *
 * <p>Fatal kinds end the session with exactly one error event. Per-record and
 * per-field kinds are never surfaced individually; they are counted and end up
 * as quality signals in the report. {@link #CANCELLED} is a deliberate terminal
 * state, not an error.
 */
public enum ErrorKind {
  /** Structurally inconsistent input. */
  PARSE_ERROR(Category.FATAL),
  /** Allocation failure while processing the input. */
  RESOURCE_EXHAUSTED(Category.FATAL),
  /** Inbound messages violated the session contract (e.g. chunk order). */
  PROTOCOL_ERROR(Category.FATAL),
  /** A record had a different number of fields than the schema. */
  FIELD_COUNT_MISMATCH(Category.PER_RECORD),
  /** A field could not be coerced to its column's locked type. */
  UNSUPPORTED_TYPE_COERCION(Category.PER_FIELD),
  /** User-initiated cancellation. */
  CANCELLED(Category.CONTROL);

  /** How a kind affects the session. */
  public enum Category {
    FATAL, PER_RECORD, PER_FIELD, CONTROL
  }

  private final Category category;

  ErrorKind(Category category) {
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }

  /**
   * Returns whether this kind aborts the session.
   */
  public boolean isFatal() {
    return category == Category.FATAL;
  }
}
