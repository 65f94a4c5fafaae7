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
package org.apache.calcite.adapter.profiler.format;

import org.apache.calcite.adapter.profiler.ProfilerException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;

/**
 * Turns an ordered stream of byte chunks into complete records.
 *
 * <p>Only the trailing partial record is buffered between chunks. Chunk
 * boundaries are arbitrary: a terminator, a quote or a multi-byte character may
 * be split between two chunks.
 */
public interface RecordReassembler {

  /**
   * Appends a chunk to the pending tail and returns the records it completes.
   *
   * <p>The returned iterator is lazy and must be drained before the next call.
   * An empty chunk yields no records.
   *
   * @throws ProfilerException with {@code PARSE_ERROR} when the pending partial
   *     record has grown beyond the configured limit
   */
  Iterator<Record> feed(byte[] chunk) throws ProfilerException;

  /**
   * Flushes the pending tail at end of input.
   *
   * @return The final record, or null if nothing was pending
   */
  @Nullable Record finish() throws ProfilerException;

  /**
   * Returns the number of records emitted so far, malformed ones included.
   */
  long getRecordCount();
}
