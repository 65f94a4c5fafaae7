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

import org.apache.calcite.adapter.profiler.ErrorKind;
import org.apache.calcite.adapter.profiler.ProfilerException;

import com.google.common.collect.AbstractIterator;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Iterator;

/**
 * Base class for reassemblers that keep the pending tail in a growable byte
 * buffer.
 *
 * <p>Bytes in {@code [recordStart, limit)} are the pending tail. Subclasses scan
 * forward from {@code scanPos} and keep whatever scanner state they need
 * (quote state, nesting depth) across chunks, so no byte is scanned twice.
 * Subclasses must only refer to buffered bytes through {@code recordStart} and
 * {@code scanPos}; both are shifted when the buffer is compacted.
 */
public abstract class AbstractRecordReassembler implements RecordReassembler {
  private static final int INITIAL_CAPACITY = 8192;

  private final int maxRecordBytes;

  protected byte[] buffer = new byte[INITIAL_CAPACITY];
  protected int limit;
  protected int recordStart;
  protected int scanPos;

  private long recordCount;
  private @Nullable Iterator<Record> current;
  private boolean finished;

  protected AbstractRecordReassembler(int maxRecordBytes) {
    this.maxRecordBytes = maxRecordBytes;
  }

  @Override public Iterator<Record> feed(byte[] chunk) throws ProfilerException {
    checkDrained();
    if (finished) {
      throw new IllegalStateException("Reassembler already finished");
    }
    compact();
    checkTailSize();
    if (chunk.length > 0) {
      append(chunk);
    }
    current = new AbstractIterator<Record>() {
      @Override protected Record computeNext() {
        Record record = scanNext();
        return record == null ? endOfData() : record;
      }
    };
    return current;
  }

  @Override public @Nullable Record finish() throws ProfilerException {
    checkDrained();
    if (finished) {
      return null;
    }
    finished = true;
    compact();
    checkTailSize();
    Record record = null;
    if (limit > 0) {
      record = flushTail();
    }
    limit = 0;
    scanPos = 0;
    recordStart = 0;
    return record;
  }

  @Override public long getRecordCount() {
    return recordCount;
  }

  /**
   * Returns the number of bytes currently held as the pending tail.
   */
  public int getPendingBytes() {
    return limit - recordStart;
  }

  /**
   * Scans from {@code scanPos} for the next complete record.
   *
   * @return The record, or null when the buffered bytes hold no further
   *     complete record
   */
  protected abstract @Nullable Record scanNext();

  /**
   * Converts whatever is left in {@code [recordStart, limit)} at end of input.
   */
  protected abstract @Nullable Record flushTail();

  /**
   * Allocates the index of the next emitted record.
   */
  protected long nextIndex() {
    return recordCount++;
  }

  private void checkDrained() {
    if (current != null && current.hasNext()) {
      throw new IllegalStateException("Records of the previous chunk were not consumed");
    }
    current = null;
  }

  private void checkTailSize() throws ProfilerException {
    int pending = limit - recordStart;
    if (pending > maxRecordBytes) {
      throw new ProfilerException(ErrorKind.PARSE_ERROR,
          "Record exceeds " + maxRecordBytes + " bytes without a terminator ("
              + pending + " bytes pending)", recordCount);
    }
  }

  private void compact() {
    if (recordStart == 0) {
      return;
    }
    int pending = limit - recordStart;
    System.arraycopy(buffer, recordStart, buffer, 0, pending);
    scanPos -= recordStart;
    limit = pending;
    recordStart = 0;
  }

  private void append(byte[] chunk) {
    int required = limit + chunk.length;
    if (required > buffer.length) {
      int capacity = Math.max(buffer.length * 2, required);
      buffer = Arrays.copyOf(buffer, capacity);
    }
    System.arraycopy(chunk, 0, buffer, limit, chunk.length);
    limit = required;
  }
}
