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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Serves an in-memory byte array in fixed-size chunks.
 */
public class ByteArrayChunkSource implements ByteChunkSource {
  private final byte[] bytes;
  private final int chunkSize;
  private int position;

  public ByteArrayChunkSource(byte[] bytes, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    this.bytes = bytes;
    this.chunkSize = chunkSize;
  }

  public static ByteArrayChunkSource of(String text, int chunkSize) {
    return new ByteArrayChunkSource(text.getBytes(StandardCharsets.UTF_8), chunkSize);
  }

  @Override public byte @Nullable [] nextChunk() {
    if (position >= bytes.length) {
      return null;
    }
    int end = Math.min(bytes.length, position + chunkSize);
    byte[] chunk = Arrays.copyOfRange(bytes, position, end);
    position = end;
    return chunk;
  }

  @Override public long totalSizeHint() {
    return bytes.length;
  }

  @Override public void close() {
  }
}
