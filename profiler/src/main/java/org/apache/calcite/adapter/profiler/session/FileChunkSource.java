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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads a file in fixed-size chunks.
 */
public class FileChunkSource implements ByteChunkSource {
  private final InputStream in;
  private final int chunkSize;
  private final long size;

  public FileChunkSource(Path path, int chunkSize) throws IOException {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    this.size = Files.size(path);
    this.in = Files.newInputStream(path);
    this.chunkSize = chunkSize;
  }

  @Override public byte @Nullable [] nextChunk() throws IOException {
    byte[] chunk = new byte[chunkSize];
    int filled = 0;
    while (filled < chunkSize) {
      int read = in.read(chunk, filled, chunkSize - filled);
      if (read < 0) {
        break;
      }
      filled += read;
    }
    if (filled == 0) {
      return null;
    }
    return filled == chunkSize ? chunk : Arrays.copyOf(chunk, filled);
  }

  @Override public long totalSizeHint() {
    return size;
  }

  @Override public void close() throws IOException {
    in.close();
  }
}
