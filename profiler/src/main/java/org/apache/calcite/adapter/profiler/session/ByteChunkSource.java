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

import java.io.Closeable;
import java.io.IOException;

/**
 * Supplies input bytes to a profiling session one chunk at a time.
 */
public interface ByteChunkSource extends Closeable {
  /**
   * Returns the next chunk, or null once the input is exhausted. Chunk
   * boundaries carry no meaning; a record may span any number of chunks.
   */
  byte @Nullable [] nextChunk() throws IOException;

  /**
   * Returns the expected total size in bytes, or -1 when unknown.
   */
  long totalSizeHint();
}
