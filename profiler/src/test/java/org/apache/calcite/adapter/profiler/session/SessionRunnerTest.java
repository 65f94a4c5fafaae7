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
import org.apache.calcite.adapter.profiler.ProfilerConfig;
import org.apache.calcite.adapter.profiler.ProfilerException;
import org.apache.calcite.adapter.profiler.format.InputFormat;
import org.apache.calcite.adapter.profiler.report.ProfileReport;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SessionRunner} and the chunk sources.
 */
@Tag("unit")
public class SessionRunnerTest {

  @TempDir
  Path tempDir;

  private final ProfilerConfig config = ProfilerConfig.builder()
      .chunkSizeBytes(16)
      .sniffSampleBytes(64)
      .build();

  @Test void testFileChunkSource() throws IOException {
    Path file = tempDir.resolve("data.csv");
    Files.write(file, "0123456789abcdefXYZ".getBytes(StandardCharsets.UTF_8));
    try (FileChunkSource source = new FileChunkSource(file, 16)) {
      assertEquals(19, source.totalSizeHint());
      assertEquals(16, source.nextChunk().length);
      assertArrayEquals("XYZ".getBytes(StandardCharsets.UTF_8), source.nextChunk());
      assertNull(source.nextChunk());
    }
  }

  @Test void testByteArrayChunkSource() {
    ByteArrayChunkSource source = ByteArrayChunkSource.of("abcde", 2);
    assertEquals(5, source.totalSizeHint());
    assertEquals("ab", new String(source.nextChunk(), StandardCharsets.UTF_8));
    assertEquals("cd", new String(source.nextChunk(), StandardCharsets.UTF_8));
    assertEquals("e", new String(source.nextChunk(), StandardCharsets.UTF_8));
    assertNull(source.nextChunk());
    assertThrows(IllegalArgumentException.class, () -> new ByteArrayChunkSource(new byte[0], 0));
  }

  @Test void testProfileFile() throws Exception {
    Path file = tempDir.resolve("people.csv");
    StringBuilder csv = new StringBuilder("name;age;email\n");
    for (int i = 0; i < 100; i++) {
      csv.append("person").append(i).append(';').append(20 + i % 40).append(';')
          .append("p").append(i).append("@example.com\n");
    }
    Files.write(file, csv.toString().getBytes(StandardCharsets.UTF_8));

    ProfileReport report = new SessionRunner(config).profile(file, null);
    assertEquals(100, report.getTotalRows());
    assertEquals(Character.valueOf(';'), report.getDelimiter());
    assertEquals(Files.size(file), report.getBytesProcessed());
    assertEquals(59.0, report.getColumn("age").getNumericStats().getMax(), 0.0);
  }

  @Test void testProfileJsonSource() throws Exception {
    ProfileReport report = new SessionRunner(config).profile(
        ByteArrayChunkSource.of("{\"id\": 1}\n{\"id\": 2}\n", 5), SchemaHints.none());
    assertEquals(InputFormat.JSON_LINES, report.getFormat());
    assertEquals(2, report.getTotalRows());
  }

  @Test void testFailureIsThrown() {
    ProfilerException e = assertThrows(ProfilerException.class,
        () -> new SessionRunner(config).profile(ByteArrayChunkSource.of("", 4), null));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
  }

  @Test void testProfileAsync() throws Exception {
    RecordingListener listener = new RecordingListener();
    ProfileReport report = new SessionRunner(config)
        .profileAsync(ByteArrayChunkSource.of("a,b\n1,2\n3,4\n", 3), null, listener)
        .get(10, TimeUnit.SECONDS);
    assertEquals(2, report.getTotalRows());
    assertEquals(1, listener.reports.size());

    ExecutionException e = assertThrows(ExecutionException.class,
        () -> new SessionRunner(config)
            .profileAsync(ByteArrayChunkSource.of("  ", 3), null, null)
            .get(10, TimeUnit.SECONDS));
    assertInstanceOf(ProfilerException.class, e.getCause());
  }

  @Test void testProfileAsyncReadFailureCancelsSession() throws Exception {
    RecordingListener listener = new RecordingListener();
    ByteChunkSource failing = new ByteChunkSource() {
      private int calls;

      @Override public byte @Nullable [] nextChunk() throws IOException {
        if (calls++ == 0) {
          return "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        }
        throw new IOException("disk gone");
      }

      @Override public long totalSizeHint() {
        return -1;
      }

      @Override public void close() {
      }
    };
    ExecutionException e = assertThrows(ExecutionException.class,
        () -> new SessionRunner(config).profileAsync(failing, null, listener)
            .get(10, TimeUnit.SECONDS));
    assertInstanceOf(IOException.class, e.getCause());
  }
}
