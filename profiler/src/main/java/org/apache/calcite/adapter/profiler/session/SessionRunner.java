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
import org.apache.calcite.adapter.profiler.report.ProfileReport;
import org.apache.calcite.adapter.profiler.statistics.ColumnSchema;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Drives a session from a {@link ByteChunkSource}.
 *
 * <p>{@link #profile} runs on the calling thread; {@link #profileAsync} hands
 * the session to a {@link ProfileSessionHost} and feeds it from the calling
 * thread, blocking only when the host's queue is full. The worker overlaps
 * parsing with reading; the call returns once the source is exhausted, and the
 * host is closed when the returned future completes.
 */
public class SessionRunner {
  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRunner.class);

  private final ProfilerConfig config;

  public SessionRunner(ProfilerConfig config) {
    this.config = config;
  }

  /**
   * Profiles a file.
   */
  public ProfileReport profile(Path path, @Nullable SchemaHints hints)
      throws ProfilerException, IOException {
    try (ByteChunkSource source = new FileChunkSource(path, config.getChunkSizeBytes())) {
      LOGGER.debug("Profiling {}", path);
      return profile(source, hints);
    }
  }

  /**
   * Profiles everything the source supplies on the calling thread.
   *
   * @throws ProfilerException if the session fails
   * @throws IOException if the source cannot be read
   */
  public ProfileReport profile(ByteChunkSource source, @Nullable SchemaHints hints)
      throws ProfilerException, IOException {
    CapturingListener listener = new CapturingListener();
    ProfileSession session = new ProfileSession(config, listener);
    session.start(hints, source.totalSizeHint());
    long sequence = 0;
    byte[] chunk;
    while (!session.getState().isTerminal() && (chunk = source.nextChunk()) != null) {
      session.pushChunk(chunk, sequence++);
    }
    session.endOfInput();
    return listener.outcome();
  }

  /**
   * Profiles the source on a worker thread.
   *
   * @param listener Receives session events as they happen; may be null
   * @return Future holding the report or the failure
   */
  public CompletableFuture<ProfileReport> profileAsync(ByteChunkSource source,
      @Nullable SchemaHints hints, @Nullable SessionListener listener) {
    ProfileSessionHost host = new ProfileSessionHost(config, listener);
    host.completion().whenComplete((report, failure) -> host.close());
    try {
      host.start(hints, source.totalSizeHint());
      long sequence = 0;
      byte[] chunk;
      while (!host.completion().isDone() && (chunk = source.nextChunk()) != null) {
        host.pushChunk(chunk, sequence++);
      }
      host.endOfInput();
      return host.completion();
    } catch (IOException e) {
      LOGGER.warn("Reading source failed; cancelling session", e);
      host.cancel();
      CompletableFuture<ProfileReport> failed = new CompletableFuture<>();
      failed.completeExceptionally(e);
      return failed;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      host.cancel();
      CompletableFuture<ProfileReport> failed = new CompletableFuture<>();
      failed.completeExceptionally(e);
      return failed;
    }
  }

  /**
   * Records the single outcome of a synchronous session.
   */
  private static class CapturingListener implements SessionListener {
    private @Nullable ProfileReport report;
    private @Nullable SessionError error;
    private boolean cancelled;

    @Override public void onReady(List<ColumnSchema> columns) {
      LOGGER.debug("Schema established with {} columns", columns.size());
    }

    @Override public void onProgress(long bytesProcessed, long totalBytesHint) {
      LOGGER.trace("Processed {} of {} bytes", bytesProcessed, totalBytesHint);
    }

    @Override public void onReport(ProfileReport report) {
      this.report = report;
    }

    @Override public void onError(SessionError error) {
      this.error = error;
    }

    @Override public void onCancelled() {
      this.cancelled = true;
    }

    ProfileReport outcome() throws ProfilerException {
      if (error != null) {
        throw error.toException();
      }
      if (cancelled || report == null) {
        throw new ProfilerException(ErrorKind.CANCELLED, "Profiling cancelled");
      }
      return report;
    }
  }
}
