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

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs a {@link ProfileSession} on a dedicated worker thread.
 *
 * <p>Messages are queued and applied in submission order. At most
 * {@code maxInFlightChunks} chunks may be queued; {@link #pushChunk} blocks the
 * producer until the worker catches up, which bounds the memory held by the
 * queue. The outcome is available both through the caller's listener and as a
 * future.
 *
 * <p>The future always completes once the host is closed: a session that was
 * never told its input ended is cancelled, queued messages dropped by a worker
 * that does not stop in time cancel it, and a message sent after close fails
 * it with {@code PROTOCOL_ERROR}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * try (ProfileSessionHost host = new ProfileSessionHost(config, listener, 4)) {
 *   host.start(SchemaHints.none(), fileSize);
 *   long seq = 0;
 *   byte[] chunk;
 *   while ((chunk = source.nextChunk()) != null) {
 *     host.pushChunk(chunk, seq++);
 *   }
 *   host.endOfInput();
 *   ProfileReport report = host.completion().get();
 * }
 * }</pre>
 */
public class ProfileSessionHost implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProfileSessionHost.class);

  public static final int DEFAULT_MAX_IN_FLIGHT_CHUNKS = 4;

  static final long DEFAULT_CLOSE_TIMEOUT_MILLIS = 30_000L;

  private static final long ACQUIRE_POLL_MILLIS = 100L;

  private final ProfileSession session;
  private final ExecutorService executor;
  private final Semaphore inFlight;
  private final long closeTimeoutMillis;
  private final CompletableFuture<ProfileReport> result = new CompletableFuture<>();
  private volatile @Nullable Thread worker;

  public ProfileSessionHost(ProfilerConfig config, @Nullable SessionListener listener) {
    this(config, listener, DEFAULT_MAX_IN_FLIGHT_CHUNKS);
  }

  /**
   * Creates a host.
   *
   * @param config Profiler configuration
   * @param listener Listener for session events; may be null
   * @param maxInFlightChunks Chunks that may be queued before producers block
   */
  public ProfileSessionHost(ProfilerConfig config, @Nullable SessionListener listener,
      int maxInFlightChunks) {
    this(config, listener, maxInFlightChunks, DEFAULT_CLOSE_TIMEOUT_MILLIS);
  }

  ProfileSessionHost(ProfilerConfig config, @Nullable SessionListener listener,
      int maxInFlightChunks, long closeTimeoutMillis) {
    if (maxInFlightChunks < 1) {
      throw new IllegalArgumentException("maxInFlightChunks must be positive: "
          + maxInFlightChunks);
    }
    this.session = new ProfileSession(config, new CompletingListener(listener));
    this.inFlight = new Semaphore(maxInFlightChunks);
    this.closeTimeoutMillis = closeTimeoutMillis;
    this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
        .setNameFormat("profile-session-%d")
        .setDaemon(true)
        .build());
  }

  public void start(@Nullable SchemaHints hints, long totalBytesHint) {
    submit(() -> session.start(hints, totalBytesHint));
  }

  /**
   * Queues a chunk. The bytes are copied, so the caller may reuse the array.
   * Returns without queuing once the outcome is known.
   *
   * @throws InterruptedException if interrupted while waiting for queue space
   */
  public void pushChunk(byte[] bytes, long sequenceIndex) throws InterruptedException {
    if (result.isDone()) {
      return;
    }
    byte[] copy = bytes.clone();
    while (!inFlight.tryAcquire(ACQUIRE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (result.isDone()) {
        return;
      }
    }
    boolean queued = false;
    try {
      queued = submit(() -> {
        try {
          session.pushChunk(copy, sequenceIndex);
        } finally {
          inFlight.release();
        }
      });
    } finally {
      if (!queued) {
        inFlight.release();
      }
    }
  }

  public void endOfInput() {
    submit(session::endOfInput);
  }

  /**
   * Cancels the session. Chunks still queued are skipped.
   */
  public void cancel() {
    session.requestCancel();
    submit(session::cancel);
  }

  /**
   * Returns a future completed with the report, completed exceptionally with
   * a {@link org.apache.calcite.adapter.profiler.ProfilerException} on failure
   * or cancelled on cancellation.
   */
  public CompletableFuture<ProfileReport> completion() {
    return result;
  }

  public SessionState getState() {
    return session.getState();
  }

  /**
   * Stops the worker after the queued messages have run and completes the
   * future if the session has not finished. When called from a listener on the
   * worker thread, only stops the worker from accepting further messages.
   */
  @Override public void close() {
    executor.shutdown();
    if (Thread.currentThread() == worker) {
      return;
    }
    try {
      if (!executor.awaitTermination(closeTimeoutMillis, TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Profile session worker did not stop within {} ms", closeTimeoutMillis);
        abandon();
      }
    } catch (InterruptedException e) {
      abandon();
      Thread.currentThread().interrupt();
    }
    if (executor.isTerminated() && !result.isDone()) {
      LOGGER.debug("Host closed before end of input; cancelling session");
      session.cancel();
    }
  }

  private void abandon() {
    session.requestCancel();
    List<Runnable> dropped = executor.shutdownNow();
    if (!dropped.isEmpty()) {
      LOGGER.warn("Dropped {} queued profile session messages", dropped.size());
    }
    result.completeExceptionally(
        new CancellationException("Profile session host closed before the session finished"));
  }

  /**
   * Queues a task; returns false if the worker no longer accepts tasks.
   */
  private boolean submit(Runnable task) {
    try {
      executor.execute(() -> {
        worker = Thread.currentThread();
        try {
          task.run();
        } catch (RuntimeException e) {
          LOGGER.error("Profile session task failed", e);
          result.completeExceptionally(e);
        }
      });
      return true;
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Profile session host is closed; message rejected");
      result.completeExceptionally(
          new ProfilerException(ErrorKind.PROTOCOL_ERROR, "Session host is closed"));
      return false;
    }
  }

  /**
   * Forwards events to the caller's listener and completes the future.
   */
  private class CompletingListener implements SessionListener {
    private final @Nullable SessionListener delegate;

    CompletingListener(@Nullable SessionListener delegate) {
      this.delegate = delegate;
    }

    @Override public void onReady(List<ColumnSchema> columns) {
      if (delegate != null) {
        delegate.onReady(columns);
      }
    }

    @Override public void onProgress(long bytesProcessed, long totalBytesHint) {
      if (delegate != null) {
        delegate.onProgress(bytesProcessed, totalBytesHint);
      }
    }

    @Override public void onReport(ProfileReport report) {
      try {
        if (delegate != null) {
          delegate.onReport(report);
        }
      } finally {
        result.complete(report);
      }
    }

    @Override public void onError(SessionError error) {
      try {
        if (delegate != null) {
          delegate.onError(error);
        }
      } finally {
        result.completeExceptionally(error.toException());
      }
    }

    @Override public void onCancelled() {
      try {
        if (delegate != null) {
          delegate.onCancelled();
        }
      } finally {
        result.completeExceptionally(new CancellationException("Profiling cancelled"));
      }
    }
  }
}
