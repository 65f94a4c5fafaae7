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

import org.apache.calcite.adapter.profiler.report.ProfileReport;
import org.apache.calcite.adapter.profiler.statistics.ColumnSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Receives the outbound events of a profiling session.
 *
 * <p>Exactly one of {@link #onReport}, {@link #onError} and
 * {@link #onCancelled} is called per session, and nothing is called after it.
 */
public interface SessionListener {
  /**
   * Called once the column schema is known.
   *
   * @param columns Columns in order; types are {@code UNKNOWN} unless hinted
   */
  void onReady(List<ColumnSchema> columns);

  /**
   * Called once per accepted chunk.
   *
   * @param bytesProcessed Bytes accepted so far
   * @param totalBytesHint Expected total, or -1 when unknown
   */
  void onProgress(long bytesProcessed, long totalBytesHint);

  /**
   * Called once when the session completes.
   */
  void onReport(ProfileReport report);

  /**
   * Called once when the session fails.
   */
  void onError(SessionError error);

  /**
   * Called once when the session is cancelled.
   */
  void onCancelled();

  /**
   * Listener that logs every event to SLF4J.
   */
  class LoggingSessionListener implements SessionListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingSessionListener.class);

    @Override public void onReady(List<ColumnSchema> columns) {
      LOG.info("Schema ready: {} columns {}", columns.size(), columns);
    }

    @Override public void onProgress(long bytesProcessed, long totalBytesHint) {
      if (totalBytesHint > 0) {
        LOG.debug("Processed {}/{} bytes ({}%)", bytesProcessed, totalBytesHint,
            bytesProcessed * 100 / totalBytesHint);
      } else {
        LOG.debug("Processed {} bytes", bytesProcessed);
      }
    }

    @Override public void onReport(ProfileReport report) {
      LOG.info("Profile complete: {} rows, {} columns in {}ms", report.getTotalRows(),
          report.getColumns().size(), report.getElapsedMs());
    }

    @Override public void onError(SessionError error) {
      LOG.warn("Profiling failed: {}", error);
    }

    @Override public void onCancelled() {
      LOG.info("Profiling cancelled");
    }
  }
}
