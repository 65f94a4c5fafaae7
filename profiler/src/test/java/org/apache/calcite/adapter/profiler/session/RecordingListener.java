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

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that records every event for assertions.
 */
class RecordingListener implements SessionListener {
  final List<List<ColumnSchema>> ready = new ArrayList<>();
  final List<Long> progress = new ArrayList<>();
  final List<ProfileReport> reports = new ArrayList<>();
  final List<SessionError> errors = new ArrayList<>();
  final List<String> threads = new ArrayList<>();
  int cancelled;

  @Override public void onReady(List<ColumnSchema> columns) {
    threads.add(Thread.currentThread().getName());
    ready.add(columns);
  }

  @Override public void onProgress(long bytesProcessed, long totalBytesHint) {
    progress.add(bytesProcessed);
  }

  @Override public void onReport(ProfileReport report) {
    threads.add(Thread.currentThread().getName());
    reports.add(report);
  }

  @Override public void onError(SessionError error) {
    errors.add(error);
  }

  @Override public void onCancelled() {
    cancelled++;
  }

  int terminalEvents() {
    return reports.size() + errors.size() + cancelled;
  }

  ProfileReport report() {
    if (reports.size() != 1) {
      throw new AssertionError("Expected one report, got " + reports + " errors " + errors);
    }
    return reports.get(0);
  }
}
