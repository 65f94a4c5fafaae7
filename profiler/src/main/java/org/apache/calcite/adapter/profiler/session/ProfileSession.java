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
import org.apache.calcite.adapter.profiler.format.Record;
import org.apache.calcite.adapter.profiler.format.RecordReassembler;
import org.apache.calcite.adapter.profiler.format.csv.CsvRecordReassembler;
import org.apache.calcite.adapter.profiler.format.csv.DelimiterSniffer;
import org.apache.calcite.adapter.profiler.format.csv.SniffResult;
import org.apache.calcite.adapter.profiler.format.json.JsonRecordReassembler;
import org.apache.calcite.adapter.profiler.report.ProfileReport;
import org.apache.calcite.adapter.profiler.report.ReportMaterializer;
import org.apache.calcite.adapter.profiler.statistics.ColumnAccumulator;
import org.apache.calcite.adapter.profiler.statistics.ColumnSchema;
import org.apache.calcite.adapter.profiler.value.FieldDecoder;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-pass profiling state machine.
 *
 * <p>Driven by four inbound messages: {@link #start}, {@link #pushChunk},
 * {@link #endOfInput} and {@link #cancel}. Chunks flow through the record
 * reassembler and field decoder into one {@link ColumnAccumulator} per column;
 * at end of input the {@link ReportMaterializer} reads every accumulator once.
 * Outbound events go to the {@link SessionListener}.
 *
 * <p>While {@code INITIALIZING}, chunks are buffered until
 * {@code sniffSampleBytes} are available (or input ends); the format is then
 * detected, the delimiter sniffed, and the buffered bytes replayed. The first
 * record establishes the schema, at which point {@code ready} is emitted and
 * the session is {@code STREAMING}.
 *
 * <p>Fatal conditions move the session to {@code FAILED} with exactly one
 * error event; they never escape as exceptions. Calls that make no sense in
 * the current state ({@code pushChunk} before {@code start}, a second
 * {@code start}) throw {@link IllegalStateException}. Messages arriving after a
 * terminal state are ignored.
 *
 * <p>Not thread-safe: a session is driven from one thread, usually the worker
 * of a {@link ProfileSessionHost}. Only {@link #requestCancel()} may be called
 * from another thread.
 */
public class ProfileSession {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProfileSession.class);

  private final ProfilerConfig config;
  private final SessionListener listener;
  private final FieldDecoder decoder;
  private final DelimiterSniffer sniffer = new DelimiterSniffer();
  private final ReportMaterializer materializer;

  private volatile boolean cancelRequested;
  private SessionState state = SessionState.IDLE;

  private SchemaHints hints = SchemaHints.none();
  private long totalBytesHint = -1;
  private long startNanos;
  private long bytesReceived;
  private long lastSequenceIndex = Long.MIN_VALUE;

  private @Nullable List<byte[]> sampleChunks = new ArrayList<>();
  private int sampleBytes;

  private @Nullable InputFormat format;
  private @Nullable Character delimiter;
  private boolean hasHeader;
  private @Nullable RecordReassembler reassembler;

  private @Nullable List<ColumnAccumulator> columns;
  private final Map<String, ColumnAccumulator> columnsByName = new HashMap<>();
  private long dataRows;
  private long fieldCountMismatches;
  private long malformedRecords;

  public ProfileSession(ProfilerConfig config, SessionListener listener) {
    this.config = Objects.requireNonNull(config, "config");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.decoder = new FieldDecoder(config.getNullEquivalents());
    this.materializer = new ReportMaterializer(config);
  }

  /**
   * Starts the session with no size hint.
   */
  public void start(@Nullable SchemaHints schemaHints) {
    start(schemaHints, -1);
  }

  /**
   * Starts the session.
   *
   * @param schemaHints Known format, delimiter, header or column types; may be null
   * @param totalBytesHint Expected input size reported with progress, or -1
   * @throws IllegalStateException if the session was already started
   */
  public void start(@Nullable SchemaHints schemaHints, long totalBytesHint) {
    if (state.isTerminal()) {
      LOGGER.debug("Ignoring start in terminal state {}", state);
      return;
    }
    if (state != SessionState.IDLE) {
      throw new IllegalStateException("Session already started (state " + state + ")");
    }
    if (cancelRequested) {
      cancel();
      return;
    }
    this.hints = schemaHints == null ? SchemaHints.none() : schemaHints;
    this.totalBytesHint = totalBytesHint;
    this.startNanos = System.nanoTime();
    state = SessionState.INITIALIZING;
    LOGGER.debug("Session initializing with {}", hints);
  }

  /**
   * Accepts the next chunk.
   *
   * @param bytes Chunk contents; not retained after the call
   * @param sequenceIndex Position of the chunk; must increase from call to call
   * @throws IllegalStateException if the session is idle or finalizing
   */
  public void pushChunk(byte[] bytes, long sequenceIndex) {
    if (state.isTerminal()) {
      LOGGER.debug("Ignoring chunk {} in terminal state {}", sequenceIndex, state);
      return;
    }
    if (state != SessionState.INITIALIZING && state != SessionState.STREAMING) {
      throw new IllegalStateException("Cannot accept chunks in state " + state);
    }
    if (cancelRequested) {
      cancel();
      return;
    }
    if (sequenceIndex <= lastSequenceIndex) {
      fail(new ProfilerException(ErrorKind.PROTOCOL_ERROR,
          "Chunk " + sequenceIndex + " arrived after chunk " + lastSequenceIndex));
      return;
    }
    lastSequenceIndex = sequenceIndex;
    bytesReceived += bytes.length;

    try {
      if (reassembler == null) {
        bufferSample(bytes);
        if (sampleBytes >= config.getSniffSampleBytes()) {
          initialize(false);
        }
      } else {
        process(bytes);
      }
    } catch (ProfilerException e) {
      fail(e);
      return;
    } catch (OutOfMemoryError e) {
      discard();
      fail(new ProfilerException(ErrorKind.RESOURCE_EXHAUSTED,
          "Out of memory after " + bytesReceived + " bytes", e));
      return;
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure processing chunk {}", sequenceIndex, e);
      fail(new ProfilerException(ErrorKind.PARSE_ERROR,
          "Unexpected failure: " + e.getMessage(), e));
      return;
    }
    listener.onProgress(bytesReceived, totalBytesHint);
  }

  /**
   * Signals that no more chunks follow; finalizes and emits the report.
   *
   * @throws IllegalStateException if the session was never started
   */
  public void endOfInput() {
    if (state.isTerminal()) {
      LOGGER.debug("Ignoring end of input in terminal state {}", state);
      return;
    }
    if (state == SessionState.IDLE || state == SessionState.FINALIZING) {
      throw new IllegalStateException("Cannot end input in state " + state);
    }
    if (cancelRequested) {
      cancel();
      return;
    }

    ProfileReport report;
    try {
      if (reassembler == null) {
        initialize(true);
      }
      state = SessionState.FINALIZING;
      RecordReassembler current = Objects.requireNonNull(reassembler, "reassembler");
      Record last = current.finish();
      if (last != null) {
        handle(last);
      }
      if (current.getRecordCount() == 0) {
        throw new ProfilerException(ErrorKind.PARSE_ERROR, "Input contains no records", 0);
      }
      if (columns == null) {
        throw new ProfilerException(ErrorKind.PARSE_ERROR,
            "No valid record found to establish a schema", 0);
      }
      report = finalizeReport();
    } catch (ProfilerException e) {
      fail(e);
      return;
    } catch (OutOfMemoryError e) {
      discard();
      fail(new ProfilerException(ErrorKind.RESOURCE_EXHAUSTED, "Out of memory while finalizing", e));
      return;
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure while finalizing", e);
      fail(new ProfilerException(ErrorKind.PARSE_ERROR,
          "Unexpected failure: " + e.getMessage(), e));
      return;
    }
    discard();
    state = SessionState.COMPLETED;
    listener.onReport(report);
  }

  /**
   * Cancels the session, discarding all accumulated state. Has no effect on a
   * terminal session.
   */
  public void cancel() {
    cancelRequested = true;
    if (state.isTerminal()) {
      LOGGER.debug("Ignoring cancel in terminal state {}", state);
      return;
    }
    discard();
    state = SessionState.CANCELLED;
    LOGGER.debug("Session cancelled after {} bytes", bytesReceived);
    listener.onCancelled();
  }

  /**
   * Flags the session for cancellation; observed before the next message is
   * processed. Safe to call from any thread.
   */
  public void requestCancel() {
    cancelRequested = true;
  }

  public SessionState getState() {
    return state;
  }

  /**
   * Returns the bytes accepted so far.
   */
  public long getBytesProcessed() {
    return bytesReceived;
  }

  /**
   * Returns the current column schemas; empty before the schema is known and
   * after the session ends.
   */
  public List<ColumnSchema> getColumnSchemas() {
    List<ColumnAccumulator> current = columns;
    if (current == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ColumnSchema> schemas = ImmutableList.builder();
    for (ColumnAccumulator column : current) {
      schemas.add(column.getSchema());
    }
    return schemas.build();
  }

  /**
   * Returns whether the session still holds accumulators, buffers or a
   * reassembler.
   */
  public boolean hasRetainedState() {
    return columns != null || reassembler != null || sampleChunks != null
        || !columnsByName.isEmpty();
  }

  private void bufferSample(byte[] bytes) {
    if (bytes.length == 0) {
      return;
    }
    Objects.requireNonNull(sampleChunks, "sampleChunks").add(bytes.clone());
    sampleBytes += bytes.length;
  }

  /**
   * Detects the format, sets up the reassembler and replays buffered chunks.
   */
  private void initialize(boolean atEnd) throws ProfilerException {
    byte[] sample = new byte[sampleBytes];
    int offset = 0;
    for (byte[] chunk : Objects.requireNonNull(sampleChunks, "sampleChunks")) {
      System.arraycopy(chunk, 0, sample, offset, chunk.length);
      offset += chunk.length;
    }
    sampleChunks = null;

    if (isBlank(sample)) {
      if (atEnd) {
        throw new ProfilerException(ErrorKind.PARSE_ERROR, "Input is empty", 0);
      }
    }

    InputFormat detected = hints.getFormat() != null
        ? hints.getFormat()
        : InputFormat.detect(sample, sample.length);
    format = detected;

    if (detected == InputFormat.CSV) {
      Character hintedDelimiter = hints.getDelimiter();
      Boolean hintedHeader = hints.getHasHeader();
      if (hintedDelimiter != null && hintedHeader != null) {
        delimiter = hintedDelimiter;
        hasHeader = hintedHeader;
      } else {
        int length = Math.min(sample.length, config.getSniffSampleBytes());
        boolean truncated = !atEnd || sample.length > length;
        SniffResult sniffed = sniffer.sniff(sample, length, truncated);
        delimiter = hintedDelimiter != null ? hintedDelimiter : sniffed.getDelimiter();
        hasHeader = hintedHeader != null ? hintedHeader : sniffed.hasHeader();
      }
      reassembler = new CsvRecordReassembler(delimiter, config.getMaxRecordBytes());
      LOGGER.debug("Delimited input: delimiter='{}', header={}", delimiter, hasHeader);
    } else {
      reassembler = new JsonRecordReassembler(detected == InputFormat.JSON_ARRAY,
          config.getMaxJsonDepth(), config.getMaxRecordBytes());
      LOGGER.debug("JSON input: {}", detected);
    }

    if (sample.length > 0) {
      process(sample);
    }
  }

  private void process(byte[] bytes) throws ProfilerException {
    Iterator<Record> records = Objects.requireNonNull(reassembler, "reassembler").feed(bytes);
    while (records.hasNext()) {
      handle(records.next());
    }
  }

  private void handle(Record record) {
    if (record.isMalformed()) {
      malformedRecords++;
      return;
    }
    if (columns == null) {
      establishSchema(record);
      if (record.isKeyed() || !hasHeader) {
        fold(record);
      }
      return;
    }
    fold(record);
  }

  private void establishSchema(Record first) {
    List<ColumnAccumulator> created = new ArrayList<>();
    List<String> names;
    if (first.isKeyed()) {
      names = Objects.requireNonNull(first.getNames(), "names");
    } else if (hasHeader) {
      names = new ArrayList<>();
      for (String token : first.getValues()) {
        names.add(token == null ? "" : token.trim());
      }
    } else {
      names = new ArrayList<>();
      for (int i = 0; i < first.size(); i++) {
        names.add(ColumnSchema.syntheticName(i));
      }
    }
    columns = created;
    for (String name : names) {
      if (addColumn(name) == null) {
        LOGGER.warn("Ignoring columns beyond the limit of {}", config.getMaxColumns());
        break;
      }
    }
    state = SessionState.STREAMING;
    listener.onReady(getColumnSchemas());
  }

  /**
   * Adds a column, making its name unique. Returns null at the column limit.
   */
  private @Nullable ColumnAccumulator addColumn(String rawName) {
    List<ColumnAccumulator> current = Objects.requireNonNull(columns, "columns");
    if (current.size() >= config.getMaxColumns()) {
      return null;
    }
    int ordinal = current.size();
    String name = rawName.isEmpty() ? ColumnSchema.syntheticName(ordinal) : rawName;
    if (columnsByName.containsKey(name)) {
      int suffix = 2;
      while (columnsByName.containsKey(name + "_" + suffix)) {
        suffix++;
      }
      name = name + "_" + suffix;
    }
    ColumnAccumulator column = new ColumnAccumulator(ordinal, name, config, decoder,
        hints.getColumnType(name));
    current.add(column);
    columnsByName.put(name, column);
    return column;
  }

  private void fold(Record record) {
    List<ColumnAccumulator> current = Objects.requireNonNull(columns, "columns");
    dataRows++;
    List<@Nullable String> values = record.getValues();

    if (!record.isKeyed()) {
      if (values.size() != current.size()) {
        fieldCountMismatches++;
      }
      for (int i = 0; i < current.size(); i++) {
        current.get(i).add(i < values.size() ? values.get(i) : null);
      }
      return;
    }

    List<String> names = Objects.requireNonNull(record.getNames(), "names");
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      ColumnAccumulator column = columnsByName.get(name);
      if (column == null) {
        column = addColumn(name);
        if (column == null) {
          continue;
        }
        // Earlier records did not have this key
        column.addMissing(dataRows - 1);
        LOGGER.debug("Discovered column '{}' at record {}", name, record.getIndex());
      }
      if (column.getCount() < dataRows) {
        column.add(values.get(i));
        Integer arrayLength = record.getArrayLengths().get(name);
        if (arrayLength != null) {
          column.addArrayLength(arrayLength);
        }
      }
    }
    for (ColumnAccumulator column : current) {
      if (column.getCount() < dataRows) {
        column.add(null);
      }
    }
  }

  private ProfileReport finalizeReport() {
    List<ColumnAccumulator> current = Objects.requireNonNull(columns, "columns");
    for (ColumnAccumulator column : current) {
      column.closeWindow();
    }
    long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
    InputFormat inputFormat = Objects.requireNonNull(format, "format");
    ProfileReport.Builder metadata = ProfileReport.builder()
        .totalRows(dataRows)
        .elapsedMs(elapsedMs)
        .bytesProcessed(bytesReceived)
        .format(inputFormat)
        .delimiter(inputFormat == InputFormat.CSV ? delimiter : null)
        .hasHeader(inputFormat == InputFormat.CSV ? hasHeader : true)
        .fieldCountMismatches(fieldCountMismatches)
        .malformedRecords(malformedRecords);
    return materializer.materialize(metadata, current);
  }

  private void fail(ProfilerException e) {
    discard();
    state = SessionState.FAILED;
    SessionError error = SessionError.of(e);
    LOGGER.debug("Session failed: {}", error);
    listener.onError(error);
  }

  private void discard() {
    columns = null;
    columnsByName.clear();
    reassembler = null;
    sampleChunks = null;
  }

  private static boolean isBlank(byte[] bytes) {
    for (byte b : bytes) {
      if (b != ' ' && b != '\t' && b != '\r' && b != '\n') {
        return false;
      }
    }
    return true;
  }
}
