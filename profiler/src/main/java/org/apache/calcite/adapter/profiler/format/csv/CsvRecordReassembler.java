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
package org.apache.calcite.adapter.profiler.format.csv;

import org.apache.calcite.adapter.profiler.format.AbstractRecordReassembler;
import org.apache.calcite.adapter.profiler.format.Record;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reassembles delimited text records.
 *
 * <p>A record ends at a {@code \n} outside quotes; a preceding {@code \r} is
 * dropped. The quote state toggles on every {@code "}, so terminators inside a
 * quoted field are data. Blank lines are skipped and a leading UTF-8 byte order
 * mark is ignored. Each reassembled line is split into fields by an opencsv
 * {@link CSVParser}; a line it rejects becomes a malformed record.
 */
public class CsvRecordReassembler extends AbstractRecordReassembler {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvRecordReassembler.class);

  private final CSVParser parser;
  private boolean inQuotes;
  private boolean bomChecked;

  public CsvRecordReassembler(char delimiter, int maxRecordBytes) {
    super(maxRecordBytes);
    this.parser = newLineParser(delimiter);
  }

  /**
   * Creates a parser for single lines: double quotes delimit fields, a doubled
   * quote stands for one quote, backslash is ordinary data and leading
   * whitespace is kept.
   */
  static CSVParser newLineParser(char delimiter) {
    return new CSVParserBuilder()
        .withSeparator(delimiter)
        .withQuoteChar(ICSVParser.DEFAULT_QUOTE_CHARACTER)
        .withEscapeChar(ICSVParser.NULL_CHARACTER)
        .withIgnoreLeadingWhiteSpace(false)
        .build();
  }

  @Override protected @Nullable Record scanNext() {
    skipByteOrderMark(false);
    while (scanPos < limit) {
      byte b = buffer[scanPos];
      if (b == '"') {
        inQuotes = !inQuotes;
      } else if (b == '\n' && !inQuotes) {
        bomChecked = true;
        int start = recordStart;
        int end = scanPos;
        scanPos++;
        recordStart = scanPos;
        if (end > start && buffer[end - 1] == '\r') {
          end--;
        }
        if (end > start) {
          return toRecord(start, end);
        }
        continue;
      }
      scanPos++;
    }
    return null;
  }

  @Override protected @Nullable Record flushTail() {
    skipByteOrderMark(true);
    int start = recordStart;
    int end = limit;
    recordStart = limit;
    scanPos = limit;
    if (end > start && buffer[end - 1] == '\r') {
      end--;
    }
    if (end <= start) {
      return null;
    }
    return toRecord(start, end);
  }

  private Record toRecord(int start, int end) {
    String line = new String(buffer, start, end - start, StandardCharsets.UTF_8);
    long index = nextIndex();
    try {
      return Record.of(index, Arrays.asList(parser.parseLine(line)));
    } catch (IOException e) {
      LOGGER.debug("Record {} is malformed: {}", index, e.getMessage());
      return Record.malformed(index);
    }
  }

  private void skipByteOrderMark(boolean atEnd) {
    if (bomChecked) {
      return;
    }
    if (limit - recordStart < 3 && !atEnd) {
      return;
    }
    bomChecked = true;
    if (limit - recordStart >= 3
        && (buffer[recordStart] & 0xFF) == 0xEF
        && (buffer[recordStart + 1] & 0xFF) == 0xBB
        && (buffer[recordStart + 2] & 0xFF) == 0xBF) {
      recordStart += 3;
      scanPos = Math.max(scanPos, recordStart);
    }
  }
}
