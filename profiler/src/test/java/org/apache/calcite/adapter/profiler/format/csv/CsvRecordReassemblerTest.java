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

import org.apache.calcite.adapter.profiler.ErrorKind;
import org.apache.calcite.adapter.profiler.ProfilerException;
import org.apache.calcite.adapter.profiler.format.Record;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CsvRecordReassembler}.
 */
@Tag("unit")
public class CsvRecordReassemblerTest {

  private static List<Record> feedAll(CsvRecordReassembler reassembler, String... chunks)
      throws ProfilerException {
    List<Record> records = new ArrayList<>();
    for (String chunk : chunks) {
      Iterator<Record> it = reassembler.feed(chunk.getBytes(StandardCharsets.UTF_8));
      it.forEachRemaining(records::add);
    }
    Record last = reassembler.finish();
    if (last != null) {
      records.add(last);
    }
    return records;
  }

  @Test void testTerminatorSplitAcrossChunks() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    List<Record> records = feedAll(reassembler, "a,b\r", "\n1,2\r", "\n");
    assertEquals(2, records.size());
    assertEquals(Arrays.asList("a", "b"), records.get(0).getValues());
    assertEquals(Arrays.asList("1", "2"), records.get(1).getValues());
    assertEquals(0, records.get(0).getIndex());
    assertEquals(1, records.get(1).getIndex());
  }

  @Test void testRecordSpanningManyChunks() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    List<Record> records = feedAll(reassembler, "lo", "ng_val", "ue,", "x", "\nshort,y");
    assertEquals(2, records.size());
    assertEquals(Arrays.asList("long_value", "x"), records.get(0).getValues());
    assertEquals(Arrays.asList("short", "y"), records.get(1).getValues());
  }

  @Test void testQuotedNewlineIsData() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    List<Record> records = feedAll(reassembler, "1,\"line one\n", "line two\"\n2,plain\n");
    assertEquals(2, records.size());
    assertEquals("line one\nline two", records.get(0).getValues().get(1));
  }

  @Test void testBlankLinesAndByteOrderMarkSkipped() throws ProfilerException {
    byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    List<Record> records = new ArrayList<>();
    reassembler.feed(bom).forEachRemaining(records::add);
    reassembler.feed("a,b\n\n\n1,2\n".getBytes(StandardCharsets.UTF_8))
        .forEachRemaining(records::add);
    assertEquals(2, records.size());
    assertEquals("a", records.get(0).getValues().get(0));
    assertEquals(2, reassembler.getRecordCount());
  }

  @Test void testOversizedPendingRecordFails() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 8);
    reassembler.feed("0123456789".getBytes(StandardCharsets.UTF_8))
        .forEachRemaining(r -> { });
    ProfilerException e = assertThrows(ProfilerException.class,
        () -> reassembler.feed("abc".getBytes(StandardCharsets.UTF_8)));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
  }

  @Test void testUndrainedIteratorRejected() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    Iterator<Record> records = reassembler.feed("a\nb\n".getBytes(StandardCharsets.UTF_8));
    assertTrue(records.hasNext());
    assertThrows(IllegalStateException.class,
        () -> reassembler.feed("c\n".getBytes(StandardCharsets.UTF_8)));
  }

  @Test void testQuotedFieldsSplit() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    List<Record> records = feedAll(reassembler, "a,\"b,c\",\"say \"\"hi\"\"\",\n",
        " x ,C:\\tmp,\n");
    assertEquals(2, records.size());
    assertEquals(ImmutableList.of("a", "b,c", "say \"hi\"", ""), records.get(0).getValues());
    assertEquals(ImmutableList.of(" x ", "C:\\tmp", ""), records.get(1).getValues());
  }

  @Test void testSemicolonDelimitedQuotedField() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(';', 1024);
    List<Record> records = feedAll(reassembler, "x;\"y;z\";w\n");
    assertEquals(ImmutableList.of("x", "y;z", "w"), records.get(0).getValues());
  }

  @Test void testUnterminatedQuoteAtEndIsMalformed() throws ProfilerException {
    CsvRecordReassembler reassembler = new CsvRecordReassembler(',', 1024);
    List<Record> records = feedAll(reassembler, "a,b\n1,\"open");
    assertEquals(2, records.size());
    assertFalse(records.get(0).isMalformed());
    assertTrue(records.get(1).isMalformed());
  }
}
