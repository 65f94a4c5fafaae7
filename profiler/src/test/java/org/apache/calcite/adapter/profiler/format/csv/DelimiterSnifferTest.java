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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DelimiterSniffer}.
 */
@Tag("unit")
public class DelimiterSnifferTest {

  private final DelimiterSniffer sniffer = new DelimiterSniffer();

  private SniffResult sniff(String text) throws ProfilerException {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    return sniffer.sniff(bytes, bytes.length, false);
  }

  @Test void testCommaWithHeader() throws ProfilerException {
    SniffResult result = sniff("name,age\nalice,30\nbob,25\n");
    assertEquals(',', result.getDelimiter());
    assertTrue(result.hasHeader());
    assertEquals(2, result.getFieldCount());
  }

  @Test void testSemicolonTabAndPipe() throws ProfilerException {
    assertEquals(';', sniff("a;b;c\n1;2;3\n4;5;6\n").getDelimiter());
    assertEquals('\t', sniff("a\tb\n1\t2\n3\t4\n").getDelimiter());
    assertEquals('|', sniff("a|b\n1|2\n3|4\n").getDelimiter());
  }

  @Test void testCommaInsideQuotesDoesNotCount() throws ProfilerException {
    SniffResult result = sniff("city;note\nParis;\"a, b, c\"\nRome;\"d, e\"\n");
    assertEquals(';', result.getDelimiter());
    assertEquals(2, result.getFieldCount());
  }

  @Test void testNumericFirstLineIsNotHeader() throws ProfilerException {
    assertFalse(sniff("1,2\n3,4\n5,6\n").hasHeader());
  }

  @Test void testRepeatedFirstLineValueIsNotHeader() throws ProfilerException {
    assertFalse(sniff("red,big\nblue,small\nred,small\n").hasHeader());
  }

  @Test void testSingleColumn() throws ProfilerException {
    SniffResult result = sniff("name\nalice\nbob\n");
    assertEquals(1, result.getFieldCount());
    assertTrue(result.hasHeader());
  }

  @Test void testAmbiguousStructureFails() {
    ProfilerException e = assertThrows(ProfilerException.class,
        () -> sniff("a,b\nc\nd,e,f\ng;h\n"));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
  }

  @Test void testEmptySampleFails() {
    ProfilerException e = assertThrows(ProfilerException.class, () -> sniff("\n\n"));
    assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
  }

  @Test void testTruncatedSampleDropsPartialLastLine() {
    List<String> lines = DelimiterSniffer.splitLines("a,b\n1,2\n3,", true);
    assertEquals(2, lines.size());
    List<String> complete = DelimiterSniffer.splitLines("\uFEFFa,b\r\n1,2", false);
    assertEquals("a,b", complete.get(0));
    assertEquals("1,2", complete.get(1));
  }
}
