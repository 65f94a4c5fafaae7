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
package org.apache.calcite.adapter.profiler.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FieldDecoder}.
 */
@Tag("unit")
public class FieldDecoderTest {

  private final FieldDecoder decoder = new FieldDecoder();

  @Test void testMissingTokens() {
    assertTrue(decoder.classify(null).isMissing());
    assertTrue(decoder.classify("").isMissing());
    assertTrue(decoder.classify("   ").isMissing());
    assertTrue(decoder.classify("NA").isMissing());
    assertTrue(decoder.classify("null").isMissing());
    assertTrue(decoder.classify("N/A").isMissing());
  }

  @Test void testClassifiesInOrderOfRestrictiveness() {
    assertEquals(Value.Kind.BOOL, decoder.classify("true").kind());
    assertEquals(Value.Kind.BOOL, decoder.classify("F").kind());
    assertEquals(Value.Kind.INT, decoder.classify("42").kind());
    assertEquals(Value.Kind.INT, decoder.classify("-7").kind());
    assertEquals(Value.Kind.FLOAT, decoder.classify("3.14").kind());
    assertEquals(Value.Kind.FLOAT, decoder.classify("1e5").kind());
    assertEquals(Value.Kind.FLOAT, decoder.classify(".5").kind());
    assertEquals(Value.Kind.TEMPORAL, decoder.classify("2024-01-15").kind());
    assertEquals(Value.Kind.TEMPORAL, decoder.classify("2024-01-15T10:30:00").kind());
    assertEquals(Value.Kind.TEXT, decoder.classify("hello").kind());
    assertEquals(Value.Kind.TEXT, decoder.classify("12abc").kind());
  }

  @Test void testTrimsSourceText() {
    Value value = decoder.classify("  17 ");
    assertEquals("17", value.text());
    assertEquals(17L, ((Value.IntValue) value).longValue());
  }

  @Test void testIntegerOverflowBecomesFloat() {
    Value value = decoder.classify("99999999999999999999");
    assertEquals(Value.Kind.FLOAT, value.kind());
    assertEquals(1e20, value.asDouble(), 1e5);
  }

  @Test void testDateLayouts() {
    assertDate("2024-01-15");
    assertDate("2024/01/15");
    assertDate("01/15/2024");
    assertDate("15/01/2024");
    assertDate("15.01.2024");
    assertEquals(Value.Kind.TEXT, decoder.classify("2024-02-30").kind());
  }

  private void assertDate(String text) {
    Value value = decoder.classify(text);
    assertEquals(Value.Kind.TEMPORAL, value.kind(), text);
    assertTrue(((Value.TemporalValue) value).isDateOnly(), text);
    assertEquals(LocalDateTime.of(2024, 1, 15, 0, 0),
        ((Value.TemporalValue) value).temporalValue(), text);
  }

  @Test void testDateTimeWithOffsetIsNormalizedToUtc() {
    Value value = decoder.classify("2024-01-15T10:30:00+02:00");
    assertEquals(Value.Kind.TEMPORAL, value.kind());
    assertFalse(((Value.TemporalValue) value).isDateOnly());
    assertEquals(LocalDateTime.of(2024, 1, 15, 8, 30),
        ((Value.TemporalValue) value).temporalValue());

    Value spaced = decoder.classify("2024-01-15 10:30:00");
    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30),
        ((Value.TemporalValue) spaced).temporalValue());
  }

  @Test void testCoerceToLockedType() {
    Value integer = decoder.classify("5");
    Value coerced = decoder.coerce(integer, DataType.NUMERIC);
    assertEquals(Value.Kind.FLOAT, coerced.kind());
    assertEquals(5.0, coerced.asDouble(), 0.0);

    assertNull(decoder.coerce(decoder.classify("5.5"), DataType.INTEGER));
    assertNull(decoder.coerce(decoder.classify("abc"), DataType.NUMERIC));
    assertNull(decoder.coerce(decoder.classify("2024-01-15T10:30:00"), DataType.DATE));
    assertEquals(Value.Kind.TEMPORAL,
        decoder.coerce(decoder.classify("2024-01-15"), DataType.DATETIME).kind());
    assertEquals(Value.Kind.TEXT, decoder.coerce(integer, DataType.STRING).kind());
    assertSame(integer, decoder.coerce(integer, DataType.MIXED));
  }

  @Test void testDecodeKeepsMissingDistinctFromNonConforming() {
    assertTrue(decoder.decode("", DataType.INTEGER).isMissing());
    assertNull(decoder.decode("abc", DataType.INTEGER));
    assertEquals(12L, ((Value.IntValue) decoder.decode("12", DataType.INTEGER)).longValue());
  }

  @Test void testOnlyTrueFalseLettersAreBoolean() {
    for (String token : new String[] {"true", "False", "T", "f"}) {
      assertEquals(Value.Kind.BOOL, decoder.classify(token).kind(), token);
    }
    for (String token : new String[] {"yes", "No", "y", "N"}) {
      assertEquals(Value.Kind.TEXT, decoder.classify(token).kind(), token);
    }
  }

  @Test void testCandidateTypes() {
    assertEquals(DataType.INTEGER, FieldDecoder.candidateType(decoder.classify("1")));
    assertEquals(DataType.NUMERIC, FieldDecoder.candidateType(decoder.classify("1.5")));
    assertEquals(DataType.BOOLEAN, FieldDecoder.candidateType(decoder.classify("TRUE")));
    assertEquals(DataType.DATE, FieldDecoder.candidateType(decoder.classify("2024-01-15")));
    assertEquals(DataType.DATETIME,
        FieldDecoder.candidateType(decoder.classify("2024-01-15T00:00:00")));
    assertEquals(DataType.STRING, FieldDecoder.candidateType(decoder.classify("x")));
    assertEquals(DataType.EMPTY, FieldDecoder.candidateType(Value.missing()));
  }

  @Test void testCustomNullEquivalents() {
    FieldDecoder custom = new FieldDecoder(java.util.Collections.singleton("-"));
    assertTrue(custom.classify("-").isMissing());
    assertFalse(custom.classify("NA").isMissing());
  }
}
