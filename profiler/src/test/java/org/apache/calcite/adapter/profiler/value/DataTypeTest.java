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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DataType}.
 */
@Tag("unit")
public class DataTypeTest {

  @Test void testLookupByNameAndAlias() {
    assertEquals(DataType.INTEGER, DataType.of("Integer"));
    assertEquals(DataType.INTEGER, DataType.of(" long "));
    assertEquals(DataType.NUMERIC, DataType.of("double"));
    assertEquals(DataType.DATETIME, DataType.of("TIMESTAMP"));
    assertNull(DataType.of("blob"));
  }

  @Test void testCategories() {
    assertTrue(DataType.NUMERIC.isNumeric());
    assertFalse(DataType.STRING.isNumeric());
    assertTrue(DataType.DATE.isCategorical());
    assertTrue(DataType.DATE.isTemporal());
    assertFalse(DataType.DATETIME.isCategorical());
    assertEquals("DateTime", DataType.DATETIME.getDisplayName());
  }
}
