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
package org.apache.calcite.adapter.profiler.format.json;

import org.apache.calcite.adapter.profiler.format.AbstractRecordReassembler;
import org.apache.calcite.adapter.profiler.format.Record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reassembles JSON records from JSON Lines or a top-level JSON array.
 *
 * <p>A record is one top-level value. For objects and arrays the boundary is
 * the bracket that brings the nesting depth back to zero; string contents and
 * escapes are skipped while counting. Whitespace and commas between values, and
 * the brackets of an enclosing array, are not part of any record. A top-level
 * value that is not an object, or that Jackson cannot parse, becomes a
 * malformed record.
 */
public class JsonRecordReassembler extends AbstractRecordReassembler {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonRecordReassembler.class);

  private final ObjectMapper mapper;
  private final JsonFlattener flattener;
  private final boolean arrayWrapped;

  private boolean wrapperOpened;
  private boolean inValue;
  private boolean scalar;
  private boolean inString;
  private boolean escape;
  private int depth;

  /**
   * Creates a reassembler.
   *
   * @param arrayWrapped Whether records are the elements of a top-level array
   * @param maxDepth Nesting depth flattened into dotted keys
   * @param maxRecordBytes Limit for a pending partial record
   */
  public JsonRecordReassembler(boolean arrayWrapped, int maxDepth, int maxRecordBytes) {
    super(maxRecordBytes);
    this.arrayWrapped = arrayWrapped;
    this.mapper = new ObjectMapper();
    this.flattener = new JsonFlattener(maxDepth);
  }

  @Override protected @Nullable Record scanNext() {
    while (scanPos < limit) {
      byte b = buffer[scanPos];
      if (!inValue) {
        if (isSeparator(b) || isByteOrderMark(b)) {
          scanPos++;
          recordStart = scanPos;
          continue;
        }
        if (arrayWrapped && b == '[' && !wrapperOpened) {
          wrapperOpened = true;
          scanPos++;
          recordStart = scanPos;
          continue;
        }
        if (arrayWrapped && b == ']') {
          scanPos++;
          recordStart = scanPos;
          continue;
        }
        inValue = true;
        scalar = b != '{' && b != '[';
        depth = 0;
        recordStart = scanPos;
      }

      if (inString) {
        if (escape) {
          escape = false;
        } else if (b == '\\') {
          escape = true;
        } else if (b == '"') {
          inString = false;
        }
      } else if (b == '"') {
        inString = true;
      } else if (scalar) {
        if (b == ',' || b == '\n' || b == '\r' || b == ']') {
          return complete(recordStart, scanPos);
        }
      } else if (b == '{' || b == '[') {
        depth++;
      } else if (b == '}' || b == ']') {
        depth--;
        if (depth == 0) {
          scanPos++;
          return complete(recordStart, scanPos);
        }
      }
      scanPos++;
    }
    return null;
  }

  @Override protected @Nullable Record flushTail() {
    if (!inValue) {
      return null;
    }
    int start = recordStart;
    int end = limit;
    while (end > start && isSeparator(buffer[end - 1])) {
      end--;
    }
    recordStart = limit;
    scanPos = limit;
    if (end <= start) {
      inValue = false;
      return null;
    }
    return complete(start, end);
  }

  private Record complete(int start, int end) {
    inValue = false;
    inString = false;
    escape = false;
    recordStart = scanPos;
    long index = nextIndex();
    try {
      JsonNode node = mapper.readTree(buffer, start, end - start);
      if (node == null || !node.isObject()) {
        LOGGER.debug("Record {} is not a JSON object", index);
        return Record.malformed(index);
      }
      Map<String, Integer> arrayLengths = new HashMap<>();
      Map<String, @Nullable String> flat = flattener.flatten(node, arrayLengths);
      List<String> names = new ArrayList<>(flat.keySet());
      List<@Nullable String> values = new ArrayList<>(flat.values());
      return Record.keyed(index, names, values, arrayLengths);
    } catch (JsonProcessingException e) {
      LOGGER.debug("Record {} is not valid JSON: {}", index, e.getOriginalMessage());
      return Record.malformed(index);
    } catch (IOException e) {
      LOGGER.debug("Record {} could not be read: {}", index, e.getMessage());
      return Record.malformed(index);
    }
  }

  private boolean isByteOrderMark(byte b) {
    return getRecordCount() == 0 && (b == (byte) 0xEF || b == (byte) 0xBB || b == (byte) 0xBF);
  }

  private static boolean isSeparator(byte b) {
    return b == ' ' || b == '\t' || b == '\r' || b == '\n' || b == ',';
  }
}
