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

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens a nested JSON object into dotted column keys.
 *
 * <p>Objects are flattened using the separator up to the maximum depth; deeper
 * objects are kept as their JSON text. Arrays of scalars become delimited
 * strings, arrays holding objects are summarized as {@code [array:N]}, and
 * empty objects are skipped. A JSON {@code null} maps to a null value. The
 * length of every flattened array can be reported to the caller.
 */
public class JsonFlattener {
  private final String delimiter;
  private final int maxDepth;
  private final String separator;

  public JsonFlattener() {
    this(",", 3, ".");
  }

  public JsonFlattener(int maxDepth) {
    this(",", maxDepth, ".");
  }

  public JsonFlattener(String delimiter, int maxDepth, String separator) {
    this.delimiter = delimiter;
    this.maxDepth = maxDepth;
    this.separator = separator;
  }

  /**
   * Flattens an object node.
   *
   * @param input The object to flatten
   * @return Flattened keys in document order, mapped to their raw tokens
   */
  public Map<String, @Nullable String> flatten(JsonNode input) {
    return flatten(input, null);
  }

  /**
   * Flattens an object node and records array lengths.
   *
   * @param input The object to flatten
   * @param arrayLengths Receives the element count of each array, keyed like
   *     the output; null to skip
   * @return Flattened keys in document order, mapped to their raw tokens
   */
  public Map<String, @Nullable String> flatten(JsonNode input,
      @Nullable Map<String, Integer> arrayLengths) {
    Map<String, @Nullable String> output = new LinkedHashMap<>();
    flattenObject("", input, output, arrayLengths, 0);
    return output;
  }

  private void flattenObject(String prefix, JsonNode obj,
                            Map<String, @Nullable String> output,
                            @Nullable Map<String, Integer> arrayLengths, int depth) {
    if (depth > maxDepth) {
      // Too deep, keep the object as JSON text
      if (!prefix.isEmpty()) {
        output.put(prefix, obj.toString());
      }
      return;
    }

    Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      String key = prefix.isEmpty() ? entry.getKey() : prefix + separator + entry.getKey();
      JsonNode value = entry.getValue();

      if (value == null || value.isNull() || value.isMissingNode()) {
        output.put(key, null);
      } else if (value.isObject()) {
        if (value.isEmpty()) {
          continue;
        }
        flattenObject(key, value, output, arrayLengths, depth + 1);
      } else if (value.isArray()) {
        output.put(key, flattenArray(value));
        if (arrayLengths != null) {
          arrayLengths.put(key, value.size());
        }
      } else {
        output.put(key, value.asText());
      }
    }
  }

  private String flattenArray(JsonNode array) {
    if (array.isEmpty()) {
      return "";
    }

    for (JsonNode item : array) {
      if (item.isContainerNode()) {
        return "[array:" + array.size() + "]";
      }
    }

    StringBuilder joined = new StringBuilder();
    for (JsonNode item : array) {
      if (joined.length() > 0) {
        joined.append(delimiter);
      }
      if (!item.isNull()) {
        joined.append(escapeValue(item.asText()));
      }
    }
    return joined.toString();
  }

  private String escapeValue(String value) {
    // If the value contains our delimiter, wrap it in quotes
    if (value.contains(delimiter)) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
