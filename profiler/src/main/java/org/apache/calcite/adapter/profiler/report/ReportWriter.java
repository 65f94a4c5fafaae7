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
package org.apache.calcite.adapter.profiler.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.util.Map;

/**
 * Serializes a {@link ProfileReport} to JSON.
 *
 * <p>Streams passed in are flushed but not closed.
 */
public class ReportWriter {
  private final ObjectMapper mapper;

  public ReportWriter() {
    this(true);
  }

  public ReportWriter(boolean pretty) {
    this.mapper = new ObjectMapper();
    // The caller owns the stream, which may be stdout
    mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    if (pretty) {
      mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }
  }

  public String toJson(ProfileReport report) throws JsonProcessingException {
    return mapper.writeValueAsString(report);
  }

  public void write(ProfileReport report, OutputStream out) throws IOException {
    mapper.writeValue(out, report);
  }

  public void write(ProfileReport report, Writer writer) throws IOException {
    mapper.writeValue(writer, report);
  }

  /**
   * Writes several reports as one JSON object keyed by source name, in the
   * map's iteration order.
   */
  public void write(Map<String, ProfileReport> reports, Writer writer) throws IOException {
    mapper.writeValue(writer, reports);
  }
}
