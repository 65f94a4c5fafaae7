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
import org.apache.calcite.adapter.profiler.value.FieldDecoder;
import org.apache.calcite.adapter.profiler.value.Value;

import com.google.common.collect.ImmutableList;
import com.opencsv.CSVParser;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guesses the field delimiter and header presence of delimited text from a
 * leading byte sample.
 *
 * <p>For each candidate the sample is split into quote-aware lines and the
 * field count of every line is computed. A candidate is consistent when its
 * modal field count covers at least 90% of the lines; among the consistent
 * candidates that split lines into more than one field the one with the lowest
 * variance wins, ties going to the larger field count and then to candidate
 * order. Stateless and thread-safe.
 */
public class DelimiterSniffer {
  private static final Logger LOGGER = LoggerFactory.getLogger(DelimiterSniffer.class);

  /** Candidate delimiters in order of preference. */
  public static final List<Character> CANDIDATES = ImmutableList.of(',', ';', '\t', '|');

  private static final double CONSISTENCY_SHARE = 0.9;
  private static final int HEADER_SAMPLE_LINES = 50;

  private final FieldDecoder decoder = new FieldDecoder();

  /**
   * Sniffs a sample.
   *
   * @param sample Leading bytes of the input
   * @param length Number of valid bytes in {@code sample}
   * @param truncated Whether the input continues past the sample
   * @return Delimiter, header guess and field count
   * @throws ProfilerException with {@code PARSE_ERROR} if the sample has no
   *     complete line or no candidate splits it consistently
   */
  public SniffResult sniff(byte[] sample, int length, boolean truncated)
      throws ProfilerException {
    List<String> lines = splitLines(new String(sample, 0, length, StandardCharsets.UTF_8),
        truncated);
    if (lines.isEmpty()) {
      throw new ProfilerException(ErrorKind.PARSE_ERROR,
          "Sample of " + length + " bytes contains no complete line", 0);
    }

    Candidate best = null;
    boolean anyOccurs = false;
    for (char delimiter : CANDIDATES) {
      Candidate candidate = Candidate.measure(delimiter, lines);
      if (candidate.modalCount <= 1) {
        anyOccurs |= candidate.occurs;
        continue;
      }
      anyOccurs = true;
      LOGGER.debug("Delimiter '{}': modal={} share={} variance={}",
          printable(delimiter), candidate.modalCount, candidate.modalShare, candidate.variance);
      if (candidate.modalShare < CONSISTENCY_SHARE) {
        continue;
      }
      if (best == null || candidate.betterThan(best)) {
        best = candidate;
      }
    }

    if (best == null) {
      if (anyOccurs) {
        throw new ProfilerException(ErrorKind.PARSE_ERROR,
            "Ambiguous structure: no delimiter yields a consistent field count", 0);
      }
      // No candidate appears anywhere: a single-column file
      return new SniffResult(',', guessHeader(lines, ','), 1);
    }

    SniffResult result = new SniffResult(best.delimiter, guessHeader(lines, best.delimiter),
        best.modalCount);
    LOGGER.debug("Sniffed {} from {} lines", result, lines.size());
    return result;
  }

  /**
   * Guesses whether the first line is a header.
   *
   * <p>Every first-line token must be non-empty and non-numeric. When some body
   * column is numeric that is enough; otherwise the first line is rejected if
   * one of its tokens reappears in the same column of the body.
   */
  boolean guessHeader(List<String> lines, char delimiter) {
    CSVParser parser = CsvRecordReassembler.newLineParser(delimiter);
    List<String> first = parseLine(parser, lines.get(0));
    if (first == null) {
      return false;
    }
    for (String token : first) {
      Value value = decoder.classify(token);
      if (value.isMissing() || isNumeric(value)) {
        return false;
      }
    }
    int sampled = Math.min(lines.size(), HEADER_SAMPLE_LINES + 1);
    if (sampled == 1) {
      return true;
    }

    Map<Integer, Integer> numericByColumn = new HashMap<>();
    List<Set<String>> bodyValues = new ArrayList<>();
    for (int i = 0; i < first.size(); i++) {
      bodyValues.add(new HashSet<>());
    }
    for (int i = 1; i < sampled; i++) {
      List<String> tokens = parseLine(parser, lines.get(i));
      if (tokens == null) {
        continue;
      }
      for (int column = 0; column < Math.min(tokens.size(), first.size()); column++) {
        Value value = decoder.classify(tokens.get(column));
        if (isNumeric(value)) {
          numericByColumn.merge(column, 1, Integer::sum);
        } else if (!value.isMissing()) {
          bodyValues.get(column).add(value.text());
        }
      }
    }
    int bodyLines = sampled - 1;
    for (int count : numericByColumn.values()) {
      if (count * 2 > bodyLines) {
        return true;
      }
    }
    for (int column = 0; column < first.size(); column++) {
      if (bodyValues.get(column).contains(first.get(column).trim())) {
        return false;
      }
    }
    return true;
  }

  /**
   * Splits a line into fields, or returns null when the parser rejects it
   * (an unterminated quote at the end of a sample).
   */
  static @Nullable List<String> parseLine(CSVParser parser, String line) {
    try {
      return Arrays.asList(parser.parseLine(line));
    } catch (IOException e) {
      LOGGER.trace("Unparseable sample line: {}", e.getMessage());
      return null;
    }
  }

  private static boolean isNumeric(Value value) {
    return value.kind() == Value.Kind.INT || value.kind() == Value.Kind.FLOAT;
  }

  /**
   * Splits text into non-blank lines, honoring quoted terminators.
   */
  static List<String> splitLines(String text, boolean truncated) {
    if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
      text = text.substring(1);
    }
    List<String> lines = new ArrayList<>();
    boolean inQuotes = false;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        inQuotes = !inQuotes;
      } else if (c == '\n' && !inQuotes) {
        addLine(lines, text, start, i);
        start = i + 1;
      }
    }
    if (start < text.length() && !(truncated && !lines.isEmpty())) {
      addLine(lines, text, start, text.length());
    }
    return lines;
  }

  private static void addLine(List<String> lines, String text, int start, int end) {
    if (end > start && text.charAt(end - 1) == '\r') {
      end--;
    }
    if (end > start) {
      lines.add(text.substring(start, end));
    }
  }

  private static String printable(char delimiter) {
    return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
  }

  /** Field count statistics of one candidate delimiter over the sample. */
  private static final class Candidate {
    final char delimiter;
    final int modalCount;
    final double modalShare;
    final double variance;
    final boolean occurs;

    private Candidate(char delimiter, int modalCount, double modalShare, double variance,
        boolean occurs) {
      this.delimiter = delimiter;
      this.modalCount = modalCount;
      this.modalShare = modalShare;
      this.variance = variance;
      this.occurs = occurs;
    }

    static Candidate measure(char delimiter, List<String> lines) {
      CSVParser parser = CsvRecordReassembler.newLineParser(delimiter);
      Map<Integer, Integer> histogram = new HashMap<>();
      double sum = 0;
      double sumSquares = 0;
      int n = 0;
      for (String line : lines) {
        List<String> fields = parseLine(parser, line);
        if (fields == null) {
          continue;
        }
        int count = fields.size();
        n++;
        histogram.merge(count, 1, Integer::sum);
        sum += count;
        sumSquares += (double) count * count;
      }
      int modalCount = 0;
      int modalLines = 0;
      for (Map.Entry<Integer, Integer> entry : histogram.entrySet()) {
        if (entry.getValue() > modalLines
            || (entry.getValue() == modalLines && entry.getKey() > modalCount)) {
          modalCount = entry.getKey();
          modalLines = entry.getValue();
        }
      }
      if (n == 0) {
        return new Candidate(delimiter, 0, 0, 0, false);
      }
      double mean = sum / n;
      double variance = Math.max(0, sumSquares / n - mean * mean);
      boolean occurs = histogram.size() > 1 || modalCount > 1;
      return new Candidate(delimiter, modalCount, (double) modalLines / n, variance, occurs);
    }

    /** Candidates are offered in preference order, so equal ones keep the earlier. */
    boolean betterThan(Candidate other) {
      if (variance != other.variance) {
        return variance < other.variance;
      }
      return modalCount > other.modalCount;
    }
  }
}
