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
package org.apache.calcite.adapter.profiler.cli;

import org.apache.calcite.adapter.profiler.ProfilerConfig;
import org.apache.calcite.adapter.profiler.ProfilerException;
import org.apache.calcite.adapter.profiler.report.ColumnProfile;
import org.apache.calcite.adapter.profiler.report.ProfileReport;
import org.apache.calcite.adapter.profiler.report.ReportWriter;
import org.apache.calcite.adapter.profiler.session.SchemaHints;
import org.apache.calcite.adapter.profiler.session.SessionRunner;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point: profiles one or more files and prints JSON.
 *
 * <p>Usage:
 * <pre>
 * java -jar column-profiler.jar data.csv [more files] [--output report.json]
 *     [--config profiler.yaml] [--delimiter ';'] [--no-header]
 *     [--chunk-size 1048576] [--fail-on-missing 10]
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when a quality gate fails, 2 on a profiling
 * or usage error.
 */
public class ProfilerMain {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProfilerMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_QUALITY_GATE = 1;
  static final int EXIT_ERROR = 2;

  private static final String USAGE = "Usage: profiler <file>... [--format json]"
      + " [--output <file>] [--config <yaml>] [--delimiter <c>] [--no-header]"
      + " [--chunk-size <bytes>] [--fail-on-missing <percent>]";

  private ProfilerMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Runs the command and returns its exit code.
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options;
    try {
      options = Options.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return EXIT_ERROR;
    }

    Map<String, ProfileReport> reports = new LinkedHashMap<>();
    try {
      ProfilerConfig config = loadConfig(options);
      SessionRunner runner = new SessionRunner(config);
      for (Path file : options.files) {
        reports.put(file.getFileName().toString(), runner.profile(file, options.hints()));
      }
    } catch (ProfilerException e) {
      LOGGER.error("Profiling failed: {}", e.getMessage());
      err.println("Profiling failed (" + e.getKind() + "): " + e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      LOGGER.error("Cannot read input", e);
      err.println("Cannot read input: " + e.getMessage());
      return EXIT_ERROR;
    } catch (IllegalArgumentException e) {
      err.println("Invalid configuration: " + e.getMessage());
      return EXIT_ERROR;
    }

    try {
      writeReports(options, reports, out);
    } catch (IOException e) {
      LOGGER.error("Cannot write report", e);
      err.println("Cannot write report: " + e.getMessage());
      return EXIT_ERROR;
    }

    if (options.failOnMissing != null) {
      List<String> violations = missingViolations(reports, options.failOnMissing);
      if (!violations.isEmpty()) {
        for (String violation : violations) {
          err.println(violation);
        }
        return EXIT_QUALITY_GATE;
      }
    }
    return EXIT_OK;
  }

  private static ProfilerConfig loadConfig(Options options) throws IOException {
    ProfilerConfig base = ProfilerConfig.defaults();
    if (options.config != null) {
      try (InputStream in = Files.newInputStream(options.config)) {
        base = ProfilerConfig.load(in);
      }
    }
    if (options.chunkSize == null) {
      return base;
    }
    return base.toBuilder().chunkSizeBytes(options.chunkSize).build();
  }

  private static void writeReports(Options options, Map<String, ProfileReport> reports,
      PrintStream out) throws IOException {
    ReportWriter writer = new ReportWriter(true);
    Writer target = options.output != null
        ? Files.newBufferedWriter(options.output, StandardCharsets.UTF_8)
        : new OutputStreamWriter(out, StandardCharsets.UTF_8);
    try {
      if (reports.size() == 1) {
        writer.write(reports.values().iterator().next(), target);
      } else {
        writer.write(reports, target);
      }
      target.write(System.lineSeparator());
      target.flush();
    } finally {
      if (options.output != null) {
        target.close();
      }
    }
  }

  /**
   * Lists the columns whose missing share exceeds the threshold.
   */
  static List<String> missingViolations(Map<String, ProfileReport> reports, double percent) {
    List<String> violations = new ArrayList<>();
    for (Map.Entry<String, ProfileReport> entry : reports.entrySet()) {
      for (ColumnProfile column : entry.getValue().getColumnList()) {
        if (column.getCount() == 0) {
          continue;
        }
        double missing = 100.0 * column.getMissingCount() / column.getCount();
        if (missing > percent) {
          violations.add(String.format(Locale.ROOT,
              "%s: column '%s' is %.1f%% missing (limit %.1f%%)",
              entry.getKey(), column.getName(), missing, percent));
        }
      }
    }
    return violations;
  }

  /** Parsed command line. */
  static class Options {
    final List<Path> files = new ArrayList<>();
    @Nullable Path output;
    @Nullable Path config;
    @Nullable Character delimiter;
    boolean noHeader;
    @Nullable Integer chunkSize;
    @Nullable Double failOnMissing;

    static Options parse(String[] args) {
      Options options = new Options();
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        switch (arg) {
        case "--format":
          String format = value(args, ++i, arg);
          if (!"json".equalsIgnoreCase(format)) {
            throw new IllegalArgumentException("Unsupported output format: " + format);
          }
          break;
        case "--output":
          options.output = Paths.get(value(args, ++i, arg));
          break;
        case "--config":
          options.config = Paths.get(value(args, ++i, arg));
          break;
        case "--delimiter":
          options.delimiter = parseDelimiter(value(args, ++i, arg));
          break;
        case "--no-header":
          options.noHeader = true;
          break;
        case "--chunk-size":
          options.chunkSize = parseNumber(value(args, ++i, arg), arg).intValue();
          break;
        case "--fail-on-missing":
          options.failOnMissing = parseNumber(value(args, ++i, arg), arg).doubleValue();
          break;
        default:
          if (arg.startsWith("--")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
          }
          options.files.add(Paths.get(arg));
        }
      }
      if (options.files.isEmpty()) {
        throw new IllegalArgumentException("No input files");
      }
      return options;
    }

    SchemaHints hints() {
      return SchemaHints.builder()
          .delimiter(delimiter)
          .hasHeader(noHeader ? Boolean.FALSE : null)
          .build();
    }

    private static String value(String[] args, int index, String option) {
      if (index >= args.length) {
        throw new IllegalArgumentException("Missing value for " + option);
      }
      return args[index];
    }

    private static char parseDelimiter(String text) {
      if ("\\t".equals(text) || "tab".equalsIgnoreCase(text)) {
        return '\t';
      }
      if (text.length() != 1) {
        throw new IllegalArgumentException("Delimiter must be a single character: " + text);
      }
      return text.charAt(0);
    }

    private static Number parseNumber(String text, String option) {
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number for " + option + ": " + text, e);
      }
    }
  }
}
