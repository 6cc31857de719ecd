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
package org.timeusage;

import org.timeusage.config.TimeUsageConfig;
import org.timeusage.report.TimeUsageReporter;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line entry point.
 *
 * <p>Usage:
 * <pre>
 * java -jar time-usage.jar --input atussum.csv [--config run.yaml]
 *     [--engine enumerable|sql] [--format table|json|csv] [--max-rows N]
 *     [--output report.txt] [--separator ,|;|tab]
 * </pre>
 *
 * <p>Options override the configuration file, which overrides the bundled
 * defaults.
 */
public class TimeUsageApp {
  private static final Logger LOGGER = LoggerFactory.getLogger(TimeUsageApp.class);

  static final String USAGE = "Usage: java -jar time-usage.jar --input <csv>"
      + " [--config <yaml>] [--engine enumerable|sql] [--format table|json|csv]"
      + " [--max-rows <n>] [--output <file>] [--separator <char>|tab]";

  private static final Map<String, String> OPTION_KEYS = new LinkedHashMap<>();

  static {
    OPTION_KEYS.put("--input", "input");
    OPTION_KEYS.put("--engine", "engine");
    OPTION_KEYS.put("--format", "format");
    OPTION_KEYS.put("--max-rows", "maxRows");
    OPTION_KEYS.put("--output", "output");
    OPTION_KEYS.put("--separator", "separator");
  }

  private TimeUsageApp() {
  }

  public static void main(String[] args) {
    PrintWriter out = new PrintWriter(
        new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
    int status = run(args, out);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Runs the pipeline and writes the report.
   *
   * @param args Command line arguments
   * @param stdout Destination of the report when no output file is configured
   * @return Process exit status, 0 on success
   */
  static int run(String[] args, Writer stdout) {
    TimeUsageConfig config;
    try {
      config = resolveConfig(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      return 1;
    } catch (IOException e) {
      LOGGER.error("Cannot read configuration", e);
      return 1;
    }

    try {
      TimeUsageResult result = new TimeUsagePipeline(config).execute();
      TimeUsageReporter reporter = new TimeUsageReporter(config.getFormat(), config.getMaxRows());
      if (config.getOutput() == null) {
        reporter.report(result.getAggregates(), stdout);
      } else {
        try (Writer writer = Files.newBufferedWriter(Paths.get(config.getOutput()),
            StandardCharsets.UTF_8)) {
          reporter.report(result.getAggregates(), writer);
        }
        LOGGER.info("Report written to {}", config.getOutput());
      }
      return 0;
    } catch (TimeUsageException e) {
      LOGGER.error("Time usage run failed: {}", e.getMessage(), e);
      return 1;
    } catch (IOException e) {
      LOGGER.error("Cannot write report", e);
      return 1;
    }
  }

  /**
   * Merges the bundled defaults, the {@code --config} file and the command
   * line options into a config.
   *
   * @throws IllegalArgumentException if an option is unknown or the result is invalid
   * @throws IOException if a configuration file cannot be read
   */
  static TimeUsageConfig resolveConfig(String[] args) throws IOException {
    Map<String, String> options = parseArgs(args);
    Map<String, Object> merged = new LinkedHashMap<>(TimeUsageConfig.readDefaults());
    @Nullable String configFile = options.remove("config");
    if (configFile != null) {
      merged.putAll(TimeUsageConfig.readMap(Paths.get(configFile)));
    }
    merged.putAll(options);
    return TimeUsageConfig.fromMap(merged);
  }

  /**
   * Parses {@code --name value} pairs into configuration keys.
   *
   * @throws IllegalArgumentException if an option is unknown or has no value
   */
  static Map<String, String> parseArgs(String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String key = "--config".equals(arg) ? "config" : OPTION_KEYS.get(arg);
      if (key == null) {
        throw new IllegalArgumentException("Unknown option: " + arg);
      }
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("Missing value for " + arg);
      }
      options.put(key, args[++i]);
    }
    return options;
  }
}
