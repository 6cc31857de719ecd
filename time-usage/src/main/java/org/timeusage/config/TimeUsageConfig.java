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
package org.timeusage.config;

import org.timeusage.group.GroupingEngine;
import org.timeusage.report.OutputFormat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of a time usage run.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * input: data/atussum.csv
 * separator: ","              # ignored for .tsv files, which use tabs
 * identifierColumn: tucaseid
 * employmentColumn: telfs
 * sexColumn: tesex
 * ageColumn: teage
 * engine: enumerable          # or sql
 * format: table               # table, json or csv
 * maxRows: 20                 # rows shown by the table format
 * output: report.txt          # optional, defaults to stdout
 * }</pre>
 *
 * <p>The defaults are bundled as {@value #DEFAULTS_RESOURCE}.
 */
public class TimeUsageConfig {

  public static final String DEFAULTS_RESOURCE = "/timeusage-defaults.yaml";

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final String input;
  private final char separator;
  private final String identifierColumn;
  private final String employmentColumn;
  private final String sexColumn;
  private final String ageColumn;
  private final GroupingEngine engine;
  private final OutputFormat format;
  private final int maxRows;
  private final @Nullable String output;

  private TimeUsageConfig(Builder builder) {
    this.input = builder.input;
    this.separator = builder.separator;
    this.identifierColumn = builder.identifierColumn;
    this.employmentColumn = builder.employmentColumn;
    this.sexColumn = builder.sexColumn;
    this.ageColumn = builder.ageColumn;
    this.engine = builder.engine;
    this.format = builder.format;
    this.maxRows = builder.maxRows;
    this.output = builder.output;
  }

  /** Returns the path of the survey file. */
  public String getInput() {
    return input;
  }

  public char getSeparator() {
    return separator;
  }

  public String getIdentifierColumn() {
    return identifierColumn;
  }

  public String getEmploymentColumn() {
    return employmentColumn;
  }

  public String getSexColumn() {
    return sexColumn;
  }

  public String getAgeColumn() {
    return ageColumn;
  }

  public GroupingEngine getEngine() {
    return engine;
  }

  public OutputFormat getFormat() {
    return format;
  }

  public int getMaxRows() {
    return maxRows;
  }

  /** Returns the report file, or null to write to standard output. */
  public @Nullable String getOutput() {
    return output;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a config from a YAML/JSON map. Keys that are absent keep the
   * builder defaults.
   */
  public static TimeUsageConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map.get("input") != null) {
      builder.input(String.valueOf(map.get("input")));
    }
    if (map.get("separator") != null) {
      builder.separator(String.valueOf(map.get("separator")));
    }
    if (map.get("identifierColumn") != null) {
      builder.identifierColumn(String.valueOf(map.get("identifierColumn")));
    }
    if (map.get("employmentColumn") != null) {
      builder.employmentColumn(String.valueOf(map.get("employmentColumn")));
    }
    if (map.get("sexColumn") != null) {
      builder.sexColumn(String.valueOf(map.get("sexColumn")));
    }
    if (map.get("ageColumn") != null) {
      builder.ageColumn(String.valueOf(map.get("ageColumn")));
    }
    if (map.get("engine") != null) {
      builder.engine(GroupingEngine.fromName(String.valueOf(map.get("engine"))));
    }
    if (map.get("format") != null) {
      builder.format(OutputFormat.fromName(String.valueOf(map.get("format"))));
    }
    Object maxRows = map.get("maxRows");
    if (maxRows instanceof Number) {
      builder.maxRows(((Number) maxRows).intValue());
    } else if (maxRows != null) {
      builder.maxRows(parseInt("maxRows", String.valueOf(maxRows)));
    }
    if (map.get("output") != null) {
      builder.output(String.valueOf(map.get("output")));
    }
    return builder.build();
  }

  /**
   * Reads a YAML or JSON configuration file into a map.
   *
   * @throws IOException if the file cannot be read or parsed
   */
  public static Map<String, Object> readMap(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return readMap(in);
    }
  }

  /** Reads the bundled defaults into a map. */
  public static Map<String, Object> readDefaults() throws IOException {
    try (InputStream in = TimeUsageConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new IOException("Resource not found: " + DEFAULTS_RESOURCE);
      }
      return readMap(in);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> readMap(InputStream in) throws IOException {
    Map<String, Object> map = YAML_MAPPER.readValue(in, Map.class);
    return map != null
        ? new LinkedHashMap<String, Object>(map)
        : Collections.<String, Object>emptyMap();
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' is not an integer: " + value, e);
    }
  }

  @Override public String toString() {
    return "TimeUsageConfig{input=" + input
        + ", engine=" + engine
        + ", format=" + format
        + ", identifierColumn=" + identifierColumn
        + ", controls=[" + employmentColumn + ", " + sexColumn + ", " + ageColumn + "]}";
  }

  /**
   * Builder for TimeUsageConfig.
   */
  public static class Builder {
    private String input;
    private char separator = ',';
    private String identifierColumn = "tucaseid";
    private String employmentColumn = "telfs";
    private String sexColumn = "tesex";
    private String ageColumn = "teage";
    private GroupingEngine engine = GroupingEngine.ENUMERABLE;
    private OutputFormat format = OutputFormat.TABLE;
    private int maxRows = 20;
    private @Nullable String output;

    public Builder input(String input) {
      this.input = input;
      return this;
    }

    public Builder separator(char separator) {
      this.separator = separator;
      return this;
    }

    /**
     * Sets the separator from its text form; {@code "\t"} and {@code "tab"}
     * select a tab.
     */
    public Builder separator(String separator) {
      if ("\\t".equals(separator) || "tab".equalsIgnoreCase(separator)) {
        this.separator = '\t';
      } else if (separator.length() == 1) {
        this.separator = separator.charAt(0);
      } else {
        throw new IllegalArgumentException("Separator must be a single character: '"
            + separator + "'");
      }
      return this;
    }

    public Builder identifierColumn(String identifierColumn) {
      this.identifierColumn = identifierColumn;
      return this;
    }

    public Builder employmentColumn(String employmentColumn) {
      this.employmentColumn = employmentColumn;
      return this;
    }

    public Builder sexColumn(String sexColumn) {
      this.sexColumn = sexColumn;
      return this;
    }

    public Builder ageColumn(String ageColumn) {
      this.ageColumn = ageColumn;
      return this;
    }

    public Builder engine(GroupingEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    public Builder maxRows(int maxRows) {
      this.maxRows = maxRows;
      return this;
    }

    public Builder output(@Nullable String output) {
      this.output = output;
      return this;
    }

    public TimeUsageConfig build() {
      if (input == null || input.trim().isEmpty()) {
        throw new IllegalArgumentException("TimeUsageConfig requires 'input'");
      }
      requireName("identifierColumn", identifierColumn);
      requireName("employmentColumn", employmentColumn);
      requireName("sexColumn", sexColumn);
      requireName("ageColumn", ageColumn);
      if (engine == null) {
        throw new IllegalArgumentException("TimeUsageConfig requires 'engine'");
      }
      if (format == null) {
        throw new IllegalArgumentException("TimeUsageConfig requires 'format'");
      }
      if (maxRows <= 0) {
        throw new IllegalArgumentException("'maxRows' must be positive: " + maxRows);
      }
      return new TimeUsageConfig(this);
    }

    private static void requireName(String key, String value) {
      if (value == null || value.trim().isEmpty()) {
        throw new IllegalArgumentException("TimeUsageConfig requires '" + key + "'");
      }
    }
  }
}
