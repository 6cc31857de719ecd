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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TimeUsageConfig.
 */
@Tag("unit")
public class TimeUsageConfigTest {

  @TempDir
  Path tempDir;

  @Test void testBuilderDefaults() {
    TimeUsageConfig config = TimeUsageConfig.builder().input("atussum.csv").build();

    assertEquals("atussum.csv", config.getInput());
    assertEquals(',', config.getSeparator());
    assertEquals("tucaseid", config.getIdentifierColumn());
    assertEquals("telfs", config.getEmploymentColumn());
    assertEquals("tesex", config.getSexColumn());
    assertEquals("teage", config.getAgeColumn());
    assertEquals(GroupingEngine.ENUMERABLE, config.getEngine());
    assertEquals(OutputFormat.TABLE, config.getFormat());
    assertEquals(20, config.getMaxRows());
    assertNull(config.getOutput());
  }

  @Test void testFromMap() {
    Map<String, Object> map = new HashMap<>();
    map.put("input", "data/atussum.tsv");
    map.put("separator", "tab");
    map.put("employmentColumn", "status");
    map.put("engine", "SQL");
    map.put("format", "json");
    map.put("maxRows", "5");
    map.put("output", "report.json");

    TimeUsageConfig config = TimeUsageConfig.fromMap(map);

    assertEquals('\t', config.getSeparator());
    assertEquals("status", config.getEmploymentColumn());
    assertEquals("tesex", config.getSexColumn());
    assertEquals(GroupingEngine.SQL, config.getEngine());
    assertEquals(OutputFormat.JSON, config.getFormat());
    assertEquals(5, config.getMaxRows());
    assertEquals("report.json", config.getOutput());
  }

  @Test void testSeparatorForms() {
    assertEquals('\t', TimeUsageConfig.builder().input("a").separator("\\t").build()
        .getSeparator());
    assertEquals(';', TimeUsageConfig.builder().input("a").separator(";").build()
        .getSeparator());
    assertThrows(IllegalArgumentException.class,
        () -> TimeUsageConfig.builder().separator(";;"));
  }

  @Test void testValidation() {
    assertThrows(IllegalArgumentException.class, () -> TimeUsageConfig.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> TimeUsageConfig.builder().input("a").maxRows(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> TimeUsageConfig.builder().input("a").ageColumn(" ").build());

    Map<String, Object> map = new HashMap<>();
    map.put("input", "a");
    map.put("maxRows", "many");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> TimeUsageConfig.fromMap(map));
    assertTrue(e.getMessage().contains("maxRows"));

    map.put("maxRows", 3);
    map.put("engine", "spark");
    assertThrows(IllegalArgumentException.class, () -> TimeUsageConfig.fromMap(map));
  }

  @Test void testReadYamlFile() throws Exception {
    Path file = tempDir.resolve("run.yaml");
    Files.write(file, ("input: data/atussum.csv\n"
        + "engine: sql\n"
        + "maxRows: 7\n").getBytes(StandardCharsets.UTF_8));

    TimeUsageConfig config = TimeUsageConfig.fromMap(TimeUsageConfig.readMap(file));

    assertEquals("data/atussum.csv", config.getInput());
    assertEquals(GroupingEngine.SQL, config.getEngine());
    assertEquals(7, config.getMaxRows());
  }

  @Test void testBundledDefaults() throws Exception {
    Map<String, Object> defaults = TimeUsageConfig.readDefaults();

    assertEquals("tucaseid", defaults.get("identifierColumn"));
    assertEquals("enumerable", defaults.get("engine"));
    assertEquals(20, defaults.get("maxRows"));
  }
}
