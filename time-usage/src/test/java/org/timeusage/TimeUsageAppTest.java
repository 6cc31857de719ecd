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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the command line entry point.
 */
@Tag("integration")
public class TimeUsageAppTest {

  @TempDir
  Path tempDir;

  @Test void testParseArgs() {
    assertEquals(ImmutableMap.of("input", "a.csv", "maxRows", "5", "config", "run.yaml"),
        TimeUsageApp.parseArgs(
            new String[] {"--input", "a.csv", "--max-rows", "5", "--config", "run.yaml"}));
  }

  @Test void testParseArgsRejectsBadOptions() {
    assertThrows(IllegalArgumentException.class,
        () -> TimeUsageApp.parseArgs(new String[] {"--threads", "4"}));
    assertThrows(IllegalArgumentException.class,
        () -> TimeUsageApp.parseArgs(new String[] {"--input"}));
  }

  @Test void testOptionsOverrideConfigFile() throws Exception {
    Path file = tempDir.resolve("run.yaml");
    Files.write(file, "input: from-file.csv\nengine: sql\nformat: json\n"
        .getBytes(StandardCharsets.UTF_8));

    TimeUsageConfig config = TimeUsageApp.resolveConfig(
        new String[] {"--config", file.toString(), "--format", "csv"});

    assertEquals("from-file.csv", config.getInput());
    assertEquals("SQL", config.getEngine().name());
    assertEquals("CSV", config.getFormat().name());
    assertEquals("tucaseid", config.getIdentifierColumn());
  }

  @Test void testSeparatorOption() throws Exception {
    TimeUsageConfig config = TimeUsageApp.resolveConfig(
        new String[] {"--input", "a.csv", "--separator", "tab"});

    assertEquals('\t', config.getSeparator());
    assertTrue(TimeUsageApp.USAGE.contains("--separator"));
  }

  @Test void testRunWritesReport() throws Exception {
    StringWriter out = new StringWriter();

    int status = TimeUsageApp.run(new String[] {
        "--input", TimeUsagePipelineTest.samplePath(), "--format", "csv"}, out);

    assertEquals(0, status);
    assertEquals("working,sex,age,primaryNeeds,work,other\n"
        + "not working,female,young,11.5,0.0,10.0\n"
        + "not working,male,young,9.3,0.0,6.0\n"
        + "working,female,elder,9.5,5.5,1.5\n"
        + "working,male,active,9.0,7.5,6.0\n", out.toString());
  }

  @Test void testRunWritesOutputFile() throws Exception {
    Path report = tempDir.resolve("report.txt");
    StringWriter out = new StringWriter();

    int status = TimeUsageApp.run(new String[] {
        "--input", TimeUsagePipelineTest.samplePath(), "--engine", "sql",
        "--max-rows", "1", "--output", report.toString()}, out);

    assertEquals(0, status);
    assertEquals("", out.toString());
    String table = new String(Files.readAllBytes(report), StandardCharsets.UTF_8);
    assertTrue(table.contains("|not working|female|young|"));
    assertTrue(table.endsWith("only showing top 1 rows\n"));
  }

  @Test void testRunFailures() {
    StringWriter out = new StringWriter();

    assertEquals(1, TimeUsageApp.run(new String[] {"--bogus", "x"}, out));
    assertEquals(1, TimeUsageApp.run(new String[0], out));
    assertEquals(1, TimeUsageApp.run(
        new String[] {"--input", tempDir.resolve("absent.csv").toString()}, out));
    assertEquals(1, TimeUsageApp.run(
        new String[] {"--input", "a.csv", "--engine", "spark"}, out));
    assertEquals("", out.toString());
  }
}
