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
package org.timeusage.report;

import org.timeusage.group.GroupAggregate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders grouped averages as a table, JSON or CSV.
 *
 * <p>Columns are always {@code working, sex, age, primaryNeeds, work, other},
 * in the order the aggregates are given.
 *
 * <h3>Table format</h3>
 * <pre>
 * +-------+----+------+------------+----+-----+
 * |working| sex|   age|primaryNeeds|work|other|
 * +-------+----+------+------------+----+-----+
 * |working|male|active|         9.0| 7.5|  6.0|
 * +-------+----+------+------------+----+-----+
 * </pre>
 */
public class TimeUsageReporter {

  public static final List<String> COLUMNS =
      ImmutableList.of("working", "sex", "age", "primaryNeeds", "work", "other");

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final OutputFormat format;
  private final int maxRows;

  /**
   * Creates a reporter.
   *
   * @param format Output format
   * @param maxRows Maximum number of rows shown by the table format
   */
  public TimeUsageReporter(OutputFormat format, int maxRows) {
    if (maxRows <= 0) {
      throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
    }
    this.format = format;
    this.maxRows = maxRows;
  }

  /**
   * Writes the rendered report.
   *
   * @throws IOException if writing fails
   */
  public void report(List<GroupAggregate> aggregates, Writer out) throws IOException {
    out.write(render(aggregates));
    out.flush();
  }

  /** Renders the report to a string. */
  public String render(List<GroupAggregate> aggregates) {
    switch (format) {
      case TABLE:
        return renderTable(aggregates);
      case JSON:
        return renderJson(aggregates);
      case CSV:
        return renderCsv(aggregates);
      default:
        throw new AssertionError("unknown format " + format);
    }
  }

  private String renderTable(List<GroupAggregate> aggregates) {
    List<String[]> cells = new ArrayList<>();
    cells.add(COLUMNS.toArray(new String[0]));
    int shown = Math.min(aggregates.size(), maxRows);
    for (GroupAggregate aggregate : aggregates.subList(0, shown)) {
      cells.add(toCells(aggregate));
    }

    int[] widths = new int[COLUMNS.size()];
    for (String[] row : cells) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], row[i].length());
      }
    }

    StringBuilder separator = new StringBuilder("+");
    for (int width : widths) {
      separator.append(Strings.repeat("-", width)).append('+');
    }
    separator.append('\n');

    StringBuilder sb = new StringBuilder();
    sb.append(separator);
    for (int r = 0; r < cells.size(); r++) {
      sb.append('|');
      for (int i = 0; i < widths.length; i++) {
        sb.append(Strings.padStart(cells.get(r)[i], widths[i], ' ')).append('|');
      }
      sb.append('\n');
      if (r == 0) {
        sb.append(separator);
      }
    }
    sb.append(separator);
    if (aggregates.size() > shown) {
      sb.append("only showing top ").append(shown).append(" rows\n");
    }
    return sb.toString();
  }

  private static String renderJson(List<GroupAggregate> aggregates) {
    ArrayNode array = JSON_MAPPER.createArrayNode();
    for (GroupAggregate aggregate : aggregates) {
      ObjectNode node = array.addObject();
      node.put("working", aggregate.getWorking());
      node.put("sex", aggregate.getSex());
      node.put("age", aggregate.getAge());
      node.put("primaryNeeds", aggregate.getPrimaryNeeds());
      node.put("work", aggregate.getWork());
      node.put("other", aggregate.getOther());
    }
    try {
      return JSON_MAPPER.writeValueAsString(array) + "\n";
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize report", e);
    }
  }

  private static String renderCsv(List<GroupAggregate> aggregates) {
    StringWriter buffer = new StringWriter();
    try (CSVWriter csvWriter = new CSVWriter(buffer)) {
      csvWriter.writeNext(COLUMNS.toArray(new String[0]), false);
      for (GroupAggregate aggregate : aggregates) {
        csvWriter.writeNext(toCells(aggregate), false);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return buffer.toString();
  }

  private static String[] toCells(GroupAggregate aggregate) {
    return new String[] {
        aggregate.getWorking(),
        aggregate.getSex(),
        aggregate.getAge(),
        String.valueOf(aggregate.getPrimaryNeeds()),
        String.valueOf(aggregate.getWork()),
        String.valueOf(aggregate.getOther())
    };
  }
}
