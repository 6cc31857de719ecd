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
package org.timeusage.format.csv;

import org.timeusage.LoadException;
import org.timeusage.SchemaException;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads a time usage survey file into a {@link RespondentTable}.
 *
 * <p>The first record is the header. The identifier column is kept as text;
 * every other column is cast to a double. Files ending in {@code .tsv} are
 * read with a tab separator, everything else with the configured separator.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CsvTimeUsageReader reader = new CsvTimeUsageReader("tucaseid", ',');
 * RespondentTable table = reader.read(Paths.get("atussum.csv"));
 * List<String> columns = table.getColumnNames();
 * }</pre>
 */
public class CsvTimeUsageReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTimeUsageReader.class);

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private static final Pattern PLAIN_DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private final String identifierColumn;
  private final char separator;

  /**
   * Creates a reader.
   *
   * @param identifierColumn Name of the column kept as text
   * @param separator Field separator for files that are not {@code .tsv}
   */
  public CsvTimeUsageReader(String identifierColumn, char separator) {
    this.identifierColumn = identifierColumn;
    this.separator = separator;
  }

  /**
   * Reads a survey file.
   *
   * @param path Location of the file
   * @return Typed rows with their catalog, in file order
   * @throws LoadException if the file cannot be read or has no header
   * @throws SchemaException if the content does not fit the expected schema
   */
  public RespondentTable read(Path path) throws LoadException {
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new LoadException("Survey file is missing or unreadable: " + path);
    }
    LOGGER.info("Reading survey file {}", path);

    try (CSVReader csvReader = openCsv(path)) {
      String[] header = readRecord(csvReader, path);
      if (header == null) {
        throw new LoadException("Survey file has no header: " + path);
      }
      ColumnCatalog catalog = toCatalog(header, path);
      int identifierIndex = catalog.indexOf(identifierColumn);

      List<Object[]> rows = new ArrayList<>();
      String[] record;
      while ((record = readRecord(csvReader, path)) != null) {
        if (record.length == 0 || record.length == 1 && record[0].trim().isEmpty()) {
          continue;
        }
        rows.add(toRow(record, catalog, identifierIndex, csvReader.getLinesRead(), path));
      }

      LOGGER.info("Loaded {} rows and {} columns from {}", rows.size(), catalog.size(), path);
      return new RespondentTable(catalog, rows);
    } catch (IOException e) {
      throw new LoadException("Error reading survey file " + path, e);
    }
  }

  private CSVReader openCsv(Path path) throws IOException {
    char fieldSeparator = path.getFileName().toString().endsWith(".tsv") ? '\t' : separator;
    Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    return new CSVReaderBuilder(reader)
        .withCSVParser(new CSVParserBuilder().withSeparator(fieldSeparator).build())
        .build();
  }

  private static String[] readRecord(CSVReader csvReader, Path path)
      throws IOException, LoadException {
    try {
      return csvReader.readNext();
    } catch (CsvValidationException e) {
      throw new LoadException("Malformed record in " + path + " at line " + e.getLineNumber(), e);
    }
  }

  private ColumnCatalog toCatalog(String[] header, Path path) throws LoadException {
    List<String> names = new ArrayList<>(header.length);
    for (int i = 0; i < header.length; i++) {
      String name = header[i].trim();
      if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
        name = name.substring(1).trim();
      }
      if (name.isEmpty()) {
        throw new LoadException("Blank column name at position " + (i + 1) + " in " + path);
      }
      names.add(name);
    }
    if (!names.contains(identifierColumn)) {
      throw new SchemaException("Identifier column '" + identifierColumn
          + "' is absent from " + path);
    }
    try {
      return ColumnCatalog.of(names, identifierColumn);
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Invalid header in " + path + ": " + e.getMessage(), e);
    }
  }

  private static Object[] toRow(String[] record, ColumnCatalog catalog, int identifierIndex,
      long line, Path path) throws SchemaException {
    if (record.length != catalog.size()) {
      throw new SchemaException(String.format("Line %d of %s has %d fields, expected %d: %s",
          line, path, record.length, catalog.size(), Arrays.toString(record)));
    }
    Object[] row = new Object[record.length];
    for (int i = 0; i < record.length; i++) {
      String value = record[i].trim();
      if (i == identifierIndex) {
        row[i] = value;
        continue;
      }
      Double number = parseDecimal(value);
      if (number == null) {
        throw new SchemaException(String.format("Line %d of %s: column '%s' is not numeric: '%s'",
            line, path, catalog.getNames().get(i), value));
      }
      row[i] = number;
    }
    return row;
  }

  /**
   * Parses a plain decimal such as {@code 480}, {@code -1} or {@code 4.5e2}.
   * Returns null for anything else, including NaN, infinities, values that
   * overflow a double, hexadecimal and Java type suffixes.
   */
  static @Nullable Double parseDecimal(String value) {
    if (!PLAIN_DECIMAL.matcher(value).matches()) {
      return null;
    }
    double number = Double.parseDouble(value);
    return Double.isFinite(number) ? number : null;
  }
}
