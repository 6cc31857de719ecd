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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Typed survey rows as loaded from a file.
 *
 * <p>Each row is an {@code Object[]} laid out like the {@link ColumnCatalog}:
 * a {@link String} at the identifier position and a {@link Double} at every
 * other position. Rows keep the order of the source file.
 */
public final class RespondentTable {

  private final ColumnCatalog catalog;
  private final ImmutableList<Object[]> rows;

  public RespondentTable(ColumnCatalog catalog, List<Object[]> rows) {
    this.catalog = catalog;
    this.rows = ImmutableList.copyOf(rows);
  }

  public ColumnCatalog getCatalog() {
    return catalog;
  }

  /** Returns the column names in file order. */
  public List<String> getColumnNames() {
    return catalog.getNames();
  }

  public List<Object[]> getRows() {
    return rows;
  }

  public int getRowCount() {
    return rows.size();
  }

  /**
   * Returns the numeric value of a cell.
   *
   * @param row A row of this table
   * @param columnIndex Position of a numeric column
   */
  public static double numericValue(Object[] row, int columnIndex) {
    return (Double) row[columnIndex];
  }

  @Override public String toString() {
    return "RespondentTable{" + catalog + ", rows=" + rows.size() + "}";
  }
}
