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
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered column names of a survey file together with their loaded types.
 *
 * <p>Exactly one column, the identifier, is {@link ColumnType#TEXT}; every
 * other column is {@link ColumnType#NUMERIC}.
 */
public final class ColumnCatalog {

  private final ImmutableList<String> names;
  private final ImmutableMap<String, Integer> indexes;
  private final String identifierColumn;

  private ColumnCatalog(ImmutableList<String> names, String identifierColumn) {
    this.names = names;
    this.identifierColumn = identifierColumn;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < names.size(); i++) {
      builder.put(names.get(i), i);
    }
    this.indexes = builder.buildOrThrow();
  }

  /**
   * Creates a catalog from header names.
   *
   * @param names Column names in file order; must be unique
   * @param identifierColumn Name of the text-typed identifier column; must be
   *     one of {@code names}
   * @throws IllegalArgumentException if a name repeats or the identifier is
   *     absent
   */
  public static ColumnCatalog of(List<String> names, String identifierColumn) {
    Objects.requireNonNull(identifierColumn, "identifierColumn");
    ImmutableList<String> copy = ImmutableList.copyOf(names);
    if (!copy.contains(identifierColumn)) {
      throw new IllegalArgumentException("Identifier column '" + identifierColumn
          + "' is not in " + copy);
    }
    if (copy.stream().distinct().count() != copy.size()) {
      throw new IllegalArgumentException("Duplicate column names in " + copy);
    }
    return new ColumnCatalog(copy, identifierColumn);
  }

  /** Returns the column names in file order. */
  public List<String> getNames() {
    return names;
  }

  public String getIdentifierColumn() {
    return identifierColumn;
  }

  public int size() {
    return names.size();
  }

  public boolean contains(String name) {
    return indexes.containsKey(name);
  }

  /**
   * Returns the position of a column.
   *
   * @throws IllegalArgumentException if the column does not exist
   */
  public int indexOf(String name) {
    Integer index = indexes.get(name);
    if (index == null) {
      throw new IllegalArgumentException("Unknown column: " + name);
    }
    return index;
  }

  public ColumnType typeOf(String name) {
    indexOf(name);
    return identifierColumn.equals(name) ? ColumnType.TEXT : ColumnType.NUMERIC;
  }

  /** Returns every column mapped to its type, in file order. */
  public Map<String, ColumnType> getTypes() {
    ImmutableMap.Builder<String, ColumnType> builder = ImmutableMap.builder();
    for (String name : names) {
      builder.put(name, typeOf(name));
    }
    return builder.buildOrThrow();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnCatalog)) {
      return false;
    }
    ColumnCatalog that = (ColumnCatalog) o;
    return names.equals(that.names) && identifierColumn.equals(that.identifierColumn);
  }

  @Override public int hashCode() {
    return Objects.hash(names, identifierColumn);
  }

  @Override public String toString() {
    return "ColumnCatalog{" + names.size() + " columns, identifier=" + identifierColumn + "}";
  }
}
