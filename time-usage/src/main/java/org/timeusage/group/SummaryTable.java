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
package org.timeusage.group;

import org.timeusage.summary.SummaryRecord;

import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.Statistic;
import org.apache.calcite.schema.Statistics;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary records exposed to Calcite as a scannable table.
 *
 * <p>Columns: {@code working}, {@code sex}, {@code age} (VARCHAR) and
 * {@code primaryNeeds}, {@code work}, {@code other} (DOUBLE).
 */
public class SummaryTable extends AbstractTable implements ScannableTable {

  private final ImmutableList<Object[]> rows;

  public SummaryTable(List<SummaryRecord> summaries) {
    List<Object[]> converted = new ArrayList<>(summaries.size());
    for (SummaryRecord summary : summaries) {
      converted.add(summary.toRow());
    }
    this.rows = ImmutableList.copyOf(converted);
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return typeFactory.builder()
        .add("working", SqlTypeName.VARCHAR)
        .add("sex", SqlTypeName.VARCHAR)
        .add("age", SqlTypeName.VARCHAR)
        .add("primaryNeeds", SqlTypeName.DOUBLE)
        .add("work", SqlTypeName.DOUBLE)
        .add("other", SqlTypeName.DOUBLE)
        .build();
  }

  @Override public Statistic getStatistic() {
    return Statistics.of(rows.size(), ImmutableList.of());
  }

  @Override public Enumerable<Object[]> scan(DataContext root) {
    return Linq4j.asEnumerable(rows);
  }
}
