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
package org.timeusage.summary;

import org.timeusage.SchemaException;
import org.timeusage.classify.ClassifiedColumns;
import org.timeusage.format.csv.ColumnCatalog;
import org.timeusage.format.csv.ColumnType;
import org.timeusage.format.csv.RespondentTable;

import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.linq4j.function.Function1;
import org.apache.calcite.linq4j.function.Predicate1;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Projects each eligible respondent onto a {@link SummaryRecord}.
 *
 * <p>The record has the following columns:
 * <ul>
 *   <li>working: "working" if 1 &lt;= employment code &lt; 3, else "not working"</li>
 *   <li>sex: "male" if the sex code is 1, else "female"</li>
 *   <li>age: "young" for 15 to 22, "active" for 23 to 55, else "elder"</li>
 *   <li>primaryNeeds: sum of the primary needs columns, in hours</li>
 *   <li>work: sum of the work columns, in hours, rounded to a whole hour</li>
 *   <li>other: sum of the other columns, in hours, rounded to a whole hour</li>
 * </ul>
 *
 * <p>Respondents whose employment code is above 4 are outside the labor force
 * universe and are dropped. The survey documents only code 5 as "not in labor
 * force"; codes above 5 are dropped as well.
 */
public class TimeUsageSummarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeUsageSummarizer.class);

  /** Highest employment code that is kept. */
  public static final double MAX_ELIGIBLE_EMPLOYMENT_CODE = 4;

  private static final double NOT_IN_LABOR_FORCE = 5;

  private final String employmentColumn;
  private final String sexColumn;
  private final String ageColumn;

  /**
   * Creates a summarizer.
   *
   * @param employmentColumn Column holding the labor force status code
   * @param sexColumn Column holding the sex code
   * @param ageColumn Column holding the age in years
   */
  public TimeUsageSummarizer(String employmentColumn, String sexColumn, String ageColumn) {
    this.employmentColumn = employmentColumn;
    this.sexColumn = sexColumn;
    this.ageColumn = ageColumn;
  }

  /**
   * Summarizes the respondents of a table.
   *
   * @param columns Activity columns of {@code table}, classified
   * @param table Loaded survey rows
   * @return One record per eligible respondent, in table order
   * @throws SchemaException if a control or activity column is absent or not numeric
   */
  public List<SummaryRecord> summarize(ClassifiedColumns columns, RespondentTable table)
      throws SchemaException {
    ColumnCatalog catalog = table.getCatalog();
    final int employmentIndex = controlIndex(catalog, employmentColumn);
    final int sexIndex = controlIndex(catalog, sexColumn);
    final int ageIndex = controlIndex(catalog, ageColumn);
    final int[] primaryNeedsIndexes = activityIndexes(catalog, columns.getPrimaryNeeds());
    final int[] workIndexes = activityIndexes(catalog, columns.getWork());
    final int[] otherIndexes = activityIndexes(catalog, columns.getOther());

    Predicate1<Object[]> eligible = row ->
        RespondentTable.numericValue(row, employmentIndex) <= MAX_ELIGIBLE_EMPLOYMENT_CODE;

    Function1<Object[], SummaryRecord> projection = row -> new SummaryRecord(
        EmploymentStatus.fromCode(RespondentTable.numericValue(row, employmentIndex)).getLabel(),
        Sex.fromCode(RespondentTable.numericValue(row, sexIndex)).getLabel(),
        AgeGroup.fromAge(RespondentTable.numericValue(row, ageIndex)).getLabel(),
        HourMath.toHours(sumMinutes(row, primaryNeedsIndexes)),
        HourMath.round(HourMath.toHours(sumMinutes(row, workIndexes))),
        HourMath.round(HourMath.toHours(sumMinutes(row, otherIndexes))));

    List<SummaryRecord> summaries = Linq4j.asEnumerable(table.getRows())
        .where(eligible)
        .select(projection)
        .toList();

    logExcluded(table, employmentIndex, summaries.size());
    return summaries;
  }

  private static double sumMinutes(Object[] row, int[] indexes) {
    double minutes = 0;
    for (int index : indexes) {
      minutes += RespondentTable.numericValue(row, index);
    }
    return minutes;
  }

  private static int controlIndex(ColumnCatalog catalog, String name) throws SchemaException {
    if (!catalog.contains(name)) {
      throw new SchemaException("Control column '" + name + "' is absent");
    }
    if (catalog.typeOf(name) != ColumnType.NUMERIC) {
      throw new SchemaException("Control column '" + name + "' is not numeric");
    }
    return catalog.indexOf(name);
  }

  private static int[] activityIndexes(ColumnCatalog catalog, List<String> names)
      throws SchemaException {
    int[] indexes = new int[names.size()];
    for (int i = 0; i < indexes.length; i++) {
      String name = names.get(i);
      if (!catalog.contains(name) || catalog.typeOf(name) != ColumnType.NUMERIC) {
        throw new SchemaException("Activity column '" + name + "' is absent or not numeric");
      }
      indexes[i] = catalog.indexOf(name);
    }
    return indexes;
  }

  private void logExcluded(RespondentTable table, int employmentIndex, int kept) {
    int excluded = table.getRowCount() - kept;
    LOGGER.info("Summarized {} respondents, excluded {} with {} above {}",
        kept, excluded, employmentColumn, (int) MAX_ELIGIBLE_EMPLOYMENT_CODE);
    if (excluded == 0) {
      return;
    }
    long beyondLaborForce = Linq4j.asEnumerable(table.getRows())
        .where(row -> RespondentTable.numericValue(row, employmentIndex) > NOT_IN_LABOR_FORCE)
        .count();
    if (beyondLaborForce > 0) {
      LOGGER.warn("{} respondents have {} above {}; they are excluded with the"
          + " not-in-labor-force respondents", beyondLaborForce, employmentColumn,
          (int) NOT_IN_LABOR_FORCE);
    }
  }
}
