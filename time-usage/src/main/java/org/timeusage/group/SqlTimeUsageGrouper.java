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

import org.timeusage.AggregationException;
import org.timeusage.summary.SummaryRecord;

import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.impl.AbstractSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Groups summaries with a plain SQL query run by Calcite.
 *
 * <p>The summaries are registered as table {@code "timeusage"."summary"} on a
 * fresh {@code jdbc:calcite:} connection, which is closed once the result has
 * been read. The query is the declarative form of
 * {@link EnumerableTimeUsageGrouper} and returns the same rows.
 */
public class SqlTimeUsageGrouper implements TimeUsageGrouper {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqlTimeUsageGrouper.class);

  public static final String SCHEMA_NAME = "timeusage";
  public static final String TABLE_NAME = "summary";

  private static final String JDBC_URL = "jdbc:calcite:";

  @Override public List<GroupAggregate> groupAverage(List<SummaryRecord> summaries)
      throws AggregationException {
    String sql = groupedQuery(SCHEMA_NAME, TABLE_NAME);
    LOGGER.debug("Grouping {} summaries with query: {}", summaries.size(), sql);

    Properties info = new Properties();
    info.setProperty("caseSensitive", "true");
    try (Connection connection = DriverManager.getConnection(JDBC_URL, info)) {
      CalciteConnection calciteConnection = connection.unwrap(CalciteConnection.class);
      SchemaPlus rootSchema = calciteConnection.getRootSchema();
      SchemaPlus schema = rootSchema.add(SCHEMA_NAME, new AbstractSchema());
      schema.add(TABLE_NAME, new SummaryTable(summaries));

      List<GroupAggregate> aggregates = new ArrayList<>();
      try (Statement statement = connection.createStatement();
           ResultSet resultSet = statement.executeQuery(sql)) {
        while (resultSet.next()) {
          GroupKey key = new GroupKey(
              resultSet.getString(1),
              resultSet.getString(2),
              resultSet.getString(3));
          aggregates.add(
              new GroupAggregate(key,
                  resultSet.getDouble(4),
                  resultSet.getDouble(5),
                  resultSet.getDouble(6)));
        }
      }
      LOGGER.debug("Query returned {} groups", aggregates.size());
      return aggregates;
    } catch (SQLException e) {
      throw new AggregationException("Grouping query failed: " + e.getMessage(), e);
    }
  }

  /**
   * Returns the SQL query equivalent to {@link EnumerableTimeUsageGrouper}.
   *
   * @param schemaName Schema holding the summaries
   * @param tableName Table or view of summary records
   */
  public static String groupedQuery(String schemaName, String tableName) {
    return "SELECT \"working\", \"sex\", \"age\",\n"
        + "  ROUND(AVG(\"primaryNeeds\"), 1) AS \"primaryNeeds\",\n"
        + "  ROUND(AVG(\"work\"), 1) AS \"work\",\n"
        + "  ROUND(AVG(\"other\"), 1) AS \"other\"\n"
        + "FROM \"" + schemaName + "\".\"" + tableName + "\"\n"
        + "GROUP BY \"working\", \"sex\", \"age\"\n"
        + "ORDER BY \"working\", \"sex\", \"age\"";
  }
}
