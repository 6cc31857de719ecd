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

import org.timeusage.classify.ClassifiedColumns;
import org.timeusage.classify.ColumnClassifier;
import org.timeusage.config.TimeUsageConfig;
import org.timeusage.format.csv.CsvTimeUsageReader;
import org.timeusage.format.csv.RespondentTable;
import org.timeusage.group.GroupAggregate;
import org.timeusage.group.GroupKey;
import org.timeusage.group.TimeUsageGrouper;
import org.timeusage.summary.SummaryRecord;
import org.timeusage.summary.TimeUsageSummarizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the time usage stages in order.
 *
 * <ol>
 *   <li>Load - read the survey file into typed rows</li>
 *   <li>Classify - split activity columns into primary needs, work and other</li>
 *   <li>Summarize - hours per bucket and demographic labels per respondent</li>
 *   <li>Group - average hours per working status, sex and age</li>
 * </ol>
 *
 * <p>Each stage consumes the whole output of the previous one. A failure in
 * any stage aborts the run; nothing is reported for a failed run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TimeUsageConfig config = TimeUsageConfig.builder()
 *     .input("atussum.csv")
 *     .engine(GroupingEngine.SQL)
 *     .build();
 * TimeUsageResult result = new TimeUsagePipeline(config).execute();
 * }</pre>
 */
public class TimeUsagePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeUsagePipeline.class);

  private final TimeUsageConfig config;

  public TimeUsagePipeline(TimeUsageConfig config) {
    this.config = config;
  }

  /**
   * Executes the pipeline.
   *
   * @return Grouped averages and run statistics
   * @throws LoadException if the survey file cannot be loaded
   * @throws AggregationException if grouping fails
   */
  public TimeUsageResult execute() throws TimeUsageException {
    LOGGER.info("Starting time usage run: {}", config);
    long startTime = System.currentTimeMillis();

    LOGGER.info("Phase 1: Loading {}", config.getInput());
    CsvTimeUsageReader reader =
        new CsvTimeUsageReader(config.getIdentifierColumn(), config.getSeparator());
    RespondentTable table = reader.read(Paths.get(config.getInput()));

    LOGGER.info("Phase 2: Classifying {} columns", table.getCatalog().size());
    ClassifiedColumns columns = ColumnClassifier.classify(table.getColumnNames());
    LOGGER.info("Classified columns: {} primary needs, {} work, {} other",
        columns.getPrimaryNeeds().size(), columns.getWork().size(), columns.getOther().size());

    LOGGER.info("Phase 3: Summarizing {} respondents", table.getRowCount());
    TimeUsageSummarizer summarizer = new TimeUsageSummarizer(
        config.getEmploymentColumn(), config.getSexColumn(), config.getAgeColumn());
    List<SummaryRecord> summaries = summarizer.summarize(columns, table);

    LOGGER.info("Phase 4: Grouping {} summaries with the {} engine",
        summaries.size(), config.getEngine());
    TimeUsageGrouper grouper = config.getEngine().createGrouper();
    List<GroupAggregate> aggregates = grouper.groupAverage(summaries);
    List<GroupKey> missingGroups = findMissingGroups(aggregates);

    long elapsedMs = System.currentTimeMillis() - startTime;
    LOGGER.info("Time usage run complete: {} groups in {}ms", aggregates.size(), elapsedMs);

    return TimeUsageResult.builder()
        .aggregates(aggregates)
        .classifiedColumns(columns)
        .respondentCount(table.getRowCount())
        .eligibleCount(summaries.size())
        .engine(config.getEngine())
        .elapsedMs(elapsedMs)
        .missingGroups(missingGroups)
        .build();
  }

  /**
   * Returns the possible group keys absent from the aggregates, logging each.
   */
  static List<GroupKey> findMissingGroups(List<GroupAggregate> aggregates) {
    Set<GroupKey> present = new HashSet<>();
    for (GroupAggregate aggregate : aggregates) {
      present.add(aggregate.getKey());
    }
    List<GroupKey> missing = new ArrayList<>();
    for (GroupKey key : GroupKey.allKeys()) {
      if (!present.contains(key)) {
        LOGGER.warn("No eligible respondents in group {}", key);
        missing.add(key);
      }
    }
    return missing;
  }
}
