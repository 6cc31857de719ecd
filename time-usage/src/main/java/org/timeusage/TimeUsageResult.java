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
import org.timeusage.group.GroupAggregate;
import org.timeusage.group.GroupKey;
import org.timeusage.group.GroupingEngine;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Outcome of a completed {@link TimeUsagePipeline} run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TimeUsageResult result = pipeline.execute();
 * for (GroupAggregate aggregate : result.getAggregates()) {
 *   System.out.println(aggregate);
 * }
 * for (GroupKey key : result.getMissingGroups()) {
 *   System.err.println("No respondents in " + key);
 * }
 * }</pre>
 */
public class TimeUsageResult {

  private final List<GroupAggregate> aggregates;
  private final ClassifiedColumns classifiedColumns;
  private final int respondentCount;
  private final int eligibleCount;
  private final GroupingEngine engine;
  private final long elapsedMs;
  private final List<GroupKey> missingGroups;

  private TimeUsageResult(Builder builder) {
    this.aggregates = ImmutableList.copyOf(builder.aggregates);
    this.classifiedColumns = builder.classifiedColumns;
    this.respondentCount = builder.respondentCount;
    this.eligibleCount = builder.eligibleCount;
    this.engine = builder.engine;
    this.elapsedMs = builder.elapsedMs;
    this.missingGroups = ImmutableList.copyOf(builder.missingGroups);
  }

  /** Returns the grouped averages, sorted by group key. */
  public List<GroupAggregate> getAggregates() {
    return aggregates;
  }

  public ClassifiedColumns getClassifiedColumns() {
    return classifiedColumns;
  }

  /** Returns the number of rows in the survey file. */
  public int getRespondentCount() {
    return respondentCount;
  }

  /** Returns the number of respondents that passed the labor force filter. */
  public int getEligibleCount() {
    return eligibleCount;
  }

  public GroupingEngine getEngine() {
    return engine;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns the group keys no eligible respondent has. They are absent from
   * {@link #getAggregates()}; this is not an error.
   */
  public List<GroupKey> getMissingGroups() {
    return missingGroups;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "TimeUsageResult{groups=" + aggregates.size()
        + ", respondents=" + respondentCount
        + ", eligible=" + eligibleCount
        + ", engine=" + engine
        + ", missingGroups=" + missingGroups.size()
        + ", elapsedMs=" + elapsedMs + "}";
  }

  /**
   * Builder for TimeUsageResult.
   */
  public static class Builder {
    private List<GroupAggregate> aggregates = ImmutableList.of();
    private ClassifiedColumns classifiedColumns;
    private int respondentCount;
    private int eligibleCount;
    private GroupingEngine engine;
    private long elapsedMs;
    private List<GroupKey> missingGroups = ImmutableList.of();

    public Builder aggregates(List<GroupAggregate> aggregates) {
      this.aggregates = aggregates;
      return this;
    }

    public Builder classifiedColumns(ClassifiedColumns classifiedColumns) {
      this.classifiedColumns = classifiedColumns;
      return this;
    }

    public Builder respondentCount(int respondentCount) {
      this.respondentCount = respondentCount;
      return this;
    }

    public Builder eligibleCount(int eligibleCount) {
      this.eligibleCount = eligibleCount;
      return this;
    }

    public Builder engine(GroupingEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public Builder missingGroups(List<GroupKey> missingGroups) {
      this.missingGroups = missingGroups;
      return this;
    }

    public TimeUsageResult build() {
      return new TimeUsageResult(this);
    }
  }
}
