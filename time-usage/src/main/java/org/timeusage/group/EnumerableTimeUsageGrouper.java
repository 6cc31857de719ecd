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

import org.timeusage.summary.HourMath;
import org.timeusage.summary.SummaryRecord;

import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.linq4j.function.Function0;
import org.apache.calcite.linq4j.function.Function1;
import org.apache.calcite.linq4j.function.Function2;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Groups summaries with a linq4j accumulator, row by row.
 *
 * <p>Each group keeps running sums and a count; the means are taken and
 * rounded once the input is exhausted, then the groups are sorted by key.
 */
public class EnumerableTimeUsageGrouper implements TimeUsageGrouper {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnumerableTimeUsageGrouper.class);

  private static final int SCALE = 1;

  @Override public List<GroupAggregate> groupAverage(List<SummaryRecord> summaries) {
    Function1<SummaryRecord, GroupKey> keySelector = GroupKey::of;
    Function0<HoursAccumulator> accumulatorInitializer = HoursAccumulator::new;
    Function2<HoursAccumulator, SummaryRecord, HoursAccumulator> accumulatorAdder =
        HoursAccumulator::add;
    Function2<GroupKey, HoursAccumulator, GroupAggregate> resultSelector =
        (key, accumulator) -> accumulator.toAggregate(key);
    Function1<GroupAggregate, GroupKey> orderKey = GroupAggregate::getKey;

    List<GroupAggregate> aggregates = Linq4j.asEnumerable(summaries)
        .groupBy(keySelector, accumulatorInitializer, accumulatorAdder, resultSelector)
        .orderBy(orderKey)
        .toList();
    LOGGER.debug("Grouped {} summaries into {} groups", summaries.size(), aggregates.size());
    return aggregates;
  }

  /** Running totals of one group. */
  private static class HoursAccumulator {
    private long count;
    private double primaryNeeds;
    private double work;
    private double other;

    HoursAccumulator add(SummaryRecord record) {
      count++;
      primaryNeeds += record.getPrimaryNeeds();
      work += record.getWork();
      other += record.getOther();
      return this;
    }

    GroupAggregate toAggregate(GroupKey key) {
      return new GroupAggregate(key,
          HourMath.round(primaryNeeds / count, SCALE),
          HourMath.round(work / count, SCALE),
          HourMath.round(other / count, SCALE));
    }
  }
}
