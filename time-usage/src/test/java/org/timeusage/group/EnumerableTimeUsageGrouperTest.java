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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for EnumerableTimeUsageGrouper.
 */
@Tag("unit")
public class EnumerableTimeUsageGrouperTest {

  private final TimeUsageGrouper grouper = new EnumerableTimeUsageGrouper();

  @Test void testAverageIsRoundedToOneDecimal() throws Exception {
    List<SummaryRecord> summaries = Arrays.asList(
        new SummaryRecord("working", "male", "active", 10.0, 8.0, 5.0),
        new SummaryRecord("working", "male", "active", 8.0, 7.0, 7.0));

    List<GroupAggregate> aggregates = grouper.groupAverage(summaries);

    assertEquals(1, aggregates.size());
    assertEquals(new GroupAggregate(new GroupKey("working", "male", "active"), 9.0, 7.5, 6.0),
        aggregates.get(0));
  }

  @Test void testRoundingHalfUp() throws Exception {
    List<SummaryRecord> summaries = Arrays.asList(
        new SummaryRecord("not working", "male", "young", 9.25, 1.0, 2.0),
        new SummaryRecord("working", "female", "elder", 1.0, 1.0, 1.0),
        new SummaryRecord("working", "female", "elder", 1.0, 1.0, 1.0),
        new SummaryRecord("working", "female", "elder", 2.0, 1.0, 0.0));

    List<GroupAggregate> aggregates = grouper.groupAverage(summaries);

    assertEquals(9.3, aggregates.get(0).getPrimaryNeeds());
    assertEquals(1.3, aggregates.get(1).getPrimaryNeeds());
    assertEquals(0.7, aggregates.get(1).getOther());
  }

  @Test void testGroupsAreSortedByKey() throws Exception {
    List<SummaryRecord> summaries = Arrays.asList(
        new SummaryRecord("working", "male", "young", 1.0, 1.0, 1.0),
        new SummaryRecord("not working", "male", "elder", 1.0, 1.0, 1.0),
        new SummaryRecord("working", "female", "active", 1.0, 1.0, 1.0),
        new SummaryRecord("not working", "female", "young", 1.0, 1.0, 1.0),
        new SummaryRecord("working", "male", "active", 1.0, 1.0, 1.0));

    List<GroupAggregate> aggregates = grouper.groupAverage(summaries);

    List<GroupKey> keys = new ArrayList<GroupKey>();
    for (GroupAggregate aggregate : aggregates) {
      keys.add(aggregate.getKey());
    }
    assertEquals(Arrays.asList(
        new GroupKey("not working", "female", "young"),
        new GroupKey("not working", "male", "elder"),
        new GroupKey("working", "female", "active"),
        new GroupKey("working", "male", "active"),
        new GroupKey("working", "male", "young")), keys);
  }

  @Test void testOneRowPerPresentKey() throws Exception {
    List<SummaryRecord> summaries = new ArrayList<SummaryRecord>();
    List<GroupKey> keys = GroupKey.allKeys();
    for (int i = 0; i < 120; i++) {
      GroupKey key = keys.get(i % 5);
      summaries.add(new SummaryRecord(key.getWorking(), key.getSex(), key.getAge(),
          i % 24, i % 9, i % 7));
    }

    List<GroupAggregate> aggregates = grouper.groupAverage(summaries);

    assertEquals(5, aggregates.size());
    for (GroupAggregate aggregate : aggregates) {
      assertTrue(aggregate.getPrimaryNeeds() >= 0 && aggregate.getPrimaryNeeds() <= 23);
    }
  }

  @Test void testEmptyInput() throws Exception {
    assertEquals(Collections.emptyList(),
        grouper.groupAverage(Collections.<SummaryRecord>emptyList()));
  }

  @Test void testIdempotent() throws Exception {
    List<SummaryRecord> summaries = Arrays.asList(
        new SummaryRecord("working", "male", "active", 10.0, 8.0, 5.0),
        new SummaryRecord("not working", "female", "young", 11.5, 0.0, 10.0),
        new SummaryRecord("working", "male", "active", 8.0, 7.0, 7.0));

    assertEquals(grouper.groupAverage(summaries), grouper.groupAverage(summaries));
  }
}
