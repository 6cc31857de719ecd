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

import java.util.List;

/**
 * Averages summary records per {@link GroupKey}.
 *
 * <p>For each key present in the input, the result holds the mean of
 * {@code primaryNeeds}, {@code work} and {@code other} over the records with
 * that key, rounded half-up to one decimal digit. The result is sorted by key.
 * Every implementation returns the same list for the same input.
 */
public interface TimeUsageGrouper {

  /**
   * Groups and averages summary records.
   *
   * @param summaries Records to aggregate
   * @return One aggregate per key present in {@code summaries}, sorted by key
   * @throws AggregationException if the engine fails
   */
  List<GroupAggregate> groupAverage(List<SummaryRecord> summaries) throws AggregationException;
}
