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
package org.timeusage.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions survey column names into primary needs, work and other
 * activities.
 *
 * <ol>
 *   <li>Primary needs (sleeping, eating, ...): columns starting with
 *   {@code t01}, {@code t03}, {@code t11}, {@code t1801} and {@code t1803}.</li>
 *   <li>Work: columns starting with {@code t05} and {@code t1805}.</li>
 *   <li>Other (leisure): columns starting with {@code t02}, {@code t04},
 *   {@code t06} to {@code t10}, {@code t12} to {@code t16} and {@code t18},
 *   when they are in neither of the previous groups.</li>
 * </ol>
 *
 * <p>Columns matching no rule, such as the respondent identifier or the
 * demographic codes, are left out of every group.
 */
public final class ColumnClassifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(ColumnClassifier.class);

  private ColumnClassifier() {
  }

  /**
   * Classifies column names.
   *
   * @param columnNames Column names in header order
   * @return The three disjoint groups, each in header order
   */
  public static ClassifiedColumns classify(List<String> columnNames) {
    List<String> primaryNeeds = new ArrayList<>();
    List<String> work = new ArrayList<>();
    List<String> other = new ArrayList<>();
    for (String name : columnNames) {
      if (isPrimaryNeeds(name)) {
        primaryNeeds.add(name);
      } else if (isWorking(name)) {
        work.add(name);
      } else if (isOther(name)) {
        other.add(name);
      } else {
        LOGGER.debug("Column '{}' is not an activity column; ignored", name);
      }
    }
    ClassifiedColumns classified = new ClassifiedColumns(primaryNeeds, work, other);
    LOGGER.debug("Classified {} of {} columns: {}", classified.size(), columnNames.size(),
        classified);
    return classified;
  }

  public static boolean isPrimaryNeeds(String name) {
    return ActivityBucket.PRIMARY_NEEDS.matchesPrefix(name);
  }

  public static boolean isWorking(String name) {
    return ActivityBucket.WORK.matchesPrefix(name);
  }

  /**
   * Returns whether a column holds an "other" activity.
   *
   * <p>The {@code t18} prefix also covers {@code t1801}, {@code t1803} and
   * {@code t1805}; those stay in primary needs and work.
   */
  public static boolean isOther(String name) {
    return ActivityBucket.OTHER.matchesPrefix(name)
        && !isPrimaryNeeds(name)
        && !isWorking(name);
  }
}
