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

import java.util.Locale;

/**
 * Available {@link TimeUsageGrouper} implementations.
 */
public enum GroupingEngine {
  /** linq4j grouped aggregation over the in-memory records. */
  ENUMERABLE {
    @Override public TimeUsageGrouper createGrouper() {
      return new EnumerableTimeUsageGrouper();
    }
  },
  /** A SQL query run by Calcite's JDBC driver. */
  SQL {
    @Override public TimeUsageGrouper createGrouper() {
      return new SqlTimeUsageGrouper();
    }
  };

  public abstract TimeUsageGrouper createGrouper();

  /**
   * Looks up an engine by name, ignoring case.
   *
   * @throws IllegalArgumentException if no engine has that name
   */
  public static GroupingEngine fromName(String name) {
    for (GroupingEngine engine : values()) {
      if (engine.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
        return engine;
      }
    }
    throw new IllegalArgumentException("Unknown grouping engine: " + name);
  }
}
