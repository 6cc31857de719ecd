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

import com.google.common.collect.ImmutableList;

/**
 * Semantic groups that activity columns are classified into, with the
 * activity code prefixes that select them.
 *
 * <p>Activity columns are named {@code t} followed by the six digit ATUS
 * activity code, e.g. {@code t010101} for sleeping or {@code t110101} for
 * eating and drinking.
 *
 * <p>The prefixes overlap: {@code t18} also matches {@code t1801},
 * {@code t1803} and {@code t1805}. Classification does not apply the
 * {@link #OTHER} prefixes literally; a column already matched by
 * {@link #PRIMARY_NEEDS} or {@link #WORK} is never "other", so every activity
 * column counts in exactly one bucket. In particular travel related to work
 * ({@code t1805}) counts as work only, not as work and other.
 *
 * @see <a href="https://www.kaggle.com/bls/american-time-use-survey">American Time Use Survey</a>
 */
public enum ActivityBucket {
  /** Sleeping, personal care, eating and the travel related to them. */
  PRIMARY_NEEDS("primaryNeeds", "t01", "t03", "t11", "t1801", "t1803"),
  /** Working and work related travel. */
  WORK("work", "t05", "t1805"),
  /** Leisure and everything else; see {@link ColumnClassifier#isOther}. */
  OTHER("other", "t02", "t04", "t06", "t07", "t08", "t09", "t10", "t12", "t13", "t14",
      "t15", "t16", "t18");

  private final String columnName;
  private final ImmutableList<String> prefixes;

  ActivityBucket(String columnName, String... prefixes) {
    this.columnName = columnName;
    this.prefixes = ImmutableList.copyOf(prefixes);
  }

  /** Returns the name of the summary column holding this bucket's hours. */
  public String getColumnName() {
    return columnName;
  }

  /** Returns whether the column name starts with one of this bucket's prefixes. */
  public boolean matchesPrefix(String name) {
    for (String prefix : prefixes) {
      if (name.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
