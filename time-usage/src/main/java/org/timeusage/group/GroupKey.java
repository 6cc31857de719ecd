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

import org.timeusage.summary.AgeGroup;
import org.timeusage.summary.EmploymentStatus;
import org.timeusage.summary.Sex;
import org.timeusage.summary.SummaryRecord;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Working status, sex and age group of a respondent; the key summaries are
 * averaged by.
 *
 * <p>Keys order lexicographically by working status, then sex, then age.
 */
public final class GroupKey implements Comparable<GroupKey> {

  private static final Comparator<GroupKey> ORDER =
      Comparator.comparing(GroupKey::getWorking)
          .thenComparing(GroupKey::getSex)
          .thenComparing(GroupKey::getAge);

  private final String working;
  private final String sex;
  private final String age;

  public GroupKey(String working, String sex, String age) {
    this.working = Objects.requireNonNull(working, "working");
    this.sex = Objects.requireNonNull(sex, "sex");
    this.age = Objects.requireNonNull(age, "age");
  }

  /** Returns the key of a summary record. */
  public static GroupKey of(SummaryRecord record) {
    return new GroupKey(record.getWorking(), record.getSex(), record.getAge());
  }

  /** Returns every key a respondent can have, in key order. */
  public static List<GroupKey> allKeys() {
    List<GroupKey> keys = new ArrayList<>();
    for (EmploymentStatus working : EmploymentStatus.values()) {
      for (Sex sex : Sex.values()) {
        for (AgeGroup age : AgeGroup.values()) {
          keys.add(new GroupKey(working.getLabel(), sex.getLabel(), age.getLabel()));
        }
      }
    }
    Collections.sort(keys);
    return ImmutableList.copyOf(keys);
  }

  public String getWorking() {
    return working;
  }

  public String getSex() {
    return sex;
  }

  public String getAge() {
    return age;
  }

  @Override public int compareTo(GroupKey other) {
    return ORDER.compare(this, other);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    GroupKey that = (GroupKey) o;
    return working.equals(that.working) && sex.equals(that.sex) && age.equals(that.age);
  }

  @Override public int hashCode() {
    return Objects.hash(working, sex, age);
  }

  @Override public String toString() {
    return "(" + working + ", " + sex + ", " + age + ")";
  }
}
