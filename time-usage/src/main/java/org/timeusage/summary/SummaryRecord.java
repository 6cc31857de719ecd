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
package org.timeusage.summary;

import java.util.Objects;

/**
 * Hours one eligible respondent spent on each kind of activity, with the
 * respondent's working status, sex and age group.
 *
 * <p>{@code primaryNeeds} keeps full precision; {@code work} and
 * {@code other} are whole hours.
 */
public final class SummaryRecord {

  private final String working;
  private final String sex;
  private final String age;
  private final double primaryNeeds;
  private final double work;
  private final double other;

  /**
   * Creates a summary record.
   *
   * @param working Working status, "working" or "not working"
   * @param sex Sex, "male" or "female"
   * @param age Age group, "young", "active" or "elder"
   * @param primaryNeeds Daily hours spent on primary needs
   * @param work Daily hours spent working
   * @param other Daily hours spent on other activities
   */
  public SummaryRecord(String working, String sex, String age, double primaryNeeds,
      double work, double other) {
    this.working = Objects.requireNonNull(working, "working");
    this.sex = Objects.requireNonNull(sex, "sex");
    this.age = Objects.requireNonNull(age, "age");
    this.primaryNeeds = primaryNeeds;
    this.work = work;
    this.other = other;
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

  public double getPrimaryNeeds() {
    return primaryNeeds;
  }

  public double getWork() {
    return work;
  }

  public double getOther() {
    return other;
  }

  /** Returns the values in column order, as exposed to SQL. */
  public Object[] toRow() {
    return new Object[] {working, sex, age, primaryNeeds, work, other};
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SummaryRecord)) {
      return false;
    }
    SummaryRecord that = (SummaryRecord) o;
    return Double.compare(that.primaryNeeds, primaryNeeds) == 0
        && Double.compare(that.work, work) == 0
        && Double.compare(that.other, other) == 0
        && working.equals(that.working)
        && sex.equals(that.sex)
        && age.equals(that.age);
  }

  @Override public int hashCode() {
    return Objects.hash(working, sex, age, primaryNeeds, work, other);
  }

  @Override public String toString() {
    return "SummaryRecord{" + working + ", " + sex + ", " + age
        + ", primaryNeeds=" + primaryNeeds
        + ", work=" + work
        + ", other=" + other + "}";
  }
}
