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

import java.util.Objects;

/**
 * Average daily hours per activity bucket of all respondents sharing a
 * {@link GroupKey}, each rounded to one decimal digit.
 */
public final class GroupAggregate {

  private final GroupKey key;
  private final double primaryNeeds;
  private final double work;
  private final double other;

  public GroupAggregate(GroupKey key, double primaryNeeds, double work, double other) {
    this.key = Objects.requireNonNull(key, "key");
    this.primaryNeeds = primaryNeeds;
    this.work = work;
    this.other = other;
  }

  public GroupKey getKey() {
    return key;
  }

  public String getWorking() {
    return key.getWorking();
  }

  public String getSex() {
    return key.getSex();
  }

  public String getAge() {
    return key.getAge();
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

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupAggregate)) {
      return false;
    }
    GroupAggregate that = (GroupAggregate) o;
    return key.equals(that.key)
        && Double.compare(that.primaryNeeds, primaryNeeds) == 0
        && Double.compare(that.work, work) == 0
        && Double.compare(that.other, other) == 0;
  }

  @Override public int hashCode() {
    return Objects.hash(key, primaryNeeds, work, other);
  }

  @Override public String toString() {
    return "GroupAggregate{" + key
        + ", primaryNeeds=" + primaryNeeds
        + ", work=" + work
        + ", other=" + other + "}";
  }
}
