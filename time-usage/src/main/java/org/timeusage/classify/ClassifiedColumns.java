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

import java.util.List;
import java.util.Objects;

/**
 * Activity column names partitioned into the three {@link ActivityBucket}s.
 *
 * <p>The three lists are disjoint and keep the order of the source header.
 */
public final class ClassifiedColumns {

  private final ImmutableList<String> primaryNeeds;
  private final ImmutableList<String> work;
  private final ImmutableList<String> other;

  public ClassifiedColumns(List<String> primaryNeeds, List<String> work, List<String> other) {
    this.primaryNeeds = ImmutableList.copyOf(primaryNeeds);
    this.work = ImmutableList.copyOf(work);
    this.other = ImmutableList.copyOf(other);
  }

  public List<String> getPrimaryNeeds() {
    return primaryNeeds;
  }

  public List<String> getWork() {
    return work;
  }

  public List<String> getOther() {
    return other;
  }

  /** Returns the columns of a bucket. */
  public List<String> get(ActivityBucket bucket) {
    switch (bucket) {
      case PRIMARY_NEEDS:
        return primaryNeeds;
      case WORK:
        return work;
      case OTHER:
        return other;
      default:
        throw new AssertionError("unknown bucket " + bucket);
    }
  }

  /** Returns the number of columns across all buckets. */
  public int size() {
    return primaryNeeds.size() + work.size() + other.size();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClassifiedColumns)) {
      return false;
    }
    ClassifiedColumns that = (ClassifiedColumns) o;
    return primaryNeeds.equals(that.primaryNeeds)
        && work.equals(that.work)
        && other.equals(that.other);
  }

  @Override public int hashCode() {
    return Objects.hash(primaryNeeds, work, other);
  }

  @Override public String toString() {
    return "ClassifiedColumns{primaryNeeds=" + primaryNeeds.size()
        + ", work=" + work.size()
        + ", other=" + other.size() + "}";
  }
}
