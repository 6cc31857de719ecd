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

/**
 * Life period derived from the age in years ({@code teage}).
 */
public enum AgeGroup {
  /** 15 to 22 years. */
  YOUNG("young"),
  /** 23 to 55 years. */
  ACTIVE("active"),
  /** Everyone else. */
  ELDER("elder");

  private final String label;

  AgeGroup(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /** Derives the group from an age; ranges are inclusive and checked in order. */
  public static AgeGroup fromAge(double age) {
    if (age >= 15 && age <= 22) {
      return YOUNG;
    }
    if (age >= 23 && age <= 55) {
      return ACTIVE;
    }
    return ELDER;
  }
}
