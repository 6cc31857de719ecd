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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for the code to label derivations of EmploymentStatus, Sex and
 * AgeGroup.
 */
@Tag("unit")
public class DemographicLabelsTest {

  @Test void testEmploymentStatus() {
    assertEquals(EmploymentStatus.NOT_WORKING, EmploymentStatus.fromCode(0));
    assertEquals(EmploymentStatus.WORKING, EmploymentStatus.fromCode(1));
    assertEquals(EmploymentStatus.WORKING, EmploymentStatus.fromCode(2));
    assertEquals(EmploymentStatus.WORKING, EmploymentStatus.fromCode(2.5));
    assertEquals(EmploymentStatus.NOT_WORKING, EmploymentStatus.fromCode(3));
    assertEquals(EmploymentStatus.NOT_WORKING, EmploymentStatus.fromCode(4));
    assertEquals("working", EmploymentStatus.WORKING.getLabel());
    assertEquals("not working", EmploymentStatus.NOT_WORKING.getLabel());
  }

  @Test void testSex() {
    assertEquals(Sex.MALE, Sex.fromCode(1));
    assertEquals(Sex.FEMALE, Sex.fromCode(2));
    assertEquals(Sex.FEMALE, Sex.fromCode(-1));
    assertEquals("male", Sex.MALE.getLabel());
    assertEquals("female", Sex.FEMALE.getLabel());
  }

  @Test void testAgeGroupBoundaries() {
    assertEquals(AgeGroup.ELDER, AgeGroup.fromAge(14));
    assertEquals(AgeGroup.YOUNG, AgeGroup.fromAge(15));
    assertEquals(AgeGroup.YOUNG, AgeGroup.fromAge(22));
    assertEquals(AgeGroup.ACTIVE, AgeGroup.fromAge(23));
    assertEquals(AgeGroup.ACTIVE, AgeGroup.fromAge(55));
    assertEquals(AgeGroup.ELDER, AgeGroup.fromAge(56));
    assertEquals(AgeGroup.ELDER, AgeGroup.fromAge(85));
  }

  @Test void testHourMath() {
    assertEquals(2.0, HourMath.toHours(120));
    assertEquals(2.0, HourMath.round(125 / 60d));
    assertEquals(3.0, HourMath.round(2.5));
    assertEquals(2.3, HourMath.round(2.25, 1));
    assertEquals(9.3, HourMath.round(9.25, 1));
    assertEquals(7.5, HourMath.round(7.5, 1));
    assertEquals(1.7, HourMath.round(5 / 3d, 1));
  }
}
