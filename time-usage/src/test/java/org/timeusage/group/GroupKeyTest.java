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

import org.timeusage.summary.SummaryRecord;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for GroupKey.
 */
@Tag("unit")
public class GroupKeyTest {

  @Test void testAllKeys() {
    List<GroupKey> keys = GroupKey.allKeys();

    assertEquals(12, keys.size());
    assertEquals(12, new HashSet<GroupKey>(keys).size());
    assertEquals(new GroupKey("not working", "female", "active"), keys.get(0));
    assertEquals(new GroupKey("working", "male", "young"), keys.get(11));

    List<GroupKey> sorted = new ArrayList<GroupKey>(keys);
    Collections.sort(sorted);
    assertEquals(sorted, keys);
  }

  @Test void testOrderingIsLexicographic() {
    GroupKey notWorking = new GroupKey("not working", "male", "young");
    GroupKey workingFemale = new GroupKey("working", "female", "young");
    GroupKey workingMaleActive = new GroupKey("working", "male", "active");
    GroupKey workingMaleElder = new GroupKey("working", "male", "elder");

    assertTrue(notWorking.compareTo(workingFemale) < 0);
    assertTrue(workingFemale.compareTo(workingMaleActive) < 0);
    assertTrue(workingMaleActive.compareTo(workingMaleElder) < 0);
    assertEquals(0, workingMaleElder.compareTo(new GroupKey("working", "male", "elder")));
  }

  @Test void testOfSummaryRecord() {
    SummaryRecord record = new SummaryRecord("working", "male", "active", 9.0, 7.0, 6.0);

    GroupKey key = GroupKey.of(record);

    assertEquals(new GroupKey("working", "male", "active"), key);
    assertEquals(key.hashCode(), new GroupKey("working", "male", "active").hashCode());
    assertNotEquals(new GroupKey("working", "male", "elder"), key);
    assertEquals("(working, male, active)", key.toString());
  }

  @Test void testNullComponentRejected() {
    assertThrows(NullPointerException.class, () -> new GroupKey("working", null, "active"));
  }
}
