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
 * Working status derived from the labor force status code ({@code telfs}).
 */
public enum EmploymentStatus {
  WORKING("working"),
  NOT_WORKING("not working");

  private final String label;

  EmploymentStatus(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Derives the status from a labor force code: codes 1 and 2 (employed, at
   * work or absent) are working, anything else is not.
   */
  public static EmploymentStatus fromCode(double code) {
    return code >= 1 && code < 3 ? WORKING : NOT_WORKING;
  }
}
