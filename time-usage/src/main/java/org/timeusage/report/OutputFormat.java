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
package org.timeusage.report;

import java.util.Locale;

/**
 * Rendering of the grouped report.
 */
public enum OutputFormat {
  /** Boxed text table. */
  TABLE,
  /** JSON array of objects. */
  JSON,
  /** Comma separated values with a header row. */
  CSV;

  /**
   * Looks up a format by name, ignoring case.
   *
   * @throws IllegalArgumentException if no format has that name
   */
  public static OutputFormat fromName(String name) {
    for (OutputFormat format : values()) {
      if (format.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown output format: " + name);
  }
}
