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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Minute to hour conversion and the rounding shared by every aggregation
 * engine.
 *
 * <p>Rounding is half-up on the decimal representation of the double, the
 * same rule as SQL {@code ROUND}, so that the enumerable and SQL engines
 * agree to the last digit.
 */
public final class HourMath {

  private static final double MINUTES_PER_HOUR = 60d;

  private HourMath() {
  }

  public static double toHours(double minutes) {
    return minutes / MINUTES_PER_HOUR;
  }

  /** Rounds to the nearest whole number, ties away from zero. */
  public static double round(double value) {
    return round(value, 0);
  }

  /**
   * Rounds to {@code scale} decimal digits, ties away from zero.
   *
   * @param value Value to round; must be finite
   * @param scale Number of digits after the decimal point
   */
  public static double round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }
}
