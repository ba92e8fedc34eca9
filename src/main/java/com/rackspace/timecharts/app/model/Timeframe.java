/*
 * Copyright 2021 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.timecharts.app.model;

import java.time.ZonedDateTime;
import java.util.Objects;
import lombok.Value;

/**
 * A half-open range of time, <code>[start, end)</code>.
 */
@Value
public class Timeframe {

  ZonedDateTime start;
  ZonedDateTime end;

  public Timeframe(ZonedDateTime start, ZonedDateTime end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException(
          String.format("Timeframe start %s is after end %s", start, end));
    }
    this.start = start;
    this.end = end;
  }

  public static Timeframe of(ZonedDateTime start, ZonedDateTime end) {
    return new Timeframe(start, end);
  }

  /**
   * @param timestamp the timestamp to check
   * @return true when start &lt;= timestamp &lt; end
   */
  public boolean contains(ZonedDateTime timestamp) {
    return !timestamp.isBefore(start) && timestamp.isBefore(end);
  }
}
