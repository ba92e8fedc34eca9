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

package com.rackspace.timecharts.app.timeframes;

import java.time.ZonedDateTime;

/**
 * Locates unit boundaries relative to a timestamp. Implementations must be strictly increasing
 * in <code>offset</code> for a fixed timestamp.
 */
@FunctionalInterface
public interface FloorStrategy {

  /**
   * @param timestamp the anchor
   * @param offset number of whole units away from the anchor's boundary, may be negative
   * @return the boundary <code>offset</code> units away from <code>timestamp</code>
   */
  ZonedDateTime floor(ZonedDateTime timestamp, long offset);
}
