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

package com.rackspace.timecharts.app.aggregation;

import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.Timeframe;
import java.util.Arrays;

/**
 * Policies restricting the rows that feed one period's aggregate.
 */
public enum TimeframeLimiter {
  /**
   * Every period sees every row.
   */
  none {
    @Override
    public TimeFilter restrict(Timeframe period, String timestampField) {
      return TimeFilter.unrestricted();
    }
  },
  /**
   * Rows with <code>start &lt;= t &lt; end</code>.
   */
  standard {
    @Override
    public TimeFilter restrict(Timeframe period, String timestampField) {
      return TimeFilter.between(timestampField, period.getStart(), period.getEnd());
    }
  },
  /**
   * Rows with <code>t &lt; end</code>, giving running totals per period.
   */
  cumulative {
    @Override
    public TimeFilter restrict(Timeframe period, String timestampField) {
      return TimeFilter.before(timestampField, period.getEnd());
    }
  };

  public abstract TimeFilter restrict(Timeframe period, String timestampField);

  public static TimeframeLimiter fromName(String name) {
    return Arrays.stream(values())
        .filter(limiter -> limiter.name().equals(name))
        .findFirst()
        .orElseThrow(() ->
            new ReportConfigurationException("Unrecognized timeframe limiter: " + name));
  }
}
