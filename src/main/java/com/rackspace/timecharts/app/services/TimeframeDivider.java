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

package com.rackspace.timecharts.app.services;

import com.rackspace.timecharts.app.config.AppProperties;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.Timeframe;
import com.rackspace.timecharts.app.timeframes.AlignmentMode;
import com.rackspace.timecharts.app.timeframes.FloorStrategy;
import com.rackspace.timecharts.app.timeframes.TimeframeUnit;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Tiles a timeframe into contiguous, chronologically ordered periods of one unit.
 */
@Service
@Slf4j
public class TimeframeDivider {

  private final AppProperties appProperties;
  private final TimeframeResolver timeframeResolver;

  @Autowired
  public TimeframeDivider(AppProperties appProperties, TimeframeResolver timeframeResolver) {
    this.appProperties = appProperties;
    this.timeframeResolver = timeframeResolver;
  }

  /**
   * Walks backwards from the end of the timeframe, pairing consecutive unit boundaries into
   * periods until a period ends at or before the timeframe start. Rolling periods stop once a
   * period end is &lt;= start; quantized periods stop once a period end is &lt; start, so
   * the first quantized period may begin before the requested start.
   *
   * @param timeframe the range to divide, may be null when unit is null
   * @param unit the period unit or null to keep the timeframe whole
   * @return the periods, or an empty list when neither timeframe nor unit is given
   */
  public List<Timeframe> divide(Timeframe timeframe, TimeframeUnit unit, boolean quantize) {
    if (timeframe == null && unit == null) {
      return List.of();
    }
    if (timeframe == null) {
      throw new ReportConfigurationException(
          "Time divisions by " + unit + " require a timeframe");
    }
    if (unit == null) {
      return List.of(timeframe);
    }

    final AlignmentMode mode = AlignmentMode.of(quantize);
    final FloorStrategy floor = timeframeResolver.floorStrategy(unit, mode);
    final ZonedDateTime start = timeframe.getStart();
    final ZonedDateTime anchor = timeframe.getEnd();
    final long firstOffset = mode == AlignmentMode.QUANTIZED ? 1 : 0;

    final List<Timeframe> periods = new ArrayList<>();
    ZonedDateTime periodEnd = floor.floor(anchor, firstOffset);
    for (long step = 1; continues(periodEnd, start, mode); step++) {
      if (periods.size() >= appProperties.getMaxPeriods()) {
        throw new ReportConfigurationException(String.format(
            "Dividing %s by %s exceeds the limit of %d periods",
            timeframe, unit, appProperties.getMaxPeriods()));
      }
      final ZonedDateTime periodStart = floor.floor(anchor, firstOffset - step);
      if (!periodStart.isBefore(periodEnd)) {
        throw new IllegalStateException(String.format(
            "Floor of %s is not increasing at offset %d", unit, firstOffset - step));
      }
      periods.add(Timeframe.of(periodStart, periodEnd));
      periodEnd = periodStart;
    }
    Collections.reverse(periods);

    log.debug("Divided {} by {} ({}) into {} periods", timeframe, unit, mode, periods.size());
    return periods;
  }

  /**
   * @return the range spanned by the periods, which may be wider than the timeframe that was
   * divided, or null when there are no periods
   */
  public static Timeframe span(List<Timeframe> periods) {
    if (periods.isEmpty()) {
      return null;
    }
    return Timeframe.of(periods.get(0).getStart(), periods.get(periods.size() - 1).getEnd());
  }

  private static boolean continues(ZonedDateTime periodEnd, ZonedDateTime start,
                                   AlignmentMode mode) {
    if (mode == AlignmentMode.QUANTIZED) {
      return !periodEnd.isBefore(start);
    }
    return periodEnd.isAfter(start);
  }
}
