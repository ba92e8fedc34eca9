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
import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.Timeframe;
import com.rackspace.timecharts.app.timeframes.AlignmentMode;
import com.rackspace.timecharts.app.timeframes.FloorStrategy;
import com.rackspace.timecharts.app.timeframes.RelativeTimeframe;
import com.rackspace.timecharts.app.timeframes.TimeframeUnit;
import com.rackspace.timecharts.app.utils.DateTimeUtils;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns literal date ranges and relative expressions into concrete timeframes.
 */
@Service
@Slf4j
public class TimeframeResolver {

  private final AppProperties appProperties;
  private final Clock clock;

  @Autowired
  public TimeframeResolver(AppProperties appProperties, Clock clock) {
    this.appProperties = appProperties;
    this.clock = clock;
  }

  /**
   * Resolves the timeframe named by the options, if any.
   *
   * @param quantize whether a relative expression is resolved against calendar boundaries
   * @param relativeTo anchor for relative expressions
   * @return the resolved timeframe or empty when the options name neither a literal range nor
   * a relative expression
   * @throws ReportConfigurationException when both a literal range and a relative expression
   * are given, or only one end of a literal range is given
   */
  public Optional<Timeframe> resolve(ReportOptions options, boolean quantize,
                                     ZonedDateTime relativeTo) {
    final boolean literal = StringUtils.isNotBlank(options.getStartDate())
        || StringUtils.isNotBlank(options.getEndDate());
    final boolean relative = StringUtils.isNotBlank(options.getTimeframe());

    if (literal && relative) {
      throw new ReportConfigurationException("Invalid timeframe arguments: either pass a start "
          + "and end date or a recognized timeframe string");
    }
    if (literal) {
      return Optional.of(resolveLiteral(options.getStartDate(), options.getEndDate()));
    }
    if (relative) {
      return Optional.of(resolveRelative(options.getTimeframe(), quantize, relativeTo));
    }
    return Optional.empty();
  }

  public Timeframe resolveRelative(String text, boolean quantize, ZonedDateTime relativeTo) {
    return resolveRelative(RelativeTimeframe.parse(text), quantize, relativeTo);
  }

  /**
   * Computes <code>[floor(anchor, offset - span), floor(anchor, offset))</code>. Quantized
   * resolution moves the offset forward by one so that <code>this_*</code> expressions cover
   * the still-open current period.
   */
  public Timeframe resolveRelative(RelativeTimeframe relativeTimeframe, boolean quantize,
                                   ZonedDateTime relativeTo) {
    final AlignmentMode mode = AlignmentMode.of(quantize);
    final FloorStrategy floor = floorStrategy(relativeTimeframe.getUnit(), mode);

    long offset = relativeTimeframe.getOffset();
    if (mode == AlignmentMode.QUANTIZED) {
      offset += 1;
    }

    final Timeframe timeframe = Timeframe.of(
        floor.floor(relativeTo, offset - relativeTimeframe.getSpan()),
        floor.floor(relativeTo, offset)
    );
    log.debug("Resolved {} relative to {} as {} with mode {}", relativeTimeframe, relativeTo,
        timeframe, mode);
    return timeframe;
  }

  /**
   * Parses both ends of a literal range with the configured date formats.
   */
  public Timeframe resolveLiteral(String start, String end) {
    if (StringUtils.isBlank(start) || StringUtils.isBlank(end)) {
      throw new ReportConfigurationException(
          "Invalid timeframe arguments: both a start and an end date are required");
    }
    return checkedTimeframe(
        DateTimeUtils.parseDate(start, appProperties.getDateFormats(),
            appProperties.getDefaultZone()),
        DateTimeUtils.parseDate(end, appProperties.getDateFormats(),
            appProperties.getDefaultZone())
    );
  }

  public FloorStrategy floorStrategy(TimeframeUnit unit, AlignmentMode mode) {
    return unit.floorStrategy(mode, appProperties.getWeekStart());
  }

  public ZonedDateTime now() {
    return ZonedDateTime.now(clock.withZone(appProperties.getDefaultZone()));
  }

  private static Timeframe checkedTimeframe(ZonedDateTime start, ZonedDateTime end) {
    if (start.isAfter(end)) {
      throw new ReportConfigurationException(String.format(
          "Invalid timeframe arguments: start %s is after end %s", start, end));
    }
    return Timeframe.of(start, end);
  }
}
