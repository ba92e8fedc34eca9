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

package com.rackspace.timecharts.app.config;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("timecharts")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * Zone used to localize dates and date-times that carry no zone of their own, and in which
   * calendar-aligned periods are computed.
   */
  @NotNull
  ZoneId defaultZone = ZoneId.of("UTC");

  /**
   * First day of the week for quantized week periods.
   */
  @NotNull
  DayOfWeek weekStart = DayOfWeek.SUNDAY;

  /**
   * Ordered list of {@link java.time.format.DateTimeFormatter} patterns tried when parsing
   * literal start and end dates. The first pattern that parses wins.
   */
  @NotEmpty
  List<String> dateFormats = new ArrayList<>(List.of("uuuu-MM-dd"));

  /**
   * Upper bound on the number of periods a single timeframe division may produce.
   */
  @Min(1)
  int maxPeriods = 10000;

  /**
   * Maximum number of per-period aggregate queries in flight for one report.
   */
  @Min(1)
  int aggregationConcurrency = 4;

  /**
   * Reports registered at startup that expose a daily metric under a friendlier name, keyed
   * by report name with values of the form <code>source:metric</code>.
   */
  Map<String, String> dailyMetricReports = new LinkedHashMap<>();
}
