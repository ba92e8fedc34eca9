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

import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.repos.DailyMetricRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds reports over the daily metric store. Unless the caller chooses otherwise, a daily
 * metric report sums <code>value</code> and limits rows by <code>date</code>.
 */
@Component
public class DailyMetricReports {

  static final String TIMESTAMP_FIELD = "date";
  static final String AGGREGATE_TYPE = "sum";
  static final String AGGREGATE_FIELD = "value";

  private final DailyMetricRepository dailyMetricRepository;
  private final TimeframeReportService timeframeReportService;

  @Autowired
  public DailyMetricReports(DailyMetricRepository dailyMetricRepository,
                            TimeframeReportService timeframeReportService) {
    this.dailyMetricRepository = dailyMetricRepository;
    this.timeframeReportService = timeframeReportService;
  }

  /**
   * @param sourceMetric the metric as <code>source:metric</code>
   */
  public Report view(String sourceMetric) {
    return options -> timeframeReportService.run(
        dailyMetricRepository.forMetric(sourceMetric), withDefaults(options));
  }

  public boolean exists(String sourceMetric) {
    return dailyMetricRepository.exists(sourceMetric);
  }

  static ReportOptions withDefaults(ReportOptions options) {
    final ReportOptions resolved = options.copy();
    if (resolved.getTimestampRelation() == null) {
      resolved.setTimestampRelation(TIMESTAMP_FIELD);
    }
    if (resolved.getAggregateType() == null) {
      resolved.setAggregateType(AGGREGATE_TYPE);
    }
    if (resolved.getAggregateField() == null) {
      resolved.setAggregateField(AGGREGATE_FIELD);
    }
    return resolved;
  }
}
