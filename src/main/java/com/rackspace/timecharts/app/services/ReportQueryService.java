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

import com.rackspace.timecharts.app.errors.UnknownReportException;
import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.ReportResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for report queries: finds the report named by the <code>metric</code> option and
 * runs it.
 */
@Service
@Slf4j
public class ReportQueryService {

  private final ReportRegistry reportRegistry;
  private final DailyMetricReports dailyMetricReports;
  private final Counter registeredReportCounter;
  private final Counter dailyMetricReportCounter;

  @Autowired
  public ReportQueryService(ReportRegistry reportRegistry, DailyMetricReports dailyMetricReports,
                            MeterRegistry meterRegistry) {
    this.reportRegistry = reportRegistry;
    this.dailyMetricReports = dailyMetricReports;
    this.registeredReportCounter = meterRegistry.counter("timecharts.report", "type", "registered");
    this.dailyMetricReportCounter =
        meterRegistry.counter("timecharts.report", "type", "daily-metric");
  }

  /**
   * @return the report result, or an {@link UnknownReportException} error when no report
   * matches the metric
   */
  public Mono<ReportResult> query(ReportOptions options) {
    final String metric = options.getMetric();
    final Optional<Report> registered = reportRegistry.find(metric);
    if (registered.isPresent()) {
      registeredReportCounter.increment();
      return registered.get().run(options);
    }
    if (metric != null && dailyMetricReports.exists(metric)) {
      dailyMetricReportCounter.increment();
      return dailyMetricReports.view(metric).run(options);
    }
    log.debug("No report found for metric {}", metric);
    return Mono.error(new UnknownReportException(metric));
  }
}
