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

import com.rackspace.timecharts.app.services.DailyMetricReports;
import com.rackspace.timecharts.app.services.Report;
import com.rackspace.timecharts.app.services.ReportRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ReportRegistryConfig {

  @Bean
  public ReportRegistry reportRegistry(AppProperties appProperties,
                                       DailyMetricReports dailyMetricReports) {
    final Map<String, Report> reports = new LinkedHashMap<>();
    appProperties.getDailyMetricReports().forEach((name, sourceMetric) -> {
      log.info("Registering report {} for daily metric {}", name, sourceMetric);
      reports.put(name, dailyMetricReports.view(sourceMetric));
    });
    return new ReportRegistry(reports);
  }
}
