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

package com.rackspace.timecharts.app.web;

import com.rackspace.timecharts.app.model.DailyMetric;
import com.rackspace.timecharts.app.repos.DailyMetricRepository;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/daily-metrics")
@Slf4j
public class DailyMetricController {

  private final DailyMetricRepository dailyMetricRepository;

  @Autowired
  public DailyMetricController(DailyMetricRepository dailyMetricRepository) {
    this.dailyMetricRepository = dailyMetricRepository;
  }

  /**
   * Stores the given metrics, replacing the value of any already recorded for the same source,
   * metric and date.
   */
  @PostMapping
  public Mono<ResponseEntity<?>> putMetrics(@RequestBody @Validated Flux<DailyMetric> metrics) {
    return dailyMetricRepository.saveAll(metrics)
        .count()
        .doOnNext(count -> log.debug("Stored {} daily metrics", count))
        .then(Mono.just(ResponseEntity.noContent().build()));
  }

  /**
   * @return the stored metrics as <code>source:metric</code>
   */
  @GetMapping
  public Mono<List<String>> listMetrics() {
    return dailyMetricRepository.listMetrics().collectList();
  }
}
