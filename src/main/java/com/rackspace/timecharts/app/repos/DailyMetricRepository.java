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

package com.rackspace.timecharts.app.repos;

import com.rackspace.timecharts.app.config.AppProperties;
import com.rackspace.timecharts.app.model.DailyMetric;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keeps daily metrics in memory, one row per source, metric and date, ordered by date.
 */
@Repository
@Slf4j
public class DailyMetricRepository {

  private final Map<String, ConcurrentSkipListMap<LocalDate, DailyMetric>> metrics =
      new ConcurrentHashMap<>();
  private final AtomicLong nextId = new AtomicLong(1);
  private final AppProperties appProperties;

  @Autowired
  public DailyMetricRepository(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  /**
   * Stores the metric, replacing the value of an existing row for the same source, metric and
   * date. The replaced row keeps its id.
   */
  public Mono<DailyMetric> save(DailyMetric metric) {
    return Mono.fromCallable(() -> {
      final ConcurrentSkipListMap<LocalDate, DailyMetric> rows =
          metrics.computeIfAbsent(metric.getSourceMetric(), key -> new ConcurrentSkipListMap<>());
      final DailyMetric saved = rows.compute(metric.getDate(), (date, existing) ->
          copyOf(metric).setId(existing == null ? nextId.getAndIncrement() : existing.getId()));
      log.trace("Saved daily metric {}", saved);
      return saved;
    });
  }

  public Flux<DailyMetric> saveAll(Flux<DailyMetric> metrics) {
    return metrics.concatMap(this::save);
  }

  /**
   * @return the distinct metrics as <code>source:metric</code>, sorted
   */
  public Flux<String> listMetrics() {
    return Flux.fromStream(() -> metrics.entrySet().stream()
        .filter(entry -> !entry.getValue().isEmpty())
        .map(Map.Entry::getKey)
        .sorted());
  }

  public boolean exists(String sourceMetric) {
    final ConcurrentSkipListMap<LocalDate, DailyMetric> rows = metrics.get(sourceMetric);
    return rows != null && !rows.isEmpty();
  }

  /**
   * @return a view over the rows of one metric, given as <code>source:metric</code>. Rows saved
   * later are visible through the view.
   */
  public DailyMetricSource forMetric(String sourceMetric) {
    return new DailyMetricSource(
        () -> List.copyOf(metrics.getOrDefault(sourceMetric, new ConcurrentSkipListMap<>())
            .values()),
        appProperties.getDefaultZone());
  }

  private static DailyMetric copyOf(DailyMetric metric) {
    return new DailyMetric()
        .setSource(metric.getSource())
        .setMetric(metric.getMetric())
        .setDate(metric.getDate())
        .setValue(metric.getValue());
  }
}
