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

import com.rackspace.timecharts.app.aggregation.Aggregation;
import com.rackspace.timecharts.app.aggregation.AggregationPlan;
import com.rackspace.timecharts.app.aggregation.AggregationSource;
import com.rackspace.timecharts.app.aggregation.SourceCapability;
import com.rackspace.timecharts.app.aggregation.TimeFilter;
import com.rackspace.timecharts.app.aggregation.TimeframeLimiter;
import com.rackspace.timecharts.app.config.AppProperties;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.Series;
import com.rackspace.timecharts.app.model.SeriesKey;
import com.rackspace.timecharts.app.schema.RelationPath;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

/**
 * Computes one aggregate cell per series and period by delegating to an
 * {@link AggregationSource}. The per-period queries run concurrently; only the final collation
 * into aligned series is sequential.
 */
@Service
@Slf4j
public class AggregationOrchestrator {

  private final AppProperties appProperties;

  @Autowired
  public AggregationOrchestrator(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  /**
   * @return one series per group key, or a single series named after the aggregation when not
   * grouping, each carrying one cell per period
   */
  public Mono<List<Series>> run(AggregationSource source, AggregationPlan plan) {
    return Mono.defer(() -> {
      final TimeframeLimiter limiter = effectiveLimiter(plan);
      final List<TimeFilter> cellFilters = cellFilters(plan, limiter);

      final Mono<List<SeriesKey>> seriesKeys;
      final Function<TimeFilter, Mono<Map<Object, Number>>> cellQuery;

      if (StringUtils.isNotBlank(plan.getGroupBy())) {
        final RelationPath grouping = resolveGrouping(source, plan.getGroupBy());
        final Aggregation aggregation = grouping.hasReverseRelation()
            ? plan.getAggregation().routedThrough(grouping.getReversePath())
            : plan.getAggregation();

        // series are discovered once over the whole timeframe so that a key seen in only some
        // periods still gets a cell in every period
        final TimeFilter fullFilter = plan.getTimeframe() == null ? TimeFilter.unrestricted()
            : limiter.restrict(plan.getTimeframe(), plan.getTimestampField());
        seriesKeys = source.enumerateGroups(fullFilter, grouping)
            .distinct(SeriesKey::getId)
            .collectList();
        cellQuery = filter -> source.aggregateByGroup(filter, grouping, aggregation);
      } else {
        final String label = plan.getAggregation().label();
        seriesKeys = Mono.just(List.of(SeriesKey.of(label, label)));
        cellQuery = filter -> source.aggregate(filter, plan.getAggregation())
            .map(value -> Map.<Object, Number>of(label, value))
            .defaultIfEmpty(Map.of());
      }

      return seriesKeys.flatMap(keys ->
          Flux.range(0, cellFilters.size())
              .flatMap(index -> cellQuery.apply(cellFilters.get(index))
                      .doOnNext(values -> log.trace("Cell {} of {} with {}: {}",
                          index, cellFilters.size(), cellFilters.get(index), values))
                      .map(values -> Tuples.of(index, values)),
                  appProperties.getAggregationConcurrency())
              .collectList()
              .map(cells -> collate(keys, cells, cellFilters.size()))
      );
    });
  }

  private static TimeframeLimiter effectiveLimiter(AggregationPlan plan) {
    if (plan.getTimeframe() == null || plan.getLimiter() == TimeframeLimiter.none) {
      return TimeframeLimiter.none;
    }
    if (StringUtils.isBlank(plan.getTimestampField())) {
      throw new ReportConfigurationException(
          "A timestamp relation is required to limit rows by timeframe");
    }
    return plan.getLimiter();
  }

  private static List<TimeFilter> cellFilters(AggregationPlan plan, TimeframeLimiter limiter) {
    if (plan.getPeriods().isEmpty()) {
      return plan.isDivided() ? List.of() : List.of(TimeFilter.unrestricted());
    }
    return plan.getPeriods().stream()
        .map(period -> limiter.restrict(period, plan.getTimestampField()))
        .collect(Collectors.toList());
  }

  private static RelationPath resolveGrouping(AggregationSource source, String groupBy) {
    if (!source.supports(SourceCapability.GROUPING)) {
      throw new ReportConfigurationException(
          "Grouping is not supported for " + source.getEntityName());
    }
    final RelationPath grouping = source.getSchema().reflect(source.getEntityName(), groupBy);
    if (grouping.hasReverseRelation() && !source.supports(SourceCapability.REVERSE_RELATIONS)) {
      throw new ReportConfigurationException(String.format(
          "Grouping %s by %s requires reverse relations, which are not supported",
          source.getEntityName(), groupBy));
    }
    return grouping;
  }

  private static List<Series> collate(List<SeriesKey> keys,
                                      List<Tuple2<Integer, Map<Object, Number>>> cells,
                                      int periodCount) {
    final Number[][] data = new Number[keys.size()][periodCount];
    for (Tuple2<Integer, Map<Object, Number>> cell : cells) {
      for (int s = 0; s < keys.size(); s++) {
        data[s][cell.getT1()] = cell.getT2().get(keys.get(s).getId());
      }
    }
    return IntStream.range(0, keys.size())
        .mapToObj(s -> Series.of(keys.get(s), Arrays.asList(data[s])))
        .collect(Collectors.toList());
  }
}
