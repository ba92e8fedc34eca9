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
import com.rackspace.timecharts.app.aggregation.AggregationFunction;
import com.rackspace.timecharts.app.aggregation.AggregationPlan;
import com.rackspace.timecharts.app.aggregation.AggregationSource;
import com.rackspace.timecharts.app.aggregation.SourceCapability;
import com.rackspace.timecharts.app.aggregation.TimeframeLimiter;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.QueryMetadata;
import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.ReportResult;
import com.rackspace.timecharts.app.model.Timeframe;
import com.rackspace.timecharts.app.timeframes.TimeframeUnit;
import com.rackspace.timecharts.app.transforms.TransformStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs a time-bucketed report over an {@link AggregationSource}: resolves the timeframe,
 * divides it into periods, aggregates each series per period, transforms the series and
 * assembles the result document.
 */
@Service
@Slf4j
public class TimeframeReportService {

  static final String DEFAULT_AGGREGATE_TYPE = "count";
  static final String DEFAULT_AGGREGATE_FIELD = "pk";
  static final String DEFAULT_TIMEFRAME_LIMITER = "standard";

  private final TimeframeResolver timeframeResolver;
  private final TimeframeDivider timeframeDivider;
  private final AggregationOrchestrator aggregationOrchestrator;
  private final TransformPipeline transformPipeline;
  private final ResultAssembler resultAssembler;

  @Autowired
  public TimeframeReportService(TimeframeResolver timeframeResolver,
                                TimeframeDivider timeframeDivider,
                                AggregationOrchestrator aggregationOrchestrator,
                                TransformPipeline transformPipeline,
                                ResultAssembler resultAssembler) {
    this.timeframeResolver = timeframeResolver;
    this.timeframeDivider = timeframeDivider;
    this.aggregationOrchestrator = aggregationOrchestrator;
    this.transformPipeline = transformPipeline;
    this.resultAssembler = resultAssembler;
  }

  public Mono<ReportResult> run(AggregationSource source, ReportOptions options) {
    return Mono.defer(() -> {
      final String aggregateType =
          StringUtils.defaultIfBlank(options.getAggregateType(), DEFAULT_AGGREGATE_TYPE);
      final String aggregateField =
          StringUtils.defaultIfBlank(options.getAggregateField(), DEFAULT_AGGREGATE_FIELD);
      final Aggregation aggregation =
          Aggregation.of(AggregationFunction.fromName(aggregateType), aggregateField);
      final TimeframeLimiter limiter = TimeframeLimiter.fromName(
          StringUtils.defaultIfBlank(options.getTimeframeLimiter(), DEFAULT_TIMEFRAME_LIMITER));
      final List<TransformStep> transforms = transformPipeline.resolve(options.getTransforms());
      final TimeframeUnit unit = StringUtils.isBlank(options.getTimeDivisions()) ? null
          : TimeframeUnit.fromName(options.getTimeDivisions());

      // a divided timeframe is resolved rolling; only its division honours quantize
      final boolean quantizeTimeframe = unit == null && options.isQuantize();
      final Optional<Timeframe> requested =
          timeframeResolver.resolve(options, quantizeTimeframe, timeframeResolver.now());

      final Mono<Optional<Timeframe>> timeframe =
          requested.isPresent() || StringUtils.isBlank(options.getTimestampRelation())
              ? Mono.just(requested)
              : discoverTimeframe(source, options.getTimestampRelation());

      return timeframe.flatMap(resolved -> {
        final List<Timeframe> periods =
            timeframeDivider.divide(resolved.orElse(null), unit, options.isQuantize());
        final Timeframe effective = unit == null || periods.isEmpty()
            ? resolved.orElse(null)
            : TimeframeDivider.span(periods);

        final AggregationPlan plan = new AggregationPlan()
            .setAggregation(aggregation)
            .setLimiter(limiter)
            .setTimestampField(options.getTimestampRelation())
            .setTimeframe(effective)
            .setPeriods(periods)
            .setDivided(unit != null)
            .setGroupBy(options.getGroupBy());
        log.debug("Running report {} over {} with {}", options.getMetric(),
            source.getEntityName(), plan);

        final QueryMetadata query = new QueryMetadata()
            .setAggregateType(aggregateType)
            .setAggregateField(aggregateField)
            .setTransforms(new ArrayList<>(options.getTransforms()))
            .setTimeDivisions(unit == null ? null : unit.name())
            .setGroupBy(options.getGroupBy());

        return aggregationOrchestrator.run(source, plan)
            .map(series -> transformPipeline.apply(transforms, series))
            .map(series -> resultAssembler.assemble(query, effective,
                unit == null ? null : periods, series));
      });
    });
  }

  /**
   * Uses the full range of the timestamp field as the timeframe. The end is exclusive, so the
   * latest timestamp is extended by one second to include it.
   */
  private Mono<Optional<Timeframe>> discoverTimeframe(AggregationSource source,
                                                      String timestampField) {
    if (!source.supports(SourceCapability.BOUNDARY_DISCOVERY)) {
      throw new ReportConfigurationException(
          "Timeframe discovery is not supported for " + source.getEntityName());
    }
    return source.timestampBounds(timestampField)
        .map(bounds -> Optional.of(Timeframe.of(bounds.getMin(), bounds.getMax().plusSeconds(1))))
        .defaultIfEmpty(Optional.empty());
  }
}
