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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.timecharts.app.aggregation.Aggregation;
import com.rackspace.timecharts.app.aggregation.AggregationFunction;
import com.rackspace.timecharts.app.aggregation.AggregationPlan;
import com.rackspace.timecharts.app.aggregation.AggregationSource;
import com.rackspace.timecharts.app.aggregation.SourceCapability;
import com.rackspace.timecharts.app.aggregation.TimeFilter;
import com.rackspace.timecharts.app.aggregation.TimeframeLimiter;
import com.rackspace.timecharts.app.config.AppProperties;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.Series;
import com.rackspace.timecharts.app.model.SeriesKey;
import com.rackspace.timecharts.app.model.Timeframe;
import com.rackspace.timecharts.app.schema.EntitySchemaReflector;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class AggregationOrchestratorTest {

  static final ZoneId UTC = ZoneId.of("UTC");
  static final ZonedDateTime JULY_1 = ZonedDateTime.of(2013, 7, 1, 0, 0, 0, 0, UTC);

  static final List<Timeframe> DAYS = List.of(
      Timeframe.of(JULY_1, JULY_1.plusDays(1)),
      Timeframe.of(JULY_1.plusDays(1), JULY_1.plusDays(2)),
      Timeframe.of(JULY_1.plusDays(2), JULY_1.plusDays(3)));

  static final Aggregation SUM_VALUE = Aggregation.of(AggregationFunction.sum, "value");

  AggregationOrchestrator orchestrator = new AggregationOrchestrator(new AppProperties());

  AggregationSource source;

  @BeforeEach
  void setUp() {
    source = mock(AggregationSource.class);
    when(source.getEntityName()).thenReturn("Sale");
    when(source.getSchema()).thenReturn(EntitySchemaReflector.builder()
        .entity("Sale", "pk", "value", "created")
        .entity("Region", "pk", "name")
        .foreignKey("Sale", "region", "Region")
        .build());
    when(source.getCapabilities()).thenReturn(Set.of(SourceCapability.GROUPING));
    when(source.supports(any())).thenCallRealMethod();
  }

  static AggregationPlan dividedPlan() {
    return new AggregationPlan()
        .setAggregation(SUM_VALUE)
        .setTimestampField("created")
        .setTimeframe(TimeframeDivider.span(DAYS))
        .setPeriods(DAYS)
        .setDivided(true);
  }

  @Nested
  public class ungrouped {

    @Test
    void oneCellPerPeriod() {
      when(source.aggregate(any(), eq(SUM_VALUE))).thenAnswer(invocation -> {
        final TimeFilter filter = invocation.getArgument(0);
        if (filter.getStart().equals(JULY_1.plusDays(1))) {
          // no rows on the second day
          return Mono.empty();
        }
        return Mono.just(filter.getStart().getDayOfMonth() * 10L);
      });

      StepVerifier.create(orchestrator.run(source, dividedPlan()))
          .assertNext(series -> {
            assertThat(series).hasSize(1);
            assertThat(series.get(0).getId()).isEqualTo("sum_value");
            assertThat(series.get(0).getName()).isEqualTo("sum_value");
            assertThat(series.get(0).getData()).containsExactly(10L, null, 30L);
          })
          .verifyComplete();

      verify(source).aggregate(TimeFilter.between("created", JULY_1, JULY_1.plusDays(1)),
          SUM_VALUE);
    }

    @Test
    void cumulativeLimiterOnlyBoundsEnd() {
      when(source.aggregate(any(), any())).thenReturn(Mono.<Number>just(1L));

      StepVerifier.create(orchestrator.run(source,
              dividedPlan().setLimiter(TimeframeLimiter.cumulative)))
          .expectNextCount(1)
          .verifyComplete();

      verify(source).aggregate(TimeFilter.before("created", JULY_1.plusDays(3)), SUM_VALUE);
    }

    @Test
    void noTimeframeAggregatesEverything() {
      when(source.aggregate(any(), any())).thenReturn(Mono.<Number>just(7L));

      StepVerifier.create(orchestrator.run(source,
              new AggregationPlan().setAggregation(SUM_VALUE)))
          .assertNext(series -> assertThat(series.get(0).getData()).containsExactly(7L))
          .verifyComplete();

      verify(source).aggregate(TimeFilter.unrestricted(), SUM_VALUE);
    }

    @Test
    void emptyDivision() {
      StepVerifier.create(orchestrator.run(source,
              dividedPlan().setPeriods(List.of()).setTimeframe(null)))
          .assertNext(series -> assertThat(series.get(0).getData()).isEmpty())
          .verifyComplete();

      verify(source, never()).aggregate(any(), any());
    }

    @Test
    void limitingRequiresTimestampField() {
      StepVerifier.create(orchestrator.run(source, dividedPlan().setTimestampField(null)))
          .expectError(ReportConfigurationException.class)
          .verify();
    }
  }

  @Nested
  public class grouped {

    @Test
    void seriesEnumeratedOverWholeTimeframe() {
      when(source.enumerateGroups(any(), any())).thenReturn(Flux.just(
          SeriesKey.of("east", "East"), SeriesKey.of("west", "West"),
          SeriesKey.of("east", "East")));
      when(source.aggregateByGroup(any(), any(), any())).thenAnswer(invocation -> {
        final TimeFilter filter = invocation.getArgument(0);
        final int day = filter.getStart().getDayOfMonth();
        return Mono.just(day == 2
            ? Map.<Object, Number>of("west", 5L)
            : Map.<Object, Number>of("east", (long) day));
      });

      StepVerifier.create(orchestrator.run(source, dividedPlan().setGroupBy("value")))
          .assertNext(series -> {
            assertThat(series).extracting(Series::getId).containsExactly("east", "west");
            assertThat(series).extracting(Series::getName).containsExactly("East", "West");
            assertThat(series.get(0).getData()).isEqualTo(Arrays.asList(1L, null, 3L));
            assertThat(series.get(1).getData()).isEqualTo(Arrays.asList(null, 5L, null));
          })
          .verifyComplete();

      verify(source).enumerateGroups(
          eq(TimeFilter.between("created", JULY_1, JULY_1.plusDays(3))), any());
    }

    @Test
    void reverseRelationRoutesAggregation() {
      when(source.getEntityName()).thenReturn("Region");
      when(source.getCapabilities()).thenReturn(
          Set.of(SourceCapability.GROUPING, SourceCapability.REVERSE_RELATIONS));
      when(source.enumerateGroups(any(), any())).thenReturn(Flux.just(SeriesKey.of(1L, "1")));
      when(source.aggregateByGroup(any(), any(), any()))
          .thenReturn(Mono.just(Map.<Object, Number>of(1L, 2L)));

      StepVerifier.create(orchestrator.run(source, dividedPlan().setGroupBy("sale.pk")))
          .expectNextCount(1)
          .verifyComplete();

      verify(source, times(3)).aggregateByGroup(any(), any(),
          eq(Aggregation.of(AggregationFunction.sum, "region.value")));
    }

    @Test
    void reverseRelationNeedsCapability() {
      when(source.getEntityName()).thenReturn("Region");

      StepVerifier.create(orchestrator.run(source, dividedPlan().setGroupBy("sale.pk")))
          .expectError(ReportConfigurationException.class)
          .verify();
    }

    @Test
    void groupingNeedsCapability() {
      when(source.getCapabilities()).thenReturn(Set.of());

      StepVerifier.create(orchestrator.run(source, dividedPlan().setGroupBy("value")))
          .expectError(ReportConfigurationException.class)
          .verify();
    }

    @Test
    void brokenRelationPath() {
      StepVerifier.create(orchestrator.run(source, dividedPlan().setGroupBy("value.name")))
          .expectError(ReportConfigurationException.class)
          .verify();
    }
  }
}
