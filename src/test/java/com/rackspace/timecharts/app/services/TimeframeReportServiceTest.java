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

import com.rackspace.timecharts.app.config.AppProperties;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.errors.UnrecognizedAggregationException;
import com.rackspace.timecharts.app.model.DailyMetric;
import com.rackspace.timecharts.app.model.Datashape;
import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.ReportResult;
import com.rackspace.timecharts.app.model.Series;
import com.rackspace.timecharts.app.repos.DailyMetricRepository;
import com.rackspace.timecharts.app.repos.DailyMetricSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class TimeframeReportServiceTest {

  static final ZoneId UTC = ZoneId.of("UTC");

  AppProperties appProperties = new AppProperties().setDefaultZone(UTC);

  TimeframeResolver resolver = new TimeframeResolver(appProperties,
      Clock.fixed(Instant.parse("2013-07-30T12:00:00Z"), UTC));

  TimeframeReportService service = new TimeframeReportService(
      resolver,
      new TimeframeDivider(appProperties, resolver),
      new AggregationOrchestrator(appProperties),
      new TransformPipeline(),
      new ResultAssembler());

  DailyMetricSource source;

  static ZonedDateTime utc(String date) {
    return LocalDate.parse(date).atStartOfDay(UTC);
  }

  static DailyMetric revenue(String date, String value) {
    return new DailyMetric()
        .setSource("web")
        .setMetric("revenue")
        .setDate(LocalDate.parse(date))
        .setValue(new BigDecimal(value));
  }

  static ReportOptions sumOfValue() {
    return new ReportOptions()
        .setAggregateType("sum")
        .setAggregateField("value")
        .setTimestampRelation("date");
  }

  @BeforeEach
  void setUp() {
    final DailyMetricRepository repository = new DailyMetricRepository(appProperties);
    repository.saveAll(Flux.just(
        revenue("2013-07-01", "10.50"),
        revenue("2013-07-02", "4.25"),
        revenue("2013-07-04", "1.00"))).blockLast();
    source = repository.forMetric("web:revenue");
  }

  @Test
  void dividedLiteralTimeframe() {
    final ReportOptions options = sumOfValue()
        .setStartDate("2013-07-01")
        .setEndDate("2013-07-05")
        .setTimeDivisions("day");

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> {
          assertThat(result.getSeries()).hasSize(1);
          final Series series = result.getSeries().get(0);
          assertThat(series.getId()).isEqualTo("sum_value");
          assertThat(series.getData()).isEqualTo(Arrays.asList(
              new BigDecimal("10.50"), new BigDecimal("4.25"), null, new BigDecimal("1.00")));

          assertThat(result.getQuery().getDatashape()).isEqualTo(Datashape.SINGLE_SERIES);
          assertThat(result.getQuery().getAggregateType()).isEqualTo("sum");
          assertThat(result.getQuery().getTimeDivisions()).isEqualTo("day");
          assertThat(result.getQuery().getTransforms()).isNull();
          assertThat(result.getQuery().getTimeframe().getStart()).isEqualTo(utc("2013-07-01"));
          assertThat(result.getQuery().getTimeframe().getEnd()).isEqualTo(utc("2013-07-05"));
          assertThat(result.getQuery().getTimeframe().getPeriods()).hasSize(4);
        })
        .verifyComplete();
  }

  @Test
  void defaultsCountEverything() {
    StepVerifier.create(service.run(source, new ReportOptions()))
        .assertNext(result -> {
          assertThat(result.getSeries().get(0).getId()).isEqualTo("count_pk");
          assertThat(result.getSeries().get(0).getData()).containsExactly(3L);
          assertThat(result.getQuery().getDatashape()).isEqualTo(Datashape.SCALAR);
          assertThat(result.getQuery().getAggregateField()).isEqualTo("pk");
          assertThat(result.getQuery().getTimeframe().getStart()).isNull();
        })
        .verifyComplete();
  }

  @Test
  void discoversTimeframeFromData() {
    final ReportOptions options = sumOfValue()
        .setTimeDivisions("day")
        .setQuantize(true);

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> {
          assertThat(result.getQuery().getTimeframe().getStart()).isEqualTo(utc("2013-06-30"));
          assertThat(result.getQuery().getTimeframe().getEnd()).isEqualTo(utc("2013-07-05"));
          assertThat(result.getSeries().get(0).getData()).isEqualTo(Arrays.asList(
              null, new BigDecimal("10.50"), new BigDecimal("4.25"), null,
              new BigDecimal("1.00")));
        })
        .verifyComplete();
  }

  @Test
  void relativeTimeframeDividedByQuantizedWeeks() {
    final ReportOptions options = sumOfValue()
        .setTimeframe("this_1_months")
        .setTimeDivisions("week")
        .setQuantize(true)
        .setTransforms(List.of("replace_nulls"));

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> {
          assertThat(result.getQuery().getTimeframe().getStart()).isEqualTo(utc("2013-06-30"));
          assertThat(result.getQuery().getTimeframe().getEnd()).isEqualTo(utc("2013-08-04"));
          assertThat(result.getSeries().get(0).getData())
              .containsExactly(new BigDecimal("15.75"), 0L, 0L, 0L, 0L);
          assertThat(result.getQuery().getTransforms()).containsExactly("replace_nulls");
        })
        .verifyComplete();
  }

  @Test
  void reducingTransformGivesScalar() {
    final ReportOptions options = sumOfValue()
        .setStartDate("2013-07-01")
        .setEndDate("2013-07-03")
        .setTimeDivisions("day")
        .setTransforms(List.of("bogus", "avg"));

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> {
          assertThat(result.getSeries().get(0).getData()).containsExactly(7.375);
          assertThat(result.getQuery().getDatashape()).isEqualTo(Datashape.SCALAR);
        })
        .verifyComplete();
  }

  @Test
  void groupedByDate() {
    final ReportOptions options = sumOfValue()
        .setStartDate("2013-07-01")
        .setEndDate("2013-07-03")
        .setGroupBy("date");

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> {
          assertThat(result.getSeries()).extracting(Series::getName)
              .containsExactly("2013-07-01T00:00:00Z", "2013-07-02T00:00:00Z");
          assertThat(result.getSeries()).extracting(Series::getData).containsExactly(
              List.of(new BigDecimal("10.50")), List.of(new BigDecimal("4.25")));
          assertThat(result.getQuery().getDatashape()).isEqualTo(Datashape.SINGLE_FRAME);
          assertThat(result.getQuery().getGroupBy()).isEqualTo("date");
        })
        .verifyComplete();
  }

  @Test
  void cumulativeLimiter() {
    final ReportOptions options = sumOfValue()
        .setStartDate("2013-07-02")
        .setEndDate("2013-07-05")
        .setTimeDivisions("day")
        .setTimeframeLimiter("cumulative");

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> assertThat(result.getSeries().get(0).getData()).containsExactly(
            new BigDecimal("14.75"), new BigDecimal("14.75"), new BigDecimal("15.75")))
        .verifyComplete();
  }

  @Test
  void unrecognizedAggregation() {
    StepVerifier.create(service.run(source, sumOfValue().setAggregateType("median")))
        .expectError(UnrecognizedAggregationException.class)
        .verify();
  }

  @Test
  void conflictingTimeframes() {
    final ReportOptions options = sumOfValue()
        .setStartDate("2013-07-01")
        .setEndDate("2013-07-03")
        .setTimeframe("yesterday");

    StepVerifier.create(service.run(source, options))
        .expectError(ReportConfigurationException.class)
        .verify();
  }

  @Test
  void unknownLimiter() {
    StepVerifier.create(service.run(source, sumOfValue().setTimeframeLimiter("sliding")))
        .expectError(ReportConfigurationException.class)
        .verify();
  }

  @Test
  void emptyResultShape() {
    final ReportOptions options = sumOfValue()
        .setStartDate("2013-07-01")
        .setEndDate("2013-07-01")
        .setTimeDivisions("day");

    StepVerifier.create(service.run(source, options))
        .assertNext(result -> {
          assertThat(result.getSeries().get(0).getData()).isEmpty();
          assertThat(result.getQuery().getDatashape()).isEqualTo(Datashape.EMPTY);
        })
        .verifyComplete();
  }

  @Test
  void serviceResultDoesNotShareOptions() {
    final ReportOptions options = sumOfValue().setTransforms(List.of("growth"));

    final ReportResult result = service.run(source, options).block();

    assertThat(result).isNotNull();
    assertThat(result.getQuery().getTransforms()).isNotSameAs(options.getTransforms());
  }
}
