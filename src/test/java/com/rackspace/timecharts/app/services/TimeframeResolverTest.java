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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.timecharts.app.config.AppProperties;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.errors.TimeframeParseException;
import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.Timeframe;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TimeframeResolverTest {

  static final ZoneId UTC = ZoneId.of("UTC");

  AppProperties appProperties = new AppProperties()
      .setDefaultZone(UTC)
      .setDateFormats(List.of("yyyy-MM-dd", "yyyy-MM-dd'T'HH:mm"));

  Clock clock = Clock.fixed(Instant.parse("2013-07-30T12:00:00Z"), UTC);

  TimeframeResolver resolver = new TimeframeResolver(appProperties, clock);

  Timeframe relative(String text, boolean quantize) {
    return resolver.resolveRelative(text, quantize, resolver.now());
  }

  static ZonedDateTime utc(String local) {
    return LocalDateTime.parse(local).atZone(UTC);
  }

  @Nested
  public class resolveRelative {

    @Test
    void quantizedPreviousQuarters() {
      final Timeframe result = relative("previous_2_quarters", true);

      assertThat(result).isEqualTo(
          Timeframe.of(utc("2013-01-01T00:00:00"), utc("2013-07-01T00:00:00")));
    }

    @Test
    void quantizedThisIncludesCurrentPeriod() {
      final Timeframe result = relative("this_quarter", true);

      assertThat(result).isEqualTo(
          Timeframe.of(utc("2013-07-01T00:00:00"), utc("2013-10-01T00:00:00")));
      assertThat(result.contains(resolver.now())).isTrue();
    }

    @Test
    void quantizedYesterday() {
      assertThat(relative("yesterday", true)).isEqualTo(
          Timeframe.of(utc("2013-07-29T00:00:00"), utc("2013-07-30T00:00:00")));
    }

    @Test
    void rollingEndsAtAnchor() {
      assertThat(relative("this_30_days", false)).isEqualTo(
          Timeframe.of(utc("2013-06-30T12:00:00"), utc("2013-07-30T12:00:00")));
    }

    @Test
    void rollingPrevious() {
      assertThat(relative("previous_1_weeks", false)).isEqualTo(
          Timeframe.of(utc("2013-07-16T12:00:00"), utc("2013-07-23T12:00:00")));
    }

    @Test
    void explicitAnchor() {
      assertThat(resolver.resolveRelative("this_month", true, utc("2012-02-29T13:00:00")))
          .isEqualTo(Timeframe.of(utc("2012-02-01T00:00:00"), utc("2012-03-01T00:00:00")));
    }

    @Test
    void unparseable() {
      assertThatThrownBy(() -> relative("sometime_soon", false))
          .isInstanceOf(TimeframeParseException.class);
    }
  }

  @Nested
  public class resolveLiteral {

    @Test
    void dates() {
      assertThat(resolver.resolveLiteral("2013-07-01", "2013-07-31")).isEqualTo(
          Timeframe.of(utc("2013-07-01T00:00:00"), utc("2013-07-31T00:00:00")));
    }

    @Test
    void laterFormatsAreTried() {
      assertThat(resolver.resolveLiteral("2013-07-01T06:30", "2013-07-31")).isEqualTo(
          Timeframe.of(utc("2013-07-01T06:30:00"), utc("2013-07-31T00:00:00")));
    }

    @Test
    void impossibleDay() {
      assertThatThrownBy(() -> resolver.resolveLiteral("2013-02-01", "2013-02-30"))
          .isInstanceOf(TimeframeParseException.class)
          .hasMessage("Unresolvable date: 2013-02-30");
    }

    @Test
    void unresolvable() {
      assertThatThrownBy(() -> resolver.resolveLiteral("07/01/2013", "2013-07-31"))
          .isInstanceOf(TimeframeParseException.class)
          .hasMessage("Unresolvable date: 07/01/2013");
    }

    @Test
    void missingEnd() {
      assertThatThrownBy(() -> resolver.resolveLiteral("2013-07-01", null))
          .isInstanceOf(ReportConfigurationException.class);
    }

    @Test
    void reversed() {
      assertThatThrownBy(() -> resolver.resolveLiteral("2013-07-31", "2013-07-01"))
          .isInstanceOf(ReportConfigurationException.class);
    }
  }

  @Nested
  public class resolve {

    @Test
    void neither() {
      assertThat(resolver.resolve(new ReportOptions(), false, resolver.now())).isEmpty();
    }

    @Test
    void literal() {
      final ReportOptions options = new ReportOptions()
          .setStartDate("2013-07-01")
          .setEndDate("2013-07-02");

      assertThat(resolver.resolve(options, true, resolver.now())).contains(
          Timeframe.of(utc("2013-07-01T00:00:00"), utc("2013-07-02T00:00:00")));
    }

    @Test
    void relative() {
      final ReportOptions options = new ReportOptions().setTimeframe("today");

      assertThat(resolver.resolve(options, true, resolver.now())).contains(
          Timeframe.of(utc("2013-07-30T00:00:00"), utc("2013-07-31T00:00:00")));
    }

    @Test
    void literalAndRelativeConflict() {
      final ReportOptions options = new ReportOptions()
          .setStartDate("2013-07-01")
          .setEndDate("2013-07-02")
          .setTimeframe("today");

      assertThatThrownBy(() -> resolver.resolve(options, false, resolver.now()))
          .isInstanceOf(ReportConfigurationException.class)
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void nowFollowsClockInDefaultZone() {
    assertThat(resolver.now()).isEqualTo(utc("2013-07-30T12:00:00"));
  }
}
