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

package com.rackspace.timecharts.app.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.timecharts.app.errors.TimeframeParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DateTimeUtilsTest {

  static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  @Test
  public void localizeAmbiguousUsesStandardOffset() {
    final ZonedDateTime result =
        DateTimeUtils.localize(LocalDateTime.parse("2013-11-03T01:30:00"), NEW_YORK);

    assertThat(result.getOffset()).isEqualTo(ZoneOffset.ofHours(-5));
  }

  @Test
  public void localizeGapShiftsForward() {
    final ZonedDateTime result =
        DateTimeUtils.localize(LocalDateTime.parse("2013-03-10T02:30:00"), NEW_YORK);

    assertThat(result.toLocalDateTime()).isEqualTo(LocalDateTime.parse("2013-03-10T03:30:00"));
    assertThat(result.getOffset()).isEqualTo(ZoneOffset.ofHours(-4));
  }

  @Test
  public void coerceToZoned() {
    final ZoneId utc = ZoneId.of("UTC");

    assertThat(DateTimeUtils.coerceToZoned(LocalDate.of(2013, 7, 1), utc))
        .isEqualTo(ZonedDateTime.of(2013, 7, 1, 0, 0, 0, 0, utc));
    assertThat(DateTimeUtils.coerceToZoned(Instant.parse("2013-07-01T05:00:00Z"), utc))
        .isEqualTo(ZonedDateTime.of(2013, 7, 1, 5, 0, 0, 0, utc));
    assertThat(DateTimeUtils.coerceToZoned(
        OffsetDateTime.parse("2013-07-01T05:00:00+02:00"), utc).getOffset())
        .isEqualTo(ZoneOffset.ofHours(2));
  }

  @Test
  public void parseDate() {
    assertThat(DateTimeUtils.parseDate("2013-07-01", List.of("MM/dd/yyyy", "yyyy-MM-dd"),
        NEW_YORK))
        .isEqualTo(ZonedDateTime.of(2013, 7, 1, 0, 0, 0, 0, NEW_YORK));
  }

  @Test
  public void parseDate_Invalid() {
    assertThatThrownBy(() -> DateTimeUtils.parseDate("July 1st", List.of("yyyy-MM-dd"),
        NEW_YORK))
        .isInstanceOf(TimeframeParseException.class)
        .hasMessage("Unresolvable date: July 1st");
  }

  @Test
  public void parseDate_ImpossibleDay() {
    assertThatThrownBy(() -> DateTimeUtils.parseDate("2013-02-30", List.of("uuuu-MM-dd"),
        NEW_YORK))
        .isInstanceOf(TimeframeParseException.class)
        .hasMessage("Unresolvable date: 2013-02-30");
    assertThatThrownBy(() -> DateTimeUtils.parseDate("02/29/2013", List.of("MM/dd/yyyy"),
        NEW_YORK))
        .isInstanceOf(TimeframeParseException.class);
    assertThat(DateTimeUtils.parseDate("02/29/2012", List.of("MM/dd/yyyy"), NEW_YORK))
        .isEqualTo(ZonedDateTime.of(2012, 2, 29, 0, 0, 0, 0, NEW_YORK));
  }

  @Test
  public void strictFormatterKeepsQuotedLiterals() {
    assertThat(DateTimeUtils.strictFormatter("yyyy'y'MM").format(LocalDate.of(2013, 7, 1)))
        .isEqualTo("2013y07");
  }

  @Test
  public void formatTimestamp() {
    final ZoneId utc = ZoneId.of("UTC");

    assertThat(DateTimeUtils.formatTimestamp(ZonedDateTime.of(2013, 7, 1, 0, 0, 0, 0, utc)))
        .isEqualTo("2013-07-01T00:00:00Z");
    assertThat(DateTimeUtils.formatTimestamp(
        ZonedDateTime.of(2013, 7, 1, 0, 0, 5, 123_456_789, utc)))
        .isEqualTo("2013-07-01T00:00:05.123Z");
    assertThat(DateTimeUtils.formatTimestamp(
        ZonedDateTime.of(2013, 7, 1, 0, 0, 0, 0, NEW_YORK)))
        .isEqualTo("2013-07-01T00:00:00-04:00");
  }

  @Test
  public void formatDuration() {
    assertThat(DateTimeUtils.formatDuration(Duration.ofHours(1))).isEqualTo("3600.0");
    assertThat(DateTimeUtils.formatDuration(Duration.ofMillis(1500))).isEqualTo("1.5");
  }
}
