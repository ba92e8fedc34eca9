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

package com.rackspace.timecharts.app.timeframes;

import static com.rackspace.timecharts.app.utils.DateTimeUtils.localize;

import com.rackspace.timecharts.app.errors.UnknownUnitException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;

/**
 * Units that timeframes are expressed in and divided by. Each unit knows its rolling and its
 * quantized boundaries.
 * <p>
 * Minute and hour arithmetic runs on the instant time-line. Day and larger units move the
 * local date and re-localize, so a day stays midnight to midnight across daylight saving
 * changes. Month, quarter and year moves clamp the day of month to the last valid day of the
 * target month, for example March 31 minus one month is February 28 (29 in leap years).
 */
public enum TimeframeUnit {
  minute {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return timestamp.plusMinutes(offset);
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      return truncateLocal(timestamp, ChronoUnit.MINUTES).plusMinutes(offset);
    }
  },
  hour {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return timestamp.plusHours(offset);
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      return truncateLocal(timestamp, ChronoUnit.HOURS).plusHours(offset);
    }
  },
  day {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return moveLocal(timestamp, timestamp.toLocalDateTime().plusDays(offset));
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      return startOfDay(timestamp, timestamp.toLocalDate().plusDays(offset));
    }
  },
  week {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return moveLocal(timestamp, timestamp.toLocalDateTime().plusWeeks(offset));
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      final LocalDate date = timestamp.toLocalDate();
      final int daysIntoWeek =
          Math.floorMod(date.getDayOfWeek().getValue() - weekStart.getValue(), 7);
      return startOfDay(timestamp, date.minusDays(daysIntoWeek).plusWeeks(offset));
    }
  },
  month {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return moveLocal(timestamp, timestamp.toLocalDateTime().plusMonths(offset));
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      return startOfDay(timestamp, timestamp.toLocalDate().withDayOfMonth(1).plusMonths(offset));
    }
  },
  quarter {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return month.rollingFloor(timestamp, offset * 3);
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      final LocalDate shifted = timestamp.toLocalDate().withDayOfMonth(1).plusMonths(offset * 3);
      final int quarterMonth = ((shifted.getMonthValue() - 1) / 3) * 3 + 1;
      return startOfDay(timestamp, shifted.withMonth(quarterMonth));
    }
  },
  year {
    @Override
    ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset) {
      return moveLocal(timestamp, timestamp.toLocalDateTime().plusYears(offset));
    }

    @Override
    ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset, DayOfWeek weekStart) {
      return startOfDay(timestamp, LocalDate.of(timestamp.getYear(), 1, 1).plusYears(offset));
    }
  };

  abstract ZonedDateTime rollingFloor(ZonedDateTime timestamp, long offset);

  abstract ZonedDateTime quantizedFloor(ZonedDateTime timestamp, long offset,
                                        DayOfWeek weekStart);

  /**
   * @param mode rolling or calendar-aligned boundaries
   * @param weekStart first day of the week, only consulted by quantized weeks
   * @return the floor function of this unit under <code>mode</code>
   */
  public FloorStrategy floorStrategy(AlignmentMode mode, DayOfWeek weekStart) {
    if (mode == AlignmentMode.QUANTIZED) {
      return (timestamp, offset) -> quantizedFloor(timestamp, offset, weekStart);
    }
    return this::rollingFloor;
  }

  public static TimeframeUnit fromName(String name) {
    return Arrays.stream(values())
        .filter(unit -> unit.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new UnknownUnitException(name));
  }

  private static ZonedDateTime truncateLocal(ZonedDateTime timestamp, ChronoUnit unit) {
    return moveLocal(timestamp, timestamp.toLocalDateTime().truncatedTo(unit));
  }

  private static ZonedDateTime startOfDay(ZonedDateTime timestamp, LocalDate date) {
    return moveLocal(timestamp, date.atStartOfDay());
  }

  private static ZonedDateTime moveLocal(ZonedDateTime timestamp, LocalDateTime local) {
    return localize(local, timestamp.getZone());
  }
}
