package com.rackspace.timecharts.app.aggregation;

import java.time.ZonedDateTime;
import lombok.Value;

/**
 * Restriction of rows by a timestamp-bearing field. A null bound is open.
 */
@Value
public class TimeFilter {

  private static final TimeFilter UNRESTRICTED = new TimeFilter(null, null, null);

  String field;
  /** inclusive */
  ZonedDateTime start;
  /** exclusive */
  ZonedDateTime end;

  public static TimeFilter unrestricted() {
    return UNRESTRICTED;
  }

  public static TimeFilter between(String field, ZonedDateTime start, ZonedDateTime end) {
    return new TimeFilter(field, start, end);
  }

  public static TimeFilter before(String field, ZonedDateTime end) {
    return new TimeFilter(field, null, end);
  }

  public boolean isUnrestricted() {
    return start == null && end == null;
  }

  public boolean matches(ZonedDateTime timestamp) {
    if (isUnrestricted()) {
      return true;
    }
    if (timestamp == null) {
      return false;
    }
    return (start == null || !timestamp.isBefore(start))
        && (end == null || timestamp.isBefore(end));
  }
}
