package com.rackspace.timecharts.app.model;

import java.time.ZonedDateTime;
import lombok.Value;

@Value(staticConstructor = "of")
public class TimestampBounds {
  ZonedDateTime min;
  ZonedDateTime max;
}
