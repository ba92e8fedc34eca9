package com.rackspace.timecharts.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.Data;

@Data
public class TimeframeMetadata {
  ZonedDateTime start;
  ZonedDateTime end;

  @JsonInclude(Include.NON_NULL)
  List<Timeframe> periods;
}
