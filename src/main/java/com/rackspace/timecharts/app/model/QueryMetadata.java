package com.rackspace.timecharts.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.Data;

/**
 * Echo of the resolved query parameters that produced a {@link ReportResult}.
 */
@Data
@JsonInclude(Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryMetadata {
  TimeframeMetadata timeframe;
  String aggregateType;
  String aggregateField;
  List<String> transforms;
  String timeDivisions;
  String groupBy;
  Datashape datashape;
}
