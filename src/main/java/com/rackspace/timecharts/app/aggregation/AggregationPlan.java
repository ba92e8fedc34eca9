package com.rackspace.timecharts.app.aggregation;

import com.rackspace.timecharts.app.model.Timeframe;
import java.util.List;
import lombok.Data;

/**
 * Everything needed to compute the aligned cells of a report.
 */
@Data
public class AggregationPlan {
  Aggregation aggregation;
  TimeframeLimiter limiter = TimeframeLimiter.standard;
  String timestampField;
  /**
   * The effective timeframe spanned by all periods, null when the report has none.
   */
  Timeframe timeframe;
  List<Timeframe> periods = List.of();
  /**
   * Whether the timeframe was divided by a unit; a division may produce no periods at all.
   */
  boolean divided;
  String groupBy;
}
