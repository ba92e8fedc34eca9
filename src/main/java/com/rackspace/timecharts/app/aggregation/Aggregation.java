package com.rackspace.timecharts.app.aggregation;

import java.util.Locale;
import lombok.Value;

@Value(staticConstructor = "of")
public class Aggregation {

  public static final String PATH_SEPARATOR = ".";

  AggregationFunction function;
  String field;

  /**
   * @return the name of the aggregation, such as <code>sum_value</code>
   */
  public String label() {
    return (function.name() + "_" + field).toLowerCase(Locale.ROOT);
  }

  /**
   * @return this aggregation with its field reached through <code>relationPath</code>
   */
  public Aggregation routedThrough(String relationPath) {
    return Aggregation.of(function, relationPath + PATH_SEPARATOR + field);
  }
}
