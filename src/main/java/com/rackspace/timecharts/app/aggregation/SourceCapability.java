package com.rackspace.timecharts.app.aggregation;

public enum SourceCapability {
  /**
   * Aggregates per distinct key and enumerates the keys.
   */
  GROUPING,
  /**
   * Groups by entities reached through a reverse relation of the aggregated entity.
   */
  REVERSE_RELATIONS,
  /**
   * Reports the minimum and maximum of a timestamp field.
   */
  BOUNDARY_DISCOVERY
}
