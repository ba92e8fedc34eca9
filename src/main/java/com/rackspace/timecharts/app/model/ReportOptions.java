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

package com.rackspace.timecharts.app.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

/**
 * Typed form of the flat report option map. Values that were not supplied stay
 * <code>null</code> so that report definitions can layer their own defaults underneath the
 * caller's choices.
 */
@Data
public class ReportOptions {

  public static final String METRIC = "metric";
  public static final String TIMEFRAME = "timeframe";
  public static final String START_DATE = "start_date";
  public static final String END_DATE = "end_date";
  public static final String TIME_DIVISIONS = "time_divisions";
  public static final String TIMESTAMP_RELATION = "timestamp_relation";
  public static final String TIMEFRAME_LIMITER = "timeframe_limiter";
  public static final String AGGREGATE_TYPE = "aggregate_type";
  public static final String AGGREGATE_FIELD = "aggregate_field";
  public static final String GROUP_BY = "group_by";
  public static final String TRANSFORMS = "transforms";
  public static final String QUANTIZE = "quantize";

  private static final String TRANSFORM_DELIMITER = "|";

  String metric;
  String timeframe;
  String startDate;
  String endDate;
  String timeDivisions;
  String timestampRelation;
  String timeframeLimiter;
  String aggregateType;
  String aggregateField;
  String groupBy;
  List<String> transforms = new ArrayList<>();
  boolean quantize;

  /**
   * Builds options from request parameters where each key may carry several values. Only
   * <code>transforms</code> honours repeated values; every other key uses its first value.
   */
  public static ReportOptions fromParams(Map<String, List<String>> params) {
    return new ReportOptions()
        .setMetric(first(params, METRIC))
        .setTimeframe(first(params, TIMEFRAME))
        .setStartDate(first(params, START_DATE))
        .setEndDate(first(params, END_DATE))
        .setTimeDivisions(first(params, TIME_DIVISIONS))
        .setTimestampRelation(first(params, TIMESTAMP_RELATION))
        .setTimeframeLimiter(first(params, TIMEFRAME_LIMITER))
        .setAggregateType(first(params, AGGREGATE_TYPE))
        .setAggregateField(first(params, AGGREGATE_FIELD))
        .setGroupBy(first(params, GROUP_BY))
        .setTransforms(parseTransforms(params.getOrDefault(TRANSFORMS, List.of())))
        .setQuantize(parseBoolean(first(params, QUANTIZE)));
  }

  /**
   * Normalizes the transform parameter, which may be given as a pipe-delimited string, as
   * repeated values, or both, into one ordered list of transform names.
   */
  public static List<String> parseTransforms(List<String> values) {
    if (values == null) {
      return new ArrayList<>();
    }
    return values.stream()
        .filter(StringUtils::isNotBlank)
        .flatMap(value -> Arrays.stream(StringUtils.split(value, TRANSFORM_DELIMITER)))
        .map(String::trim)
        .filter(StringUtils::isNotEmpty)
        .collect(Collectors.toCollection(ArrayList::new));
  }

  static boolean parseBoolean(String value) {
    return "1".equals(value) || Boolean.parseBoolean(value);
  }

  private static String first(Map<String, List<String>> params, String key) {
    final List<String> values = params.get(key);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return StringUtils.trimToNull(values.get(0));
  }

  public ReportOptions copy() {
    return new ReportOptions()
        .setMetric(metric)
        .setTimeframe(timeframe)
        .setStartDate(startDate)
        .setEndDate(endDate)
        .setTimeDivisions(timeDivisions)
        .setTimestampRelation(timestampRelation)
        .setTimeframeLimiter(timeframeLimiter)
        .setAggregateType(aggregateType)
        .setAggregateField(aggregateField)
        .setGroupBy(groupBy)
        .setTransforms(new ArrayList<>(transforms))
        .setQuantize(quantize);
  }
}
