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

package com.rackspace.timecharts.app.repos;

import com.rackspace.timecharts.app.aggregation.Aggregation;
import com.rackspace.timecharts.app.aggregation.AggregationFunction;
import com.rackspace.timecharts.app.aggregation.AggregationSource;
import com.rackspace.timecharts.app.aggregation.SourceCapability;
import com.rackspace.timecharts.app.aggregation.TimeFilter;
import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.DailyMetric;
import com.rackspace.timecharts.app.model.SeriesKey;
import com.rackspace.timecharts.app.model.TimestampBounds;
import com.rackspace.timecharts.app.schema.EntitySchemaReflector;
import com.rackspace.timecharts.app.schema.RelationPath;
import com.rackspace.timecharts.app.schema.SchemaReflector;
import com.rackspace.timecharts.app.utils.DateTimeUtils;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Aggregates the rows of a single daily metric. Dates are treated as the start of that day in
 * the configured zone.
 */
public class DailyMetricSource implements AggregationSource {

  static final String ENTITY = "DailyMetric";
  static final String PK = "pk";
  static final String SOURCE = "source";
  static final String METRIC = "metric";
  static final String DATE = "date";
  static final String VALUE = "value";

  private static final SchemaReflector SCHEMA = EntitySchemaReflector.builder()
      .entity(ENTITY, PK, SOURCE, METRIC, DATE, VALUE)
      .build();

  private static final Set<SourceCapability> CAPABILITIES =
      Set.of(SourceCapability.GROUPING, SourceCapability.BOUNDARY_DISCOVERY);

  private final Supplier<List<DailyMetric>> rows;
  private final ZoneId zone;

  DailyMetricSource(Supplier<List<DailyMetric>> rows, ZoneId zone) {
    this.rows = rows;
    this.zone = zone;
  }

  @Override
  public String getEntityName() {
    return ENTITY;
  }

  @Override
  public SchemaReflector getSchema() {
    return SCHEMA;
  }

  @Override
  public Set<SourceCapability> getCapabilities() {
    return CAPABILITIES;
  }

  @Override
  public Mono<Number> aggregate(TimeFilter filter, Aggregation aggregation) {
    return Mono.fromCallable(() -> compute(filtered(filter), aggregation));
  }

  @Override
  public Mono<TimestampBounds> timestampBounds(String timestampField) {
    return Mono.defer(() -> {
      requireTimestampField(timestampField);
      final List<ZonedDateTime> timestamps = rows.get().stream()
          .map(this::timestampOf)
          .sorted()
          .collect(Collectors.toList());
      return timestamps.isEmpty() ? Mono.empty()
          : Mono.just(TimestampBounds.of(
              timestamps.get(0), timestamps.get(timestamps.size() - 1)));
    });
  }

  @Override
  public Mono<Map<Object, Number>> aggregateByGroup(TimeFilter filter, RelationPath grouping,
                                                    Aggregation aggregation) {
    return Mono.fromCallable(() -> {
      final Function<DailyMetric, Object> groupKey = fieldAccessor(groupField(grouping));
      final Map<Object, List<DailyMetric>> groups = filtered(filter)
          .filter(row -> groupKey.apply(row) != null)
          .collect(Collectors.groupingBy(groupKey, LinkedHashMap::new, Collectors.toList()));

      final Map<Object, Number> results = new LinkedHashMap<>();
      groups.forEach((key, members) -> {
        final Number value = compute(members.stream(), aggregation);
        if (value != null) {
          results.put(key, value);
        }
      });
      return results;
    });
  }

  /**
   * Groups come out in the order they are first seen. Rows are held in date order.
   */
  @Override
  public Flux<SeriesKey> enumerateGroups(TimeFilter filter, RelationPath grouping) {
    return Flux.defer(() -> {
      final Function<DailyMetric, Object> groupKey = fieldAccessor(groupField(grouping));
      return Flux.fromStream(filtered(filter)
          .map(groupKey)
          .filter(Objects::nonNull)
          .distinct()
          .map(key -> SeriesKey.of(key, label(key))));
    });
  }

  private Stream<DailyMetric> filtered(TimeFilter filter) {
    if (!filter.isUnrestricted()) {
      requireTimestampField(filter.getField());
    }
    return rows.get().stream()
        .filter(row -> filter.matches(timestampOf(row)));
  }

  private Number compute(Stream<DailyMetric> selected, Aggregation aggregation) {
    final Function<DailyMetric, Object> accessor = fieldAccessor(aggregation.getField());
    if (aggregation.getFunction() == AggregationFunction.count) {
      return selected.map(accessor).filter(Objects::nonNull).count();
    }
    return selected.map(accessor)
        .map(value -> requireNumeric(value, aggregation))
        .collect(AggregateCollectors.of(aggregation.getFunction()));
  }

  private Function<DailyMetric, Object> fieldAccessor(String field) {
    switch (field) {
      case PK:
        return DailyMetric::getId;
      case SOURCE:
        return DailyMetric::getSource;
      case METRIC:
        return DailyMetric::getMetric;
      case DATE:
        return this::timestampOf;
      case VALUE:
        return DailyMetric::getValue;
      default:
        throw new ReportConfigurationException(
            String.format("Unknown field %s on %s", field, ENTITY));
    }
  }

  private ZonedDateTime timestampOf(DailyMetric row) {
    return DateTimeUtils.localize(row.getDate().atStartOfDay(), zone);
  }

  private static String groupField(RelationPath grouping) {
    if (grouping.getTerminalField() == null) {
      throw new ReportConfigurationException(
          "Grouping requires a field of " + grouping.getTargetEntity());
    }
    return grouping.getTerminalField();
  }

  private static void requireTimestampField(String field) {
    if (!DATE.equals(field)) {
      throw new ReportConfigurationException(
          String.format("Field %s of %s does not hold timestamps", field, ENTITY));
    }
  }

  private static Number requireNumeric(Object value, Aggregation aggregation) {
    if (value == null || value instanceof Number) {
      return (Number) value;
    }
    throw new ReportConfigurationException(String.format(
        "Cannot compute %s over non-numeric field %s",
        aggregation.getFunction(), aggregation.getField()));
  }

  private static String label(Object key) {
    return key instanceof ZonedDateTime ? DateTimeUtils.formatTimestamp((ZonedDateTime) key)
        : String.valueOf(key);
  }
}
