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

package com.rackspace.timecharts.app.aggregation;

import com.rackspace.timecharts.app.model.SeriesKey;
import com.rackspace.timecharts.app.model.TimestampBounds;
import com.rackspace.timecharts.app.schema.RelationPath;
import com.rackspace.timecharts.app.schema.SchemaReflector;
import java.util.Map;
import java.util.Set;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The data store behind a report. Implementations compute aggregates over a row set of one
 * entity; an empty {@link Mono} denotes an aggregate that could not be computed, such as the
 * sum of no rows.
 */
public interface AggregationSource {

  /**
   * @return the entity whose rows are aggregated
   */
  String getEntityName();

  SchemaReflector getSchema();

  Set<SourceCapability> getCapabilities();

  default boolean supports(SourceCapability capability) {
    return getCapabilities().contains(capability);
  }

  Mono<Number> aggregate(TimeFilter filter, Aggregation aggregation);

  /**
   * @return the smallest and largest value of <code>timestampField</code> over all rows, or
   * empty when there are no rows
   */
  Mono<TimestampBounds> timestampBounds(String timestampField);

  /**
   * Aggregates per distinct group key. Groups without matching rows are left out of the map.
   */
  Mono<Map<Object, Number>> aggregateByGroup(TimeFilter filter, RelationPath grouping,
                                             Aggregation aggregation);

  /**
   * Enumerates the distinct group keys among the rows, each with its display label, in a
   * stable order.
   */
  Flux<SeriesKey> enumerateGroups(TimeFilter filter, RelationPath grouping);
}
