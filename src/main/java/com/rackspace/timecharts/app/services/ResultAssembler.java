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

package com.rackspace.timecharts.app.services;

import com.rackspace.timecharts.app.errors.EmptyResultException;
import com.rackspace.timecharts.app.model.Datashape;
import com.rackspace.timecharts.app.model.QueryMetadata;
import com.rackspace.timecharts.app.model.ReportResult;
import com.rackspace.timecharts.app.model.Series;
import com.rackspace.timecharts.app.model.Timeframe;
import com.rackspace.timecharts.app.model.TimeframeMetadata;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds the report document: the series plus an echo of the resolved query.
 */
@Component
public class ResultAssembler {

  /**
   * @param query the resolved query echo; its timeframe and datashape are filled in here
   * @param timeframe the effective timeframe, or null when the report has none
   * @param periods the division of the timeframe, or null when no division was requested
   */
  public ReportResult assemble(QueryMetadata query, Timeframe timeframe, List<Timeframe> periods,
                               List<Series> series) {
    final TimeframeMetadata timeframeMetadata = new TimeframeMetadata();
    if (timeframe != null) {
      timeframeMetadata.setStart(timeframe.getStart()).setEnd(timeframe.getEnd());
    }
    if (periods != null) {
      timeframeMetadata.setPeriods(new ArrayList<>(periods));
    }

    if (query.getTransforms() != null && query.getTransforms().isEmpty()) {
      query.setTransforms(null);
    }
    if (StringUtils.isBlank(query.getGroupBy())) {
      query.setGroupBy(null);
    }

    query.setTimeframe(timeframeMetadata)
        .setDatashape(sniffDatashape(series));

    return new ReportResult()
        .setQuery(query)
        .setSeries(series);
  }

  /**
   * Classifies the result by its number of series and of values per series.
   *
   * @throws EmptyResultException when the series list or the data of a series is missing
   */
  public static Datashape sniffDatashape(List<Series> series) {
    if (series == null) {
      throw new EmptyResultException("No series found in data frame");
    }
    for (Series each : series) {
      if (each.getData() == null) {
        throw new EmptyResultException("No values found in data subframe of " + each.getId());
      }
    }

    if (series.isEmpty()) {
      return Datashape.EMPTY;
    }
    final int values = series.get(0).getData().size();
    if (values == 0) {
      return Datashape.EMPTY;
    }
    if (series.size() == 1) {
      return values == 1 ? Datashape.SCALAR : Datashape.SINGLE_SERIES;
    }
    return values == 1 ? Datashape.SINGLE_FRAME : Datashape.MULTI_SERIES;
  }
}
