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

import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import com.rackspace.timecharts.app.model.Series;
import com.rackspace.timecharts.app.transforms.SeriesTransform;
import com.rackspace.timecharts.app.transforms.TransformStep;
import com.rackspace.timecharts.app.utils.NumberUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Applies requested transforms, in order, to each series independently. Names that do not
 * denote a transform are skipped without error.
 */
@Component
@Slf4j
public class TransformPipeline {

  private static final String ARGUMENT_SEPARATOR = ":";

  /**
   * @param names transform names, each optionally followed by <code>:argument</code>
   * @return the recognized transforms in request order
   * @throws ReportConfigurationException when a transform that takes an argument is given a
   * malformed one
   */
  public List<TransformStep> resolve(List<String> names) {
    final List<TransformStep> steps = new ArrayList<>();
    for (String requested : names) {
      final String name = StringUtils.substringBefore(requested, ARGUMENT_SEPARATOR);
      final Optional<SeriesTransform> transform = SeriesTransform.fromName(name);
      if (transform.isEmpty()) {
        log.debug("Skipping unrecognized transform {}", requested);
        continue;
      }
      final Number argument =
          transform.get().takesArgument() ? parseArgument(requested) : null;
      steps.add(TransformStep.of(transform.get(), argument));
    }
    return steps;
  }

  public Series apply(List<TransformStep> steps, Series series) {
    List<Number> data = series.getData();
    for (TransformStep step : steps) {
      data = step.getTransform().apply(data, step.getArgument());
    }
    return series.withData(data);
  }

  public List<Series> apply(List<TransformStep> steps, List<Series> series) {
    if (steps.isEmpty()) {
      return series;
    }
    final List<Series> transformed = new ArrayList<>(series.size());
    for (Series each : series) {
      transformed.add(apply(steps, each));
    }
    return transformed;
  }

  private static Number parseArgument(String requested) {
    if (!requested.contains(ARGUMENT_SEPARATOR)) {
      return null;
    }
    final String argument = StringUtils.substringAfter(requested, ARGUMENT_SEPARATOR);
    try {
      return NumberUtils.parse(argument);
    } catch (NumberFormatException e) {
      throw new ReportConfigurationException(
          String.format("Invalid argument '%s' for transform %s", argument, requested));
    }
  }
}
