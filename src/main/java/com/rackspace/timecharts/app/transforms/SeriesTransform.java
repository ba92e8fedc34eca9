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

package com.rackspace.timecharts.app.transforms;

import static com.rackspace.timecharts.app.utils.NumberUtils.add;
import static com.rackspace.timecharts.app.utils.NumberUtils.isZero;
import static com.rackspace.timecharts.app.utils.NumberUtils.subtract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Post-processing applied to the values of one series. Length-preserving transforms map every
 * cell; reducing transforms collapse the series to a single cell. A <code>null</code> cell is
 * absent.
 */
public enum SeriesTransform {
  /**
   * Difference to the previous cell: <code>[10, 12, 12, 9, 15] -&gt; [-, 2, 0, -3, 6]</code>.
   */
  growth(false) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      final List<Number> result = new ArrayList<>(data.size());
      for (int i = 0; i < data.size(); i++) {
        final Number previous = i > 0 ? data.get(i - 1) : null;
        final Number current = data.get(i);
        result.add(previous == null || current == null ? null : subtract(current, previous));
      }
      return result;
    }
  },
  /**
   * Percentage change to the previous cell, infinite when the previous cell is zero or absent.
   */
  growth_pct(false) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      final List<Number> result = new ArrayList<>(data.size());
      for (int i = 0; i < data.size(); i++) {
        if (i == 0) {
          result.add(null);
          continue;
        }
        final Number previous = data.get(i - 1);
        final Number current = data.get(i);
        if (current == null) {
          result.add(null);
        } else if (previous == null || isZero(previous)) {
          result.add(Double.POSITIVE_INFINITY);
        } else {
          result.add(((current.doubleValue() - previous.doubleValue()) * 100.0)
              / previous.doubleValue());
        }
      }
      return result;
    }
  },
  /**
   * Running total on top of a baseline, which defaults to zero. Absent cells stay absent and
   * do not contribute.
   */
  cumulative(true) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      Number total = argument == null ? 0L : argument;
      final List<Number> result = new ArrayList<>(data.size());
      for (Number value : data) {
        if (value == null) {
          result.add(null);
        } else {
          total = add(total, value);
          result.add(total);
        }
      }
      return result;
    }
  },
  /**
   * Substitutes absent cells with the argument, zero by default.
   */
  replace_nulls(true) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      final Number replacement = argument == null ? 0L : argument;
      return data.stream()
          .map(value -> value == null ? replacement : value)
          .collect(Collectors.toList());
    }
  },
  /**
   * Subtracts the argument, zero by default, from every present cell.
   */
  relative_to(true) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      final Number normal = argument == null ? 0L : argument;
      final List<Number> result = new ArrayList<>(data.size());
      for (Number value : data) {
        result.add(value == null ? null : subtract(value, normal));
      }
      return result;
    }
  },
  avg(false) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      return Collections.singletonList(mean(data));
    }
  },
  stddev(false) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      final Number variance = variance(data);
      return Collections.singletonList(
          variance == null ? null : Math.sqrt(variance.doubleValue()));
    }
  },
  /**
   * <code>mean((x / mean)^2)</code> over the present cells. This is not the textbook variance;
   * existing consumers depend on these numbers.
   */
  variance(false) {
    @Override
    public List<Number> apply(List<Number> data, Number argument) {
      return Collections.singletonList(variance(data));
    }
  };

  private final boolean takesArgument;

  SeriesTransform(boolean takesArgument) {
    this.takesArgument = takesArgument;
  }

  /**
   * @param argument optional parameter of the transform, such as the baseline of
   * {@link #cumulative}, or null for its default
   */
  public abstract List<Number> apply(List<Number> data, Number argument);

  /**
   * Whether <code>name:argument</code> is meaningful for this transform. Arguments given to any
   * other transform are ignored.
   */
  public boolean takesArgument() {
    return takesArgument;
  }

  public static Optional<SeriesTransform> fromName(String name) {
    return Arrays.stream(values())
        .filter(transform -> transform.name().equals(name))
        .findFirst();
  }

  private static Double mean(List<Number> data) {
    final List<Number> present = present(data);
    if (present.isEmpty()) {
      return null;
    }
    return present.stream().mapToDouble(Number::doubleValue).sum() / present.size();
  }

  private static Double variance(List<Number> data) {
    final Double mean = mean(data);
    if (mean == null || mean == 0.0) {
      return null;
    }
    final List<Number> present = present(data);
    return present.stream()
        .mapToDouble(value -> Math.pow(value.doubleValue() / mean, 2))
        .sum() / present.size();
  }

  private static List<Number> present(List<Number> data) {
    return data.stream().filter(Objects::nonNull).collect(Collectors.toList());
  }
}
