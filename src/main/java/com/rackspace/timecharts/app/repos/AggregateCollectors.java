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

import com.rackspace.timecharts.app.aggregation.AggregationFunction;
import com.rackspace.timecharts.app.utils.NumberUtils;
import java.util.stream.Collector;

/**
 * Collectors computing an {@link AggregationFunction} over a stream of field values. Null values
 * are skipped. Every function other than <code>count</code> yields null over no values.
 */
public class AggregateCollectors {

  public static Collector<Number, Accumulator, Number> of(AggregationFunction function) {
    return Collector.of(
        Accumulator::new,
        Accumulator::add,
        Accumulator::combine,
        acc -> acc.result(function)
    );
  }

  static class Accumulator {
    long count;
    Number sum;
    Number min;
    Number max;
    // running mean and sum of squared deviations
    double mean;
    double m2;

    void add(Number value) {
      if (value == null) {
        return;
      }
      count++;
      sum = sum == null ? value : NumberUtils.add(sum, value);
      min = min == null || compare(value, min) < 0 ? value : min;
      max = max == null || compare(value, max) > 0 ? value : max;
      final double delta = value.doubleValue() - mean;
      mean += delta / count;
      m2 += delta * (value.doubleValue() - mean);
    }

    Accumulator combine(Accumulator other) {
      if (other.count == 0) {
        return this;
      }
      if (count == 0) {
        return other;
      }
      final long total = count + other.count;
      final double delta = other.mean - mean;
      m2 = m2 + other.m2 + delta * delta * count * other.count / total;
      mean = mean + delta * other.count / total;
      count = total;
      sum = NumberUtils.add(sum, other.sum);
      min = compare(other.min, min) < 0 ? other.min : min;
      max = compare(other.max, max) > 0 ? other.max : max;
      return this;
    }

    Number result(AggregationFunction function) {
      if (function == AggregationFunction.count) {
        return count;
      }
      if (count == 0) {
        return null;
      }
      switch (function) {
        case sum:
          return sum;
        case avg:
          return sum.doubleValue() / count;
        case min:
          return min;
        case max:
          return max;
        case variance:
          return m2 / count;
        case stddev:
          return Math.sqrt(m2 / count);
        default:
          throw new IllegalStateException("Unhandled aggregation function: " + function);
      }
    }

    private static int compare(Number lhs, Number rhs) {
      return NumberUtils.toBigDecimal(lhs).compareTo(NumberUtils.toBigDecimal(rhs));
    }
  }
}
