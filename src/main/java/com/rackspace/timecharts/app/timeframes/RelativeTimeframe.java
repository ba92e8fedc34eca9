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

package com.rackspace.timecharts.app.timeframes;

import com.rackspace.timecharts.app.errors.TimeframeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * A parsed relative timeframe expression such as <code>this_week</code>,
 * <code>previous_3_months</code> or <code>yesterday</code>.
 */
@Value
public class RelativeTimeframe {

  public static final String SPAN_PATTERN = "^(this|previous|last)_([0-9]+)_(\\w+)s$";
  public static final String SINGLE_PATTERN = "^(this|previous|last)_(\\w+)$";

  private static final Pattern SPAN = Pattern.compile(SPAN_PATTERN);
  private static final Pattern SINGLE = Pattern.compile(SINGLE_PATTERN);

  private static final Map<String, String> ALIASES = Map.of(
      "yesterday", "previous_1_days",
      "today", "this_1_days"
  );

  private static final Map<String, Integer> OFFSETS = Map.of(
      "this", 0,
      "previous", -1,
      "last", -1
  );

  TimeframeUnit unit;
  int offset;
  int span;

  /**
   * @throws TimeframeParseException when the text does not follow the grammar
   * @throws com.rackspace.timecharts.app.errors.UnknownUnitException when the unit is unknown
   */
  public static RelativeTimeframe parse(String text) {
    if (text == null) {
      throw new TimeframeParseException("Unrecognized timeframe format: null");
    }
    final String expression = ALIASES.getOrDefault(text, text);

    Matcher match = SPAN.matcher(expression);
    if (match.matches()) {
      return new RelativeTimeframe(
          TimeframeUnit.fromName(match.group(3)),
          OFFSETS.get(match.group(1)),
          parseSpan(match.group(2), text));
    }

    match = SINGLE.matcher(expression);
    if (match.matches()) {
      return new RelativeTimeframe(
          TimeframeUnit.fromName(match.group(2)), OFFSETS.get(match.group(1)), 1);
    }

    throw new TimeframeParseException("Unrecognized timeframe format: " + text);
  }

  private static int parseSpan(String span, String text) {
    try {
      return Integer.parseInt(span);
    } catch (NumberFormatException e) {
      throw new TimeframeParseException("Unrecognized timeframe span: " + text, e);
    }
  }
}
