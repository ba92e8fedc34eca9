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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonProperty.Access;
import java.math.BigDecimal;
import java.time.LocalDate;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;
import lombok.Data;

/**
 * A single value recorded for a source and metric on one calendar day. The combination of
 * source, metric and date is unique.
 */
@Data
public class DailyMetric {

  /**
   * Assigned by the store when the metric is first saved.
   */
  @JsonProperty(access = Access.READ_ONLY)
  Long id;

  @NotBlank
  @Pattern(regexp = "[^:]*", message = "must not contain ':'")
  @Size(max = 50)
  String source;

  @NotBlank
  @Size(max = 50)
  String metric;

  @NotNull
  LocalDate date;

  @NotNull
  BigDecimal value;

  @JsonIgnore
  public String getSourceMetric() {
    return source + ":" + metric;
  }
}
