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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of named reports, built once at startup and safe to read concurrently.
 */
public class ReportRegistry {

  private final Map<String, Report> reports;

  public ReportRegistry(Map<String, Report> reports) {
    this.reports = Map.copyOf(reports);
  }

  public Optional<Report> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(reports.get(name));
  }

  public Set<String> names() {
    return reports.keySet();
  }
}
