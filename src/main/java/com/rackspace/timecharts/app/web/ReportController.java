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

package com.rackspace.timecharts.app.web;

import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.ReportResult;
import com.rackspace.timecharts.app.services.ReportQueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Report query API. Every report option is passed as a query parameter; <code>transforms</code>
 * may be repeated or pipe-separated.
 */
@RestController
@RequestMapping("/api/report")
public class ReportController {

  private final ReportQueryService reportQueryService;

  @Autowired
  public ReportController(ReportQueryService reportQueryService) {
    this.reportQueryService = reportQueryService;
  }

  @GetMapping
  public Mono<ReportResult> report(@RequestParam MultiValueMap<String, String> allParams) {
    return reportQueryService.query(ReportOptions.fromParams(allParams));
  }
}
