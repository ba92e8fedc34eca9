package com.rackspace.timecharts.app.services;

import com.rackspace.timecharts.app.model.ReportOptions;
import com.rackspace.timecharts.app.model.ReportResult;
import reactor.core.publisher.Mono;

@FunctionalInterface
public interface Report {

  Mono<ReportResult> run(ReportOptions options);
}
