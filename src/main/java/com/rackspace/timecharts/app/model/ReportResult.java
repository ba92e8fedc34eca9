package com.rackspace.timecharts.app.model;

import java.util.List;
import lombok.Data;

@Data
public class ReportResult {
  QueryMetadata query;
  List<Series> series;
}
