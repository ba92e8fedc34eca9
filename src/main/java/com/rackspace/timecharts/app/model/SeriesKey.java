package com.rackspace.timecharts.app.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class SeriesKey {
  Object id;
  String name;
}
