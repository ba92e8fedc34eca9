package com.rackspace.timecharts.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One identified sequence of per-period values. A <code>null</code> element is an absent cell,
 * meaning no aggregate was computed for it, which is different from zero.
 */
@Data
@NoArgsConstructor
public class Series {
  Object id;
  String name;
  List<Number> data;

  public Series(Object id, String name, List<Number> data) {
    this.id = id;
    this.name = name;
    this.data = data;
  }

  public static Series of(SeriesKey key, List<Number> data) {
    return new Series(key.getId(), key.getName(), data);
  }

  public Series withData(List<Number> replacement) {
    return new Series(id, name, new ArrayList<>(replacement));
  }
}
