package com.rackspace.timecharts.app.transforms;

import lombok.Value;

/**
 * A transform together with its optional argument, written <code>name:argument</code>.
 */
@Value(staticConstructor = "of")
public class TransformStep {
  SeriesTransform transform;
  Number argument;
}
