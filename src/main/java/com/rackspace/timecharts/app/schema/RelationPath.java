package com.rackspace.timecharts.app.schema;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Result of following a grouping path from an entity: the entity the path arrives at, the
 * path leading from that entity back to the original one, and the plain field the path ends
 * with, if any.
 */
@Value(staticConstructor = "of")
public class RelationPath {
  String targetEntity;
  /**
   * Empty when the grouping path does not cross any relation.
   */
  String reversePath;
  String terminalField;

  public boolean hasReverseRelation() {
    return StringUtils.isNotEmpty(reversePath);
  }
}
