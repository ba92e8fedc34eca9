package com.rackspace.timecharts.app.schema;

/**
 * Resolves grouping paths against a data model.
 */
public interface SchemaReflector {

  /**
   * Follows a dotted path of relations, optionally ending in a plain field, from
   * <code>entity</code>.
   * <p>
   * For example when a comment has a foreign key to its post and one to its user, reflecting
   * <code>comment.post</code> from user yields target entity post with reverse path
   * <code>comment.user</code>.
   *
   * @throws com.rackspace.timecharts.app.errors.ReportConfigurationException when a segment is
   * unknown or a plain field appears before the last segment
   */
  RelationPath reflect(String entity, String path);
}
