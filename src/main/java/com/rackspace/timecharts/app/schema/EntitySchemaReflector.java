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

package com.rackspace.timecharts.app.schema;

import com.rackspace.timecharts.app.errors.ReportConfigurationException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link SchemaReflector} over a declared set of entities, their plain fields and the foreign
 * keys between them. Each foreign key is navigable in both directions: forwards under the field
 * name, backwards under the related name, which defaults to the lower-cased name of the entity
 * holding the key.
 */
@Slf4j
public class EntitySchemaReflector implements SchemaReflector {

  private static final Pattern PATH_SEPARATOR = Pattern.compile("\\.");

  private final Map<String, Entity> entities;

  private EntitySchemaReflector(Map<String, Entity> entities) {
    this.entities = entities;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public RelationPath reflect(String entity, String path) {
    final String[] segments = PATH_SEPARATOR.split(path);
    final Deque<String> reverseSegments = new ArrayDeque<>();
    String current = entity;
    String terminalField = null;

    for (int i = 0; i < segments.length; i++) {
      final String segment = segments[i];
      final Entity model = lookup(current);
      final Relation relation = model.relations.get(segment);
      if (relation != null) {
        reverseSegments.push(relation.reverseName);
        current = relation.target;
      } else if (model.fields.contains(segment)) {
        if (i < segments.length - 1) {
          throw new ReportConfigurationException(String.format(
              "Non-relational property %s found as an intermediate relation in %s",
              segment, path));
        }
        terminalField = segment;
      } else {
        throw new ReportConfigurationException(
            String.format("Unknown field %s on %s in %s", segment, current, path));
      }
    }

    final RelationPath result =
        RelationPath.of(current, String.join(".", reverseSegments), terminalField);
    log.trace("Reflected {} from {} as {}", path, entity, result);
    return result;
  }

  private Entity lookup(String name) {
    final Entity entity = entities.get(name);
    if (entity == null) {
      throw new ReportConfigurationException("Unknown entity: " + name);
    }
    return entity;
  }

  private static class Entity {
    final Set<String> fields = new LinkedHashSet<>();
    final Map<String, Relation> relations = new LinkedHashMap<>();
  }

  private static class Relation {
    final String target;
    final String reverseName;

    private Relation(String target, String reverseName) {
      this.target = target;
      this.reverseName = reverseName;
    }
  }

  public static class Builder {

    private final Map<String, Entity> entities = new LinkedHashMap<>();

    public Builder entity(String name, String... fields) {
      final Entity entity = entities.computeIfAbsent(name, key -> new Entity());
      entity.fields.addAll(Set.of(fields));
      return this;
    }

    public Builder foreignKey(String owner, String field, String target) {
      return foreignKey(owner, field, target, owner.toLowerCase(Locale.ROOT));
    }

    /**
     * @param owner the entity holding the key
     * @param field name of the key on the owner
     * @param target the referenced entity
     * @param relatedName name under which the target reaches back to the owner
     */
    public Builder foreignKey(String owner, String field, String target, String relatedName) {
      entity(owner);
      entity(target);
      entities.get(owner).relations.put(field, new Relation(target, relatedName));
      entities.get(target).relations.put(relatedName, new Relation(owner, field));
      return this;
    }

    public EntitySchemaReflector build() {
      return new EntitySchemaReflector(new LinkedHashMap<>(entities));
    }
  }
}
