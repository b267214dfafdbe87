package com.example.authengine.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of fields for one entity. Built once by the context builder.
 */
public final class EntitySchema {

  private final String entity;
  private final Map<String, FieldAttribute> fields;

  EntitySchema(String entity, Map<String, FieldAttribute> fields) {
    this.entity = entity;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public String entity() {
    return entity;
  }

  public Collection<FieldAttribute> fields() {
    return fields.values();
  }

  public Optional<FieldAttribute> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public boolean has(String name) {
    return fields.containsKey(name);
  }
}
