package com.example.authengine.schema;

import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.exception.ContextBuildException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;

/**
 * One closed schema per entity, folded from the base fields and every plugin fragment.
 * Input and output transformation are pure functions over this registry.
 */
public final class SchemaRegistry {

  public static final String USER = "user";
  public static final String SESSION = "session";
  public static final String ACCOUNT = "account";
  public static final String VERIFICATION = "verification";

  private final Map<String, EntitySchema> schemas;

  private SchemaRegistry(Map<String, EntitySchema> schemas) {
    this.schemas = Map.copyOf(schemas);
  }

  public Optional<EntitySchema> get(String entity) {
    return Optional.ofNullable(schemas.get(entity));
  }

  public EntitySchema require(String entity) {
    return get(entity).orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + entity));
  }

  /**
   * Validates client-supplied data for an entity. Unknown keys are dropped, {@code input=false}
   * fields are rejected, values are coerced to the declared type. On create, defaults are filled
   * and {@code required} fields are enforced.
   */
  public Map<String, Object> transformInput(String entity, Map<String, Object> data, boolean create) {
    EntitySchema schema = require(entity);
    Map<String, Object> result = new LinkedHashMap<>();
    List<Map<String, String>> problems = new ArrayList<>();

    for (Map.Entry<String, Object> entry : data.entrySet()) {
      Optional<FieldAttribute> attribute = schema.field(entry.getKey());
      if (attribute.isEmpty()) {
        continue;
      }
      FieldAttribute field = attribute.get();
      if (!field.input()) {
        throw new AuthApiException(HttpStatus.BAD_REQUEST, BaseErrorCodes.FIELD_NOT_ALLOWED.code(),
            BaseErrorCodes.FIELD_NOT_ALLOWED.message(), List.of(Map.of("field", field.field())));
      }
      Object coerced = field.type().coerce(entry.getValue());
      if (entry.getValue() != null && coerced == null) {
        problems.add(Map.of("field", field.field(),
            "message", "Expected " + field.type().name().toLowerCase(Locale.ROOT)));
        continue;
      }
      result.put(field.field(), coerced);
    }

    if (create) {
      applyDefaults(schema, result);
      for (FieldAttribute field : schema.fields()) {
        if (field.required() && result.get(field.field()) == null) {
          problems.add(Map.of("field", field.field(), "message", BaseErrorCodes.MISSING_FIELD.message()));
        }
      }
    }
    if (!problems.isEmpty()) {
      throw new AuthApiException(HttpStatus.BAD_REQUEST, BaseErrorCodes.VALIDATION_ERROR.code(),
          BaseErrorCodes.VALIDATION_ERROR.message(), problems);
    }
    return result;
  }

  /**
   * Fills defaults for fields the engine itself creates rows with, without input checks.
   */
  public Map<String, Object> applyDefaults(String entity, Map<String, Object> data) {
    Map<String, Object> result = new LinkedHashMap<>(data);
    applyDefaults(require(entity), result);
    return result;
  }

  public Map<String, Object> transformOutput(String entity, Map<String, Object> row) {
    EntitySchema schema = require(entity);
    Map<String, Object> result = new LinkedHashMap<>();
    row.forEach((key, value) -> {
      boolean returned = schema.field(key).map(FieldAttribute::returned).orElse(true);
      if (returned || "id".equals(key)) {
        result.put(key, value);
      }
    });
    return result;
  }

  private static void applyDefaults(EntitySchema schema, Map<String, Object> target) {
    for (FieldAttribute field : schema.fields()) {
      if (field.defaultValue() != null && target.get(field.field()) == null) {
        target.put(field.field(), field.defaultValue());
      }
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Collects base fields and plugin fragments; any field defined twice is a build failure.
   */
  public static final class Builder {

    private final Map<String, Map<String, FieldAttribute>> fields = new LinkedHashMap<>();
    private final Map<String, String> owners = new HashMap<>();

    public Builder add(String owner, FieldAttribute attribute) {
      String key = attribute.entity() + "." + attribute.field();
      String existing = owners.putIfAbsent(key, owner);
      if (existing != null) {
        throw new ContextBuildException(ContextBuildException.Kind.INVALID_SCHEMA,
            "Field '%s' contributed by '%s' is already defined by '%s'".formatted(key, owner, existing));
      }
      fields.computeIfAbsent(attribute.entity(), k -> new LinkedHashMap<>())
          .put(attribute.field(), attribute);
      return this;
    }

    public SchemaRegistry build() {
      Map<String, EntitySchema> schemas = new HashMap<>();
      fields.forEach((entity, entityFields) -> schemas.put(entity, new EntitySchema(entity, entityFields)));
      return new SchemaRegistry(schemas);
    }
  }
}
