package com.example.authengine.schema;

/**
 * A field of an entity.
 *
 * @param required     must be present when a row is created
 * @param input        clients may supply a value for it
 * @param returned     echoed in responses
 * @param defaultValue applied on create when no value is supplied
 */
public record FieldAttribute(
    String entity,
    String field,
    FieldType type,
    boolean required,
    boolean input,
    boolean returned,
    Object defaultValue
) {

  public FieldAttribute {
    if (entity == null || entity.isBlank() || field == null || field.isBlank()) {
      throw new IllegalArgumentException("Field attribute needs an entity and a field name");
    }
    if (type == null) {
      throw new IllegalArgumentException("Field attribute " + entity + "." + field + " needs a type");
    }
  }

  public static FieldAttribute of(String entity, String field, FieldType type) {
    return new FieldAttribute(entity, field, type, false, true, true, null);
  }

  public static FieldAttribute internal(String entity, String field, FieldType type) {
    return new FieldAttribute(entity, field, type, false, false, true, null);
  }

  public FieldAttribute withRequired(boolean value) {
    return new FieldAttribute(entity, field, type, value, input, returned, defaultValue);
  }

  public FieldAttribute withReturned(boolean value) {
    return new FieldAttribute(entity, field, type, required, input, value, defaultValue);
  }

  public FieldAttribute withDefault(Object value) {
    return new FieldAttribute(entity, field, type, required, input, returned, value);
  }
}
