package com.example.authengine.schema;

import java.time.Instant;
import java.util.List;

public enum FieldType {
  STRING,
  NUMBER,
  BOOLEAN,
  DATE,
  STRING_ARRAY;

  /**
   * Coerces a client-supplied value to this type, or returns null when it cannot be coerced.
   */
  public Object coerce(Object value) {
    if (value == null) {
      return null;
    }
    return switch (this) {
      case STRING -> value instanceof String ? value : null;
      case NUMBER -> value instanceof Number ? value : parseNumber(value);
      case BOOLEAN -> value instanceof Boolean ? value : parseBoolean(value);
      case DATE -> value instanceof Instant ? value : parseInstant(value);
      case STRING_ARRAY -> value instanceof List<?> list
          && list.stream().allMatch(String.class::isInstance) ? List.copyOf(list) : null;
    };
  }

  private static Object parseNumber(Object value) {
    try {
      return Double.valueOf(value.toString());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Object parseBoolean(Object value) {
    String s = value.toString();
    if ("true".equalsIgnoreCase(s)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(s)) {
      return Boolean.FALSE;
    }
    return null;
  }

  private static Object parseInstant(Object value) {
    try {
      return Instant.parse(value.toString());
    } catch (RuntimeException e) {
      return null;
    }
  }
}
