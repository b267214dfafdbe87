package com.example.authengine.domain.entity;

import java.time.Instant;
import java.util.Map;

/**
 * Local user. {@code additionalFields} holds values of plugin-contributed schema fields.
 */
public record User(
    String id,
    String name,
    String email,
    boolean emailVerified,
    String image,
    Instant createdAt,
    Instant updatedAt,
    Map<String, Object> additionalFields
) {
  public User {
    additionalFields = additionalFields == null ? Map.of() : Map.copyOf(additionalFields);
  }
}
