package com.example.authengine.pipeline;

import com.example.authengine.schema.FieldType;

/**
 * One declared body or query parameter of an endpoint.
 */
public record ParamSpec(String name, FieldType type, boolean required) {

  public static ParamSpec required(String name, FieldType type) {
    return new ParamSpec(name, type, true);
  }

  public static ParamSpec optional(String name, FieldType type) {
    return new ParamSpec(name, type, false);
  }
}
