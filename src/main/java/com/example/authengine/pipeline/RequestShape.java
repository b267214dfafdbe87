package com.example.authengine.pipeline;

import java.util.List;

/**
 * Declared shape of an endpoint's input. Undeclared parameters pass through untouched.
 */
public record RequestShape(List<ParamSpec> body, List<ParamSpec> query) {

  public static final RequestShape NONE = new RequestShape(List.of(), List.of());

  public RequestShape {
    body = body == null ? List.of() : List.copyOf(body);
    query = query == null ? List.of() : List.copyOf(query);
  }

  public static RequestShape body(ParamSpec... params) {
    return new RequestShape(List.of(params), List.of());
  }

  public static RequestShape query(ParamSpec... params) {
    return new RequestShape(List.of(), List.of(params));
  }
}
