package com.example.authengine.pipeline;

import java.util.Set;
import org.springframework.http.HttpMethod;

/**
 * A routable operation. {@code path} is relative to the base path and may contain
 * {@code :name} segments bound as path parameters.
 */
public record Endpoint(String path, Set<HttpMethod> methods, RequestShape shape, EndpointHandler handler) {

  public Endpoint {
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException("Endpoint path must start with '/': " + path);
    }
    if (methods == null || methods.isEmpty()) {
      throw new IllegalArgumentException("Endpoint " + path + " needs at least one method");
    }
    methods = Set.copyOf(methods);
    shape = shape == null ? RequestShape.NONE : shape;
  }

  public static Endpoint get(String path, RequestShape shape, EndpointHandler handler) {
    return new Endpoint(path, Set.of(HttpMethod.GET), shape, handler);
  }

  public static Endpoint post(String path, RequestShape shape, EndpointHandler handler) {
    return new Endpoint(path, Set.of(HttpMethod.POST), shape, handler);
  }
}
