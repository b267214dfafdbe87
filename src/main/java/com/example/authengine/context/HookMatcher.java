package com.example.authengine.context;

import com.example.authengine.pipeline.AuthRequest;
import org.springframework.http.HttpMethod;

/**
 * Predicate selecting the requests a hook runs for. The request path is relative to the base path.
 */
@FunctionalInterface
public interface HookMatcher {

  boolean matches(AuthRequest request);

  static HookMatcher any() {
    return request -> true;
  }

  static HookMatcher path(String path) {
    return request -> path.equals(request.path());
  }

  static HookMatcher pathPrefix(String prefix) {
    return request -> request.path().startsWith(prefix);
  }

  static HookMatcher method(HttpMethod method) {
    return request -> method.equals(request.method());
  }

  default HookMatcher and(HookMatcher other) {
    return request -> matches(request) && other.matches(request);
  }

  default HookMatcher or(HookMatcher other) {
    return request -> matches(request) || other.matches(request);
  }
}
