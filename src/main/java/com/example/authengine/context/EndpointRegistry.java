package com.example.authengine.context;

import com.example.authengine.exception.ContextBuildException;
import com.example.authengine.pipeline.Endpoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpMethod;

/**
 * Endpoints keyed by method and normalized path pattern. Two patterns that differ only in the
 * names of their {@code :param} segments are the same route.
 */
public final class EndpointRegistry {

  /**
   * A resolved endpoint with the values bound to its path parameters.
   */
  public record Match(Endpoint endpoint, Map<String, String> params) {}

  private record Route(HttpMethod method, String[] segments, Endpoint endpoint, String owner) {}

  private final Map<String, Route> routes = new LinkedHashMap<>();

  void register(String owner, Endpoint endpoint) {
    for (HttpMethod method : endpoint.methods()) {
      String key = method.name() + " " + normalize(endpoint.path());
      Route existing = routes.get(key);
      if (existing != null) {
        throw new ContextBuildException(ContextBuildException.Kind.DUPLICATE_ENDPOINT,
            "Endpoint %s %s from '%s' is already registered by '%s'"
                .formatted(method.name(), endpoint.path(), owner, existing.owner()));
      }
      routes.put(key, new Route(method, split(endpoint.path()), endpoint, owner));
    }
  }

  /**
   * Finds the endpoint for a concrete path. Literal segments win over parameters when both match.
   */
  public Optional<Match> find(String path, HttpMethod method) {
    String[] requested = split(path);
    Match best = null;
    int bestLiterals = -1;
    for (Route route : routes.values()) {
      if (!route.method().equals(method) || route.segments().length != requested.length) {
        continue;
      }
      Map<String, String> params = new LinkedHashMap<>();
      int literals = 0;
      boolean matched = true;
      for (int i = 0; i < requested.length; i++) {
        String segment = route.segments()[i];
        if (segment.startsWith(":")) {
          if (requested[i].isEmpty()) {
            matched = false;
            break;
          }
          params.put(segment.substring(1), requested[i]);
        } else if (segment.equals(requested[i])) {
          literals++;
        } else {
          matched = false;
          break;
        }
      }
      if (matched && literals > bestLiterals) {
        best = new Match(route.endpoint(), Collections.unmodifiableMap(params));
        bestLiterals = literals;
      }
    }
    return Optional.ofNullable(best);
  }

  public List<String> describe() {
    return new ArrayList<>(routes.keySet());
  }

  public int size() {
    return routes.size();
  }

  static String normalize(String path) {
    StringBuilder sb = new StringBuilder();
    for (String segment : split(path)) {
      sb.append('/').append(segment.startsWith(":") ? ":*" : segment);
    }
    return sb.length() == 0 ? "/" : sb.toString();
  }

  private static String[] split(String path) {
    String trimmed = path.startsWith("/") ? path.substring(1) : path;
    if (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed.isEmpty() ? new String[0] : trimmed.split("/", -1);
  }
}
