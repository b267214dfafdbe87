package com.example.authengine.pipeline;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * What a handler or a short-circuiting before-hook produced: a JSON body or a redirect.
 * Headers and cookies are collected on the {@link EndpointContext} instead.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class EndpointResult {

  private final HttpStatus status;
  private final Object body;
  private final String redirectUrl;

  /** JSON 200. A null body is serialized as the literal {@code null}. */
  public static EndpointResult json(Object body) {
    return new EndpointResult(HttpStatus.OK, body, null);
  }

  public static EndpointResult json(HttpStatus status, Object body) {
    return new EndpointResult(status, body, null);
  }

  /** 302 to the given location; the pipeline vets the location before responding. */
  public static EndpointResult redirect(String location) {
    return new EndpointResult(HttpStatus.FOUND, null, location);
  }

  public boolean isRedirect() {
    return redirectUrl != null;
  }
}
