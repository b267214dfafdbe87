package com.example.authengine.pipeline;

import com.example.authengine.context.AuthContext;
import com.example.authengine.domain.entity.SessionWithUser;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;

/**
 * Request-scoped state threaded through hooks and the handler. Never shared between requests.
 */
@Getter
public class EndpointContext {

  private final AuthContext authContext;
  private final AuthRequest request;
  private final Endpoint endpoint;
  private final Map<String, String> params;
  private final Map<String, Object> body;
  private final Map<String, Object> query;
  private final HttpHeaders responseHeaders = new HttpHeaders();

  private SessionWithUser session;
  private boolean sessionResolved;

  /** Suppresses the sliding session refresh for this request only. */
  @Setter
  private boolean disableRefresh;

  /** Set by the pipeline once the handler returned; read-only for after-hooks. */
  @Setter(AccessLevel.PACKAGE)
  private EndpointResult result;

  public EndpointContext(AuthContext authContext, AuthRequest request, Endpoint endpoint,
                         Map<String, String> params, Map<String, Object> body,
                         Map<String, Object> query) {
    this.authContext = authContext;
    this.request = request;
    this.endpoint = endpoint;
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    this.body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    this.query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
  }

  public Optional<String> param(String name) {
    return Optional.ofNullable(params.get(name));
  }

  public Optional<Object> bodyValue(String name) {
    return Optional.ofNullable(body.get(name));
  }

  public Optional<String> bodyString(String name) {
    return bodyValue(name).map(Object::toString).filter(s -> !s.isEmpty());
  }

  public Optional<String> queryString(String name) {
    return Optional.ofNullable(query.get(name)).map(Object::toString).filter(s -> !s.isEmpty());
  }

  public boolean bodyFlag(String name) {
    return bodyValue(name).map(Boolean.TRUE::equals).orElse(false);
  }

  /**
   * Looks a parameter up in the body first, then in the query string.
   */
  public Optional<String> input(String name) {
    return bodyString(name).or(() -> queryString(name));
  }

  public Optional<SessionWithUser> getSession() {
    return Optional.ofNullable(session);
  }

  /**
   * Attaches the resolved session (or its absence) so later stages do not resolve it again.
   */
  public void attachSession(SessionWithUser resolved) {
    this.session = resolved;
    this.sessionResolved = true;
  }

  public void setCookie(ResponseCookie cookie) {
    responseHeaders.add(HttpHeaders.SET_COOKIE, cookie.toString());
  }

  public void setHeader(String name, String value) {
    responseHeaders.set(name, value);
  }

  public Optional<EndpointResult> getResult() {
    return Optional.ofNullable(result);
  }
}
