package com.example.authengine.context;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.adapter.db.DatabaseAdapter;
import com.example.authengine.adapter.idp.IdentityProvider;
import com.example.authengine.exception.ErrorCode;
import com.example.authengine.oauth2.OAuth2Service;
import com.example.authengine.origin.TrustedOriginGuard;
import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.schema.EntitySchema;
import com.example.authengine.schema.SchemaRegistry;
import com.example.authengine.session.CookiePolicy;
import com.example.authengine.session.SessionManager;
import com.example.authengine.session.SessionResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpMethod;

/**
 * The composed, immutable engine context. Built once by {@link AuthContextBuilder} and shared
 * read-only by all requests.
 */
@Getter
@Builder(access = AccessLevel.PACKAGE)
public class AuthContext {

  private final AuthOptions options;
  private final DatabaseAdapter adapter;
  private final AuthDataStore dataStore;
  private final SchemaRegistry schemaRegistry;
  @Getter(AccessLevel.NONE)
  private final EndpointRegistry endpoints;
  @Getter(AccessLevel.NONE)
  private final List<Hook> beforeHooks;
  @Getter(AccessLevel.NONE)
  private final List<Hook> afterHooks;
  @Getter(AccessLevel.NONE)
  private final Map<String, ErrorCode> errorCodes;
  private final CookiePolicy cookiePolicy;
  private final TrustedOriginGuard originGuard;
  private final SessionManager sessionManager;
  private final SessionResolver sessionResolver;
  private final OAuth2Service oauth2Service;
  private final Map<String, IdentityProvider> providers;
  private final List<String> pluginIds;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public Optional<EndpointRegistry.Match> getEndpoint(String path, HttpMethod method) {
    return endpoints.find(path, method);
  }

  /**
   * Before-hooks matching the request, in execution order.
   */
  public List<Hook> getBeforeHooks(AuthRequest request) {
    return beforeHooks.stream().filter(hook -> hook.matcher().matches(request)).toList();
  }

  public List<Hook> getAfterHooks(AuthRequest request) {
    return afterHooks.stream().filter(hook -> hook.matcher().matches(request)).toList();
  }

  public Optional<EntitySchema> getSchema(String entity) {
    return schemaRegistry.get(entity);
  }

  public Optional<ErrorCode> getErrorCode(String code) {
    return Optional.ofNullable(code).map(errorCodes::get);
  }

  public DatabaseAdapter adapter() {
    return adapter;
  }
}
