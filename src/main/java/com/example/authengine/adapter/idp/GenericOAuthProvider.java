package com.example.authengine.adapter.idp;

import com.example.authengine.exception.ProviderException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Config-driven {@link IdentityProvider} for providers that follow the plain OAuth2
 * authorization-code flow with a JSON user-info endpoint.
 * Token and user-info calls go through a per-provider circuit breaker.
 */
@Slf4j
public class GenericOAuthProvider implements IdentityProvider {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final GenericProviderConfig config;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CircuitBreaker circuitBreaker;
  private final Clock clock;

  public GenericOAuthProvider(GenericProviderConfig config, OkHttpClient httpClient,
                              ObjectMapper objectMapper, Clock clock) {
    this.config = config;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.circuitBreaker = CircuitBreaker.of("idp-" + config.id(), CircuitBreakerConfig.custom()
        .failureRateThreshold(50)
        .minimumNumberOfCalls(10)
        .ignoreExceptions(StructuredProviderError.class)
        .build());
  }

  @Override
  public String id() {
    return config.id();
  }

  @Override
  public boolean requiresPkce() {
    return config.pkce();
  }

  @Override
  public URI createAuthorizationUrl(String state, String pkceChallenge, List<String> scopes,
                                    String redirectUri) {
    Set<String> allScopes = new LinkedHashSet<>(config.scopes());
    allScopes.addAll(scopes);

    HttpUrl.Builder url = HttpUrl.get(config.authorizationUri()).newBuilder()
        .addQueryParameter("response_type", "code")
        .addQueryParameter("client_id", config.clientId())
        .addQueryParameter("redirect_uri", redirectUri)
        .addQueryParameter("state", state);
    if (!allScopes.isEmpty()) {
      url.addQueryParameter("scope", String.join(" ", allScopes));
    }
    if (pkceChallenge != null) {
      url.addQueryParameter("code_challenge", pkceChallenge)
          .addQueryParameter("code_challenge_method", "S256");
    }
    return url.build().uri();
  }

  @Override
  public OAuthTokens exchangeCode(String code, String pkceVerifier, String redirectUri) {
    log.debug("Exchanging authorization code for tokens with {}", config.id());

    FormBody.Builder form = new FormBody.Builder()
        .add("grant_type", "authorization_code")
        .add("client_id", config.clientId())
        .add("code", code)
        .add("redirect_uri", redirectUri);
    if (pkceVerifier != null) {
      form.add("code_verifier", pkceVerifier);
    }
    return postTokenRequest(form.build());
  }

  @Override
  public OAuthTokens refreshAccessToken(String refreshToken) {
    FormBody form = new FormBody.Builder()
        .add("grant_type", "refresh_token")
        .add("client_id", config.clientId())
        .add("refresh_token", refreshToken)
        .build();
    return postTokenRequest(form);
  }

  @Override
  public Optional<ProviderUserInfo> getUserInfo(OAuthTokens tokens) {
    if (config.userInfoUri() == null || tokens.accessToken() == null) {
      return Optional.empty();
    }
    Request request = new Request.Builder()
        .url(config.userInfoUri())
        .header("Authorization", "Bearer " + tokens.accessToken())
        .header("Accept", "application/json")
        .get()
        .build();

    Map<String, Object> body = guarded(() -> execute(request, "user info"));
    Object id = body.containsKey("sub") ? body.get("sub") : body.get("id");
    if (id == null) {
      log.warn("User info from {} carried no subject", config.id());
      return Optional.empty();
    }
    Object picture = body.containsKey("picture") ? body.get("picture") : body.get("avatar_url");
    return Optional.of(new ProviderUserInfo(
        id.toString(),
        (String) body.get("email"),
        Boolean.TRUE.equals(body.get("email_verified")),
        (String) body.get("name"),
        picture == null ? null : picture.toString()
    ));
  }

  private OAuthTokens postTokenRequest(FormBody form) {
    Request.Builder builder = new Request.Builder()
        .url(config.tokenUri())
        .header("Accept", "application/json")
        .post(form);
    // public clients authenticate with PKCE only
    if (config.clientSecret() != null) {
      builder.header("Authorization", Credentials.basic(config.clientId(), config.clientSecret()));
    }
    Request request = builder.build();

    Map<String, Object> body = guarded(() -> execute(request, "token"));
    Instant now = clock.instant();
    Number expiresIn = (Number) body.get("expires_in");
    Number refreshExpiresIn = (Number) body.get("refresh_token_expires_in");
    String scope = (String) body.get("scope");

    return new OAuthTokens(
        (String) body.get("access_token"),
        (String) body.get("refresh_token"),
        (String) body.get("id_token"),
        expiresIn == null ? null : now.plusSeconds(expiresIn.longValue()),
        refreshExpiresIn == null ? null : now.plusSeconds(refreshExpiresIn.longValue()),
        scope == null ? List.of() : Arrays.asList(scope.split("[ ,]+")),
        (String) body.get("token_type")
    );
  }

  private Map<String, Object> execute(Request request, String operation) {
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String raw = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        Map<String, Object> error = parseQuietly(raw);
        if (error.get("error") != null) {
          throw new StructuredProviderError(
              "%s request to %s rejected: %s".formatted(operation, config.id(), error.get("error")));
        }
        throw new ProviderException(
            "%s request to %s failed with status %d".formatted(operation, config.id(), response.code()), false);
      }
      return objectMapper.readValue(raw, MAP_TYPE);
    } catch (IOException e) {
      throw new ProviderException(operation + " request to " + config.id() + " failed due to network error", e);
    }
  }

  private Map<String, Object> parseQuietly(String raw) {
    try {
      return objectMapper.readValue(raw, MAP_TYPE);
    } catch (IOException e) {
      log.debug("Provider {} returned a non-JSON error body", config.id());
      return Map.of();
    }
  }

  private <T> T guarded(Supplier<T> call) {
    try {
      return circuitBreaker.executeSupplier(call);
    } catch (CallNotPermittedException e) {
      log.error("Circuit breaker for {} is open", config.id());
      throw new ProviderException(config.id() + " is temporarily unavailable", e);
    }
  }

  /**
   * Provider answered with an OAuth2 error body. Does not count as a circuit-breaker failure.
   */
  static class StructuredProviderError extends ProviderException {
    StructuredProviderError(String message) {
      super(message, true);
    }
  }
}
