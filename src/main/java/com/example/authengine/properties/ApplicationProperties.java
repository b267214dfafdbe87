package com.example.authengine.properties;

import com.example.authengine.adapter.idp.GenericProviderConfig;
import com.example.authengine.context.AuthOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the auth engine, bound from the {@code auth.*} namespace.
 * Uses records for immutability; {@link #toAuthOptions()} maps it onto the engine's options.
 */
@Validated
@ConfigurationProperties(prefix = "auth")
public record ApplicationProperties(
    @DefaultValue("Auth Engine") String appName,
    @NotBlank String baseUrl,
    @DefaultValue("/api/auth") @Pattern(regexp = "/.*") String basePath,
    @NotBlank @Size(min = 32) String secret,
    @DefaultValue List<String> trustedOrigins,
    @DefaultValue List<String> disabledPaths,
    @DefaultValue("false") boolean disableOriginCheck,
    @DefaultValue @Valid SessionProperties session,
    @DefaultValue @Valid CookieProperties cookies,
    @DefaultValue @Valid OAuthProperties oauth,
    @DefaultValue Map<String, @Valid ProviderProperties> providers,
    @DefaultValue @Valid OkHttpProperties http,
    @DefaultValue @Valid PluginProperties plugins
) {

  /**
   * Session lifetime and refresh behaviour
   */
  public record SessionProperties(
      @DefaultValue("DATABASE") @NotNull AuthOptions.SessionMode mode,
      @DefaultValue("7d") Duration expiresIn,
      @DefaultValue("1d") Duration updateAge,
      @DefaultValue("1d") Duration freshAge,
      @DefaultValue("false") boolean disableRefresh,
      @DefaultValue("true") boolean encryptStatelessTokens,
      @DefaultValue("5s") Duration cacheTtl,
      @DefaultValue("10000") @Positive int cacheMaxSize
  ) {}

  public record CookieProperties(
      @DefaultValue("auth") @NotBlank String prefix,
      @DefaultValue("Lax") @Pattern(regexp = "Strict|Lax|None") String sameSite,
      Boolean secure,
      String domain
  ) {}

  /**
   * OAuth2 flow and account linking
   */
  public record OAuthProperties(
      @DefaultValue("DATABASE") @NotNull AuthOptions.StateStrategy stateStrategy,
      @DefaultValue("false") boolean skipStateCookieCheck,
      @DefaultValue("10m") Duration stateTtl,
      @DefaultValue("true") boolean accountLinkingEnabled,
      @DefaultValue List<String> trustedProviders,
      @DefaultValue("false") boolean allowDifferentLinkEmails,
      @DefaultValue("false") boolean updateUserInfoOnLink,
      @DefaultValue("false") boolean disableImplicitSignUp,
      @DefaultValue("true") boolean updateAccountOnSignIn
  ) {}

  /**
   * One authorization-code identity provider. The map key is the provider id.
   */
  public record ProviderProperties(
      @NotBlank String clientId,
      String clientSecret,
      @NotBlank String authorizationUri,
      @NotBlank String tokenUri,
      String userInfoUri,
      @DefaultValue List<String> scopes,
      @DefaultValue("true") boolean pkce
  ) {
    public GenericProviderConfig toConfig(String id) {
      return new GenericProviderConfig(id, clientId, clientSecret, authorizationUri, tokenUri,
          userInfoUri, scopes, pkce);
    }
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @DefaultValue("20") @Positive int maxIdleConnections,
      @DefaultValue("5m") Duration keepAlive,
      @DefaultValue("100") @Positive int maxRequests,
      @DefaultValue("20") @Positive int maxRequestsPerHost,
      @DefaultValue("3s") Duration connectTimeout,
      @DefaultValue("5s") Duration readTimeout,
      @DefaultValue("10s") Duration callTimeout
  ) {}

  public record PluginProperties(
      @DefaultValue @Valid LastLoginMethodProperties lastLoginMethod
  ) {
    public record LastLoginMethodProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("false") boolean storeInDatabase,
        @DefaultValue("30d") Duration maxAge
    ) {}
  }

  public AuthOptions toAuthOptions() {
    return AuthOptions.builder()
        .appName(appName)
        .baseUrl(baseUrl)
        .basePath(basePath)
        .secret(secret)
        .trustedOrigins(trustedOrigins)
        .disabledPaths(disabledPaths)
        .disableOriginCheck(disableOriginCheck)
        .sessionMode(session.mode())
        .expiresIn(session.expiresIn())
        .updateAge(session.updateAge())
        .freshAge(session.freshAge())
        .disableSessionRefresh(session.disableRefresh())
        .encryptStatelessTokens(session.encryptStatelessTokens())
        .sessionCacheTtl(session.cacheTtl())
        .sessionCacheMaxSize(session.cacheMaxSize())
        .cookiePrefix(cookies.prefix())
        .sameSite(cookies.sameSite())
        .secureCookies(cookies.secure())
        .crossSubdomainDomain(cookies.domain())
        .stateStrategy(oauth.stateStrategy())
        .skipStateCookieCheck(oauth.skipStateCookieCheck())
        .stateTtl(oauth.stateTtl())
        .accountLinkingEnabled(oauth.accountLinkingEnabled())
        .trustedProviders(oauth.trustedProviders())
        .allowDifferentLinkEmails(oauth.allowDifferentLinkEmails())
        .updateUserInfoOnLink(oauth.updateUserInfoOnLink())
        .disableImplicitSignUp(oauth.disableImplicitSignUp())
        .updateAccountOnSignIn(oauth.updateAccountOnSignIn())
        .build();
  }
}
