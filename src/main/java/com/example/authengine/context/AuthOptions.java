package com.example.authengine.context;

import com.example.authengine.origin.TrustedOriginsProvider;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved engine options. Built once from configuration and never mutated.
 */
@Value
@Builder(toBuilder = true)
public class AuthOptions {

  public enum SessionMode {
    DATABASE,
    STATELESS
  }

  public enum StateStrategy {
    DATABASE,
    ENCRYPTED
  }

  @Builder.Default
  String appName = "Auth Engine";

  String baseUrl;

  @Builder.Default
  String basePath = "/api/auth";

  String secret;

  @Singular
  List<String> trustedOrigins;

  TrustedOriginsProvider trustedOriginsProvider;

  @Singular
  Set<String> disabledPaths;

  boolean disableOriginCheck;

  // session
  @Builder.Default
  SessionMode sessionMode = SessionMode.DATABASE;

  @Builder.Default
  Duration expiresIn = Duration.ofDays(7);

  @Builder.Default
  Duration updateAge = Duration.ofDays(1);

  @Builder.Default
  Duration freshAge = Duration.ofDays(1);

  boolean disableSessionRefresh;

  @Builder.Default
  boolean encryptStatelessTokens = true;

  @Builder.Default
  Duration sessionCacheTtl = Duration.ofSeconds(5);

  @Builder.Default
  int sessionCacheMaxSize = 10_000;

  // cookies
  @Builder.Default
  String cookiePrefix = "auth";

  @Builder.Default
  String sameSite = "Lax";

  /** Null means: secure when the base URL is https. */
  Boolean secureCookies;

  String crossSubdomainDomain;

  // oauth
  @Builder.Default
  StateStrategy stateStrategy = StateStrategy.DATABASE;

  boolean skipStateCookieCheck;

  @Builder.Default
  Duration stateTtl = Duration.ofMinutes(10);

  @Builder.Default
  boolean accountLinkingEnabled = true;

  @Singular
  Set<String> trustedProviders;

  boolean allowDifferentLinkEmails;

  boolean updateUserInfoOnLink;

  boolean disableImplicitSignUp;

  @Builder.Default
  boolean updateAccountOnSignIn = true;

  public boolean isSecureCookies() {
    if (secureCookies != null) {
      return secureCookies;
    }
    return baseUrl != null && baseUrl.startsWith("https://");
  }

  /**
   * Scheme, host and port of {@link #getBaseUrl()}.
   */
  public String getBaseOrigin() {
    URI uri = URI.create(baseUrl);
    String origin = uri.getScheme() + "://" + uri.getHost();
    return uri.getPort() == -1 ? origin : origin + ":" + uri.getPort();
  }

  /**
   * Absolute URL of the engine's mount point, without a trailing slash.
   */
  public String getAuthUrl() {
    String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return base + basePath;
  }
}
