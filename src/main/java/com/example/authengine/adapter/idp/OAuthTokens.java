package com.example.authengine.adapter.idp;

import java.time.Instant;
import java.util.List;

/**
 * Tokens returned by a provider's token endpoint.
 */
public record OAuthTokens(
    String accessToken,
    String refreshToken,
    String idToken,
    Instant accessTokenExpiresAt,
    Instant refreshTokenExpiresAt,
    List<String> scopes,
    String tokenType
) {
  public OAuthTokens {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
  }
}
