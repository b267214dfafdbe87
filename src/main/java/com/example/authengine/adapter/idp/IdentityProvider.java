package com.example.authengine.adapter.idp;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Collaborator implemented once per external identity provider.
 * Calls that go over the network must enforce their own timeout.
 */
public interface IdentityProvider {

  /**
   * Provider id as used in {@code /sign-in/oauth/:providerId} and {@code /callback/:providerId}.
   */
  String id();

  default boolean requiresPkce() {
    return true;
  }

  /**
   * @param pkceChallenge S256 challenge, null when the provider does not use PKCE
   */
  URI createAuthorizationUrl(String state, String pkceChallenge, List<String> scopes, String redirectUri);

  OAuthTokens exchangeCode(String code, String pkceVerifier, String redirectUri);

  Optional<ProviderUserInfo> getUserInfo(OAuthTokens tokens);

  OAuthTokens refreshAccessToken(String refreshToken);
}
