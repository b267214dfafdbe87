package com.example.authengine.oauth2;

import java.time.Instant;

/**
 * Everything the callback needs from the sign-in request. Only trusted after the state
 * store has verified it.
 *
 * @param csrfState     random value also bound to the browser through the state cookie
 * @param link          present when an authenticated user is linking another provider
 * @param requestSignUp the caller explicitly asked for sign-up
 */
public record OAuthStatePayload(
    String csrfState,
    String codeVerifier,
    String providerId,
    String callbackURL,
    String errorURL,
    String newUserCallbackURL,
    Instant expiresAt,
    LinkHint link,
    boolean requestSignUp
) {

  public record LinkHint(String email, String userId) {}

  public boolean isExpired(Instant now) {
    return expiresAt == null || !now.isBefore(expiresAt);
  }
}
