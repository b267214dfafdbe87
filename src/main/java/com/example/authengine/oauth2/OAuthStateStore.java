package com.example.authengine.oauth2;

/**
 * Turns a flow payload into the opaque {@code state} parameter and back.
 */
public interface OAuthStateStore {

  String store(OAuthStatePayload payload);

  /**
   * Verifies and consumes a state value. A value can be consumed at most once.
   *
   * @throws com.example.authengine.exception.OAuth2Exception with {@code state_mismatch} when the
   *     value fails verification, {@code please_restart_the_process} when it is unknown, already
   *     used or expired
   */
  OAuthStatePayload consume(String state);
}
