package com.example.authengine.oauth2;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.crypto.HmacSigner;
import com.example.authengine.crypto.RandomTokens;
import com.example.authengine.domain.entity.Verification;
import com.example.authengine.exception.OAuth2Exception;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the payload in a verification row keyed by a random id. The state parameter is the
 * HMAC-signed id; the row is deleted when consumed.
 */
@Slf4j
@RequiredArgsConstructor
public class DatabaseStateStore implements OAuthStateStore {

  static final String IDENTIFIER_PREFIX = "oauth-state:";
  private static final int STATE_ID_LENGTH = 32;

  private final AuthDataStore dataStore;
  private final HmacSigner signer;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public String store(OAuthStatePayload payload) {
    String id = RandomTokens.generate(STATE_ID_LENGTH, RandomTokens.URL_SAFE_ALPHABET);
    try {
      dataStore.createVerification(IDENTIFIER_PREFIX + id, objectMapper.writeValueAsString(payload),
          payload.expiresAt());
    } catch (JsonProcessingException e) {
      throw new OAuth2Exception(OAuthErrors.INTERNAL_SERVER_ERROR, "Failed to store OAuth state", e);
    }
    return signer.sign(id);
  }

  @Override
  public OAuthStatePayload consume(String state) {
    String id = signer.unsign(state).orElseThrow(() -> {
      log.warn("OAuth state failed signature verification");
      return new OAuth2Exception(OAuthErrors.STATE_MISMATCH, "State signature mismatch");
    });

    String identifier = IDENTIFIER_PREFIX + id;
    Optional<Verification> verification = dataStore.findVerification(identifier);
    if (verification.isEmpty() || !dataStore.deleteVerification(identifier)) {
      throw new OAuth2Exception(OAuthErrors.PLEASE_RESTART, "State not found or already used");
    }

    OAuthStatePayload payload;
    try {
      payload = objectMapper.readValue(verification.get().value(), OAuthStatePayload.class);
    } catch (JsonProcessingException e) {
      throw new OAuth2Exception(OAuthErrors.STATE_MISMATCH, "Stored state is unreadable", e);
    }
    if (payload.isExpired(clock.instant())) {
      throw new OAuth2Exception(OAuthErrors.PLEASE_RESTART, "State expired");
    }
    return payload;
  }
}
