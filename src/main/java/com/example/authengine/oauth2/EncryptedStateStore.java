package com.example.authengine.oauth2;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.crypto.EncryptionService;
import com.example.authengine.crypto.HmacSigner;
import com.example.authengine.exception.EncryptionException;
import com.example.authengine.exception.OAuth2Exception;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Carries the payload inside the state parameter itself: AES-256-GCM encrypted, then signed.
 * Issuing a state also writes a pending marker row; consuming deletes it, and only the caller
 * whose delete removed the row gets the payload.
 */
@Slf4j
@RequiredArgsConstructor
public class EncryptedStateStore implements OAuthStateStore {

  static final String PENDING_PREFIX = "oauth-state-pending:";

  private final AuthDataStore dataStore;
  private final EncryptionService encryptionService;
  private final HmacSigner signer;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public String store(OAuthStatePayload payload) {
    try {
      String state = signer.sign(encryptionService.encrypt(objectMapper.writeValueAsString(payload)));
      dataStore.createVerification(PENDING_PREFIX + payload.csrfState(), payload.providerId(),
          payload.expiresAt());
      return state;
    } catch (JsonProcessingException e) {
      throw new OAuth2Exception(OAuthErrors.INTERNAL_SERVER_ERROR, "Failed to encode OAuth state", e);
    }
  }

  @Override
  public OAuthStatePayload consume(String state) {
    String encrypted = signer.unsign(state).orElseThrow(() -> {
      log.warn("OAuth state failed signature verification");
      return new OAuth2Exception(OAuthErrors.STATE_MISMATCH, "State signature mismatch");
    });

    OAuthStatePayload payload;
    try {
      payload = objectMapper.readValue(encryptionService.decrypt(encrypted), OAuthStatePayload.class);
    } catch (EncryptionException | JsonProcessingException e) {
      log.warn("OAuth state could not be decrypted: {}", e.getMessage());
      throw new OAuth2Exception(OAuthErrors.STATE_MISMATCH, "State could not be decrypted", e);
    }
    if (payload.isExpired(clock.instant())) {
      throw new OAuth2Exception(OAuthErrors.PLEASE_RESTART, "State expired");
    }

    if (!dataStore.deleteVerification(PENDING_PREFIX + payload.csrfState())) {
      log.warn("Replayed OAuth state for provider {}", payload.providerId());
      throw new OAuth2Exception(OAuthErrors.PLEASE_RESTART, "State already used");
    }
    return payload;
  }
}
