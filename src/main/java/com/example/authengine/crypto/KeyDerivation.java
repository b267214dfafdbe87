package com.example.authengine.crypto;

import com.example.authengine.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.experimental.UtilityClass;

/**
 * Derives independent 256-bit keys from the single configured secret, one per purpose label,
 * so the cookie-signing key never doubles as an encryption key.
 */
@UtilityClass
public class KeyDerivation {

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  public static byte[] deriveKey(String secret, String purpose) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return mac.doFinal(("auth-engine/" + purpose).getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to derive key for " + purpose, e);
    }
  }
}
