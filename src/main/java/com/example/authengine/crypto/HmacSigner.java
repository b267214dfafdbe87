package com.example.authengine.crypto;

import com.example.authengine.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signing of short string values. Signed values have the form
 * {@code value.signature} with a base64url signature; verification is constant-time.
 */
public class HmacSigner {

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final char SEPARATOR = '.';

  private final SecretKeySpec key;

  public HmacSigner(byte[] keyBytes) {
    this.key = new SecretKeySpec(keyBytes, HMAC_ALGORITHM);
  }

  public String signature(String value) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(key);
      byte[] raw = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to sign value", e);
    }
  }

  public String sign(String value) {
    return value + SEPARATOR + signature(value);
  }

  /**
   * Returns the original value when the signature matches, empty otherwise.
   */
  public Optional<String> unsign(String signedValue) {
    if (signedValue == null) {
      return Optional.empty();
    }
    int idx = signedValue.lastIndexOf(SEPARATOR);
    if (idx <= 0 || idx == signedValue.length() - 1) {
      return Optional.empty();
    }
    String value = signedValue.substring(0, idx);
    String provided = signedValue.substring(idx + 1);
    byte[] expected = signature(value).getBytes(StandardCharsets.US_ASCII);
    if (!MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.US_ASCII))) {
      return Optional.empty();
    }
    return Optional.of(value);
  }
}
