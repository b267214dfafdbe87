package com.example.authengine.crypto;

import com.example.authengine.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * AES-256-GCM encryption of string payloads. Output is base64url without padding so it can
 * travel in cookies and query parameters unchanged. Any modification of the ciphertext fails
 * authentication on decrypt.
 */
@Slf4j
public class EncryptionService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final SecretKey key;

  public EncryptionService(byte[] keyBytes) {
    if (keyBytes.length != 32) {
      throw new EncryptionException("Invalid key length: expected 256 bits");
    }
    this.key = new SecretKeySpec(keyBytes, "AES");
  }

  public String encrypt(String plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getUrlEncoder().withoutPadding().encodeToString(combined);
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed", e);
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  /**
   * Decrypts a value produced by {@link #encrypt(String)}.
   *
   * @throws EncryptionException when the input is malformed or fails GCM authentication
   */
  public String decrypt(String encryptedData) {
    byte[] combined;
    try {
      combined = Base64.getUrlDecoder().decode(encryptedData);
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Encrypted data is not valid base64url", e);
    }
    if (combined.length <= GCM_IV_LENGTH) {
      throw new EncryptionException("Encrypted data is too short");
    }
    try {
      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, combined, 0, GCM_IV_LENGTH));
      byte[] decrypted = cipher.doFinal(combined, GCM_IV_LENGTH, combined.length - GCM_IV_LENGTH);
      return new String(decrypted, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      log.debug("Decryption failed: {}", e.getMessage());
      throw new EncryptionException("Failed to decrypt data", e);
    }
  }
}
