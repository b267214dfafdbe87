package com.example.authengine.crypto;

import java.security.SecureRandom;
import lombok.experimental.UtilityClass;

/**
 * Random token generation backed by a shared {@link SecureRandom}.
 */
@UtilityClass
public class RandomTokens {

  public static final String URL_SAFE_ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";
  public static final String ALPHANUMERIC =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  public static String generate(int length, String alphabet) {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(alphabet.charAt(SECURE_RANDOM.nextInt(alphabet.length())));
    }
    return sb.toString();
  }

  public static String generate(int length) {
    return generate(length, ALPHANUMERIC);
  }

  public static String generateId() {
    return generate(32);
  }
}
