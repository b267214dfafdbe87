package com.example.authengine.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cookie value encoding and servlet cookie extraction.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  /**
   * Collects request cookies into a name to raw value map. The first cookie of a name wins.
   */
  public static Map<String, String> readCookies(HttpServletRequest request) {
    Map<String, String> cookies = new LinkedHashMap<>();
    Cookie[] raw = request == null ? null : request.getCookies();
    if (raw == null) {
      return cookies;
    }
    for (Cookie cookie : raw) {
      if (cookie.getValue() != null && !cookie.getValue().isEmpty()) {
        cookies.putIfAbsent(cookie.getName(), cookie.getValue());
      }
    }
    return cookies;
  }

  /**
   * Encode cookie value for safe transport
   */
  public static String encodeCookieValue(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  /**
   * Decode cookie value safely; malformed input is returned as-is
   */
  public static String decodeCookieValue(String encodedValue) {
    try {
      return URLDecoder.decode(encodedValue, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      log.debug("Failed to decode cookie value: {}", e.getMessage());
      return encodedValue;
    }
  }

  /**
   * Shortens a token for log output.
   */
  public static String mask(String token) {
    if (token == null || token.length() < 8) {
      return "INVALID";
    }
    return token.substring(0, 8) + "...";
  }
}
