package com.example.authengine.session;

import com.example.authengine.context.AuthOptions;
import com.example.authengine.crypto.HmacSigner;
import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.util.CookieUtil;
import java.time.Duration;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseCookie;

/**
 * Cookie names and attributes, computed once from the options and shared by every component
 * that sets a cookie. Values written through this policy are HMAC-signed.
 */
@Slf4j
public class CookiePolicy {

  public static final String SESSION_TOKEN = "session_token";
  public static final String STATE = "state";
  private static final String SECURE_PREFIX = "__Secure-";
  private static final String COOKIE_PATH = "/";

  @Getter
  private final boolean secure;
  @Getter
  private final String sameSite;
  @Getter
  private final String domain;
  private final String prefix;
  private final Duration sessionMaxAge;
  private final HmacSigner signer;

  public CookiePolicy(AuthOptions options, HmacSigner signer) {
    this.secure = options.isSecureCookies();
    this.sameSite = options.getSameSite();
    this.domain = options.getCrossSubdomainDomain();
    this.prefix = options.getCookiePrefix();
    this.sessionMaxAge = options.getExpiresIn();
    this.signer = signer;
  }

  /**
   * Full cookie name for a logical name, e.g. {@code __Secure-auth.session_token}.
   */
  public String name(String logicalName) {
    String name = prefix + "." + logicalName;
    return secure ? SECURE_PREFIX + name : name;
  }

  public ResponseCookie sessionCookie(String token) {
    return signedCookie(SESSION_TOKEN, token, sessionMaxAge);
  }

  public ResponseCookie signedCookie(String logicalName, String value, Duration maxAge) {
    return cookie(name(logicalName), signer.sign(value), maxAge, true);
  }

  /**
   * An unsigned cookie using the shared attributes. {@code httpOnly=false} is meant for
   * non-sensitive hints that client code must read.
   */
  public ResponseCookie cookie(String fullName, String value, Duration maxAge, boolean httpOnly) {
    ResponseCookie.ResponseCookieBuilder builder = ResponseCookie
        .from(fullName, CookieUtil.encodeCookieValue(value))
        .httpOnly(httpOnly)
        .secure(secure)
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(sameSite);
    if (domain != null && !domain.isBlank()) {
      builder.domain(domain);
    }
    return builder.build();
  }

  public ResponseCookie expire(String logicalName) {
    return cookie(name(logicalName), "", Duration.ZERO, true);
  }

  /**
   * Reads and verifies a signed cookie. A present cookie with a bad signature is treated as absent.
   */
  public Optional<String> readSigned(AuthRequest request, String logicalName) {
    Optional<String> raw = request.cookie(name(logicalName)).map(CookieUtil::decodeCookieValue);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    Optional<String> value = signer.unsign(raw.get());
    if (value.isEmpty()) {
      log.warn("Ignoring cookie {} with an invalid signature", name(logicalName));
    }
    return value;
  }
}
