package com.example.authengine.config;

import com.example.authengine.properties.ApplicationProperties;
import com.example.authengine.properties.ApplicationProperties.ProviderProperties;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Enforces rules across properties that JSR-303 annotations cannot express. Fails fast and
 * reports every problem at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final String PROTOCOL_HTTP = "http://";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating auth engine configuration...");
    List<String> errors = new ArrayList<>();

    validateBaseConfig(errors);
    validateSessionConfig(errors);
    validateCookieConfig(errors);
    validateProviders(errors);
    validateHttpConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateBaseConfig(List<String> errors) {
    if (!isAbsoluteHttpUrl(properties.baseUrl())) {
      errors.add(ERROR_INVALID_URL.formatted("Base URL", properties.baseUrl()));
    }
    validateHttpsRequired(properties.baseUrl(), "Base URL", errors);
    if (properties.basePath().length() > 1 && properties.basePath().endsWith("/")) {
      errors.add("Base path must not end with '/': " + properties.basePath());
    }
    for (String origin : properties.trustedOrigins()) {
      if (origin.isBlank()) {
        errors.add("Trusted origins must not contain blank entries.");
      }
    }
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    requirePositive(session.expiresIn(), "Session expiresIn", errors);
    requirePositive(properties.oauth().stateTtl(), "OAuth state TTL", errors);
    if (session.updateAge().compareTo(session.expiresIn()) > 0) {
      errors.add("Session updateAge (%s) must not exceed expiresIn (%s)"
                     .formatted(session.updateAge(), session.expiresIn()));
    }
    if (session.cacheTtl().isNegative()) {
      errors.add("Session cache TTL cannot be negative.");
    }
  }

  private void validateCookieConfig(List<String> errors) {
    ApplicationProperties.CookieProperties cookies = properties.cookies();
    boolean secure = cookies.secure() != null ? cookies.secure() : properties.baseUrl().startsWith("https://");
    if ("None".equals(cookies.sameSite()) && !secure) {
      errors.add("SameSite=None cookies must be secure.");
    }
  }

  private void validateProviders(List<String> errors) {
    for (Map.Entry<String, ProviderProperties> entry : properties.providers().entrySet()) {
      String id = entry.getKey();
      ProviderProperties provider = entry.getValue();
      if (!id.matches("[a-z0-9][a-z0-9_-]*")) {
        errors.add("Provider id must be lowercase alphanumeric: " + id);
      }
      if (!isAbsoluteHttpUrl(provider.authorizationUri())) {
        errors.add(ERROR_INVALID_URL.formatted("Provider '" + id + "' authorization URI", provider.authorizationUri()));
      }
      if (!isAbsoluteHttpUrl(provider.tokenUri())) {
        errors.add(ERROR_INVALID_URL.formatted("Provider '" + id + "' token URI", provider.tokenUri()));
      }
      if (provider.userInfoUri() != null && !isAbsoluteHttpUrl(provider.userInfoUri())) {
        errors.add(ERROR_INVALID_URL.formatted("Provider '" + id + "' user info URI", provider.userInfoUri()));
      }
      if (!provider.pkce() && (provider.clientSecret() == null || provider.clientSecret().isBlank())) {
        errors.add("Provider '" + id + "' needs a client secret when PKCE is disabled.");
      }
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties http = properties.http();
    if (http.maxRequests() < http.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private static void requirePositive(Duration duration, String fieldName, List<String> errors) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted(fieldName));
    }
  }

  private static boolean isAbsoluteHttpUrl(String url) {
    if (url == null) {
      return false;
    }
    try {
      URI uri = URI.create(url);
      return uri.getHost() != null && ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()));
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  private static void validateHttpsRequired(String uri, String fieldName, List<String> errors) {
    if (uri != null && uri.startsWith(PROTOCOL_HTTP)
        && !uri.contains(HOST_LOCALHOST) && !uri.contains(HOST_LOOPBACK)) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(fieldName, uri));
    }
  }
}
