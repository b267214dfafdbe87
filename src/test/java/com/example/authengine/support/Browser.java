package com.example.authengine.support;

import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.pipeline.AuthResponse;
import com.example.authengine.pipeline.RequestPipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpMethod;

/**
 * Drives a {@link RequestPipeline} like a browser would. Keeps a cookie jar of raw values and
 * sends the configured Origin on every request.
 */
public class Browser {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final RequestPipeline pipeline;
  private final Map<String, String> cookies = new LinkedHashMap<>();
  private String origin = TestAuth.BASE_URL;

  public Browser(RequestPipeline pipeline) {
    this.pipeline = pipeline;
  }

  public Browser origin(String value) {
    this.origin = value;
    return this;
  }

  public Map<String, String> cookies() {
    return cookies;
  }

  public AuthResponse get(String pathAndQuery) {
    return send(builder(HttpMethod.GET, pathAndQuery));
  }

  public AuthResponse postJson(String path, String json) {
    return send(builder(HttpMethod.POST, path).jsonBody(json));
  }

  /**
   * Runs the whole provider round trip against a provider that accepts
   * {@link FakeIdentityProvider#VALID_CODE} and returns the callback response.
   */
  public AuthResponse signInWith(String providerId) {
    AuthResponse start = postJson("/api/auth/sign-in/oauth/" + providerId, "{\"callbackURL\":\"/dashboard\"}");
    String state;
    try {
      state = MAPPER.readTree(start.body()).get("state").asText();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return get("/api/auth/callback/" + providerId + "?code=" + FakeIdentityProvider.VALID_CODE
        + "&state=" + URLEncoder.encode(state, StandardCharsets.UTF_8));
  }

  public AuthResponse send(AuthRequest.Builder builder) {
    cookies.forEach(builder::cookie);
    if (origin != null) {
      builder.header("Origin", origin);
    }
    AuthResponse response = pipeline.handle(builder.remoteAddress("203.0.113.7").header("User-Agent", "JUnit").build());
    response.setCookies().forEach(this::store);
    return response;
  }

  public static AuthRequest.Builder builder(HttpMethod method, String pathAndQuery) {
    int idx = pathAndQuery.indexOf('?');
    AuthRequest.Builder builder = AuthRequest.builder(method, idx < 0 ? pathAndQuery : pathAndQuery.substring(0, idx));
    if (idx >= 0) {
      for (String pair : pathAndQuery.substring(idx + 1).split("&")) {
        int eq = pair.indexOf('=');
        String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
        String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
        builder.query(name, value);
      }
    }
    return builder;
  }

  private void store(String setCookie) {
    String pair = setCookie.split(";", 2)[0];
    int eq = pair.indexOf('=');
    String name = pair.substring(0, eq).trim();
    String value = pair.substring(eq + 1);
    if (setCookie.contains("Max-Age=0") || value.isEmpty()) {
      cookies.remove(name);
    } else {
      cookies.put(name, value);
    }
  }
}
