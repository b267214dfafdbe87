package com.example.authengine.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.http.HttpMethod;

/**
 * Framework-independent view of an inbound request. Header names are case-insensitive.
 *
 * @param path        request path; the pipeline replaces it with the path relative to the base path
 * @param query       raw query parameters, first value wins
 * @param body        raw body bytes, may be empty
 * @param contentType value of the Content-Type header, may be null
 */
public record AuthRequest(
    HttpMethod method,
    String path,
    Map<String, String> query,
    Map<String, List<String>> headers,
    Map<String, String> cookies,
    byte[] body,
    String contentType,
    String remoteAddress
) {

  public AuthRequest {
    query = query == null ? Map.of() : Map.copyOf(query);
    cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    TreeMap<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      headers.forEach((name, values) -> normalized.put(name, List.copyOf(values)));
    }
    headers = normalized;
    body = body == null ? new byte[0] : body;
  }

  public Optional<String> header(String name) {
    List<String> values = headers.get(name);
    return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
  }

  public Optional<String> cookie(String name) {
    return Optional.ofNullable(cookies.get(name));
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public boolean hasBody() {
    return body.length > 0;
  }

  public String mediaType() {
    if (contentType == null) {
      return "";
    }
    int idx = contentType.indexOf(';');
    return (idx < 0 ? contentType : contentType.substring(0, idx)).trim().toLowerCase(Locale.ROOT);
  }

  public Optional<String> userAgent() {
    return header("User-Agent");
  }

  public AuthRequest withPath(String newPath) {
    return new AuthRequest(method, newPath, query, headers, cookies, body, contentType, remoteAddress);
  }

  public static Builder builder(HttpMethod method, String path) {
    return new Builder(method, path);
  }

  /**
   * Convenience builder, mostly for tests and internal redirects.
   */
  public static final class Builder {

    private final HttpMethod method;
    private final String path;
    private final Map<String, String> query = new TreeMap<>();
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, String> cookies = new TreeMap<>();
    private byte[] body;
    private String contentType;
    private String remoteAddress;

    private Builder(HttpMethod method, String path) {
      this.method = method;
      this.path = path;
    }

    public Builder query(String name, String value) {
      query.put(name, value);
      return this;
    }

    public Builder header(String name, String value) {
      headers.put(name, List.of(value));
      return this;
    }

    public Builder cookie(String name, String value) {
      cookies.put(name, value);
      return this;
    }

    public Builder jsonBody(String json) {
      this.body = json.getBytes(StandardCharsets.UTF_8);
      this.contentType = "application/json";
      return this;
    }

    public Builder formBody(String form) {
      this.body = form.getBytes(StandardCharsets.UTF_8);
      this.contentType = "application/x-www-form-urlencoded";
      return this;
    }

    public Builder remoteAddress(String address) {
      this.remoteAddress = address;
      return this;
    }

    public AuthRequest build() {
      return new AuthRequest(method, path, query, headers, cookies, body, contentType, remoteAddress);
    }
  }
}
