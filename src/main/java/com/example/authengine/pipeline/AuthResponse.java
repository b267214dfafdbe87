package com.example.authengine.pipeline;

import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

/**
 * Final, serialized response handed back to the web adaptor.
 *
 * @param body JSON text, or null for redirects
 */
public record AuthResponse(HttpStatus status, HttpHeaders headers, String body) {

  public AuthResponse {
    HttpHeaders copy = new HttpHeaders();
    if (headers != null) {
      copy.putAll(headers);
    }
    headers = HttpHeaders.readOnlyHttpHeaders(copy);
  }

  public String location() {
    return headers.getFirst(HttpHeaders.LOCATION);
  }

  public List<String> setCookies() {
    List<String> values = headers.get(HttpHeaders.SET_COOKIE);
    return values == null ? List.of() : values;
  }
}
