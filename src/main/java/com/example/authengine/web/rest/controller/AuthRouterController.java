package com.example.authengine.web.rest.controller;

import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.pipeline.AuthResponse;
import com.example.authengine.pipeline.RequestPipeline;
import com.example.authengine.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Thin servlet adaptor: turns the servlet request into an {@link AuthRequest}, runs the pipeline
 * and copies status, headers and body back.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthRouterController implements AuthRouterAPI {

  private final RequestPipeline pipeline;

  @Override
  public ResponseEntity<String> dispatch(byte[] body, HttpServletRequest request) {
    AuthRequest authRequest = toAuthRequest(request, body);
    log.debug("{} {}", authRequest.method(), authRequest.path());

    AuthResponse response = pipeline.handle(authRequest);
    return ResponseEntity.status(response.status())
        .headers(response.headers())
        .body(response.body());
  }

  static AuthRequest toAuthRequest(HttpServletRequest request, byte[] body) {
    String path = request.getRequestURI().substring(request.getContextPath().length());

    Map<String, List<String>> headers = new LinkedHashMap<>();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.put(name, new ArrayList<>(Collections.list(request.getHeaders(name))));
    }

    return new AuthRequest(
        HttpMethod.valueOf(request.getMethod()),
        path,
        queryParameters(request.getQueryString()),
        headers,
        CookieUtil.readCookies(request),
        body,
        request.getContentType(),
        // proxy headers are resolved by the container (server.forward-headers-strategy), never here
        request.getRemoteAddr());
  }

  /**
   * Reads the query string only; servlet parameters would also include form body fields.
   */
  private static Map<String, String> queryParameters(String queryString) {
    Map<String, String> query = new LinkedHashMap<>();
    if (queryString == null || queryString.isEmpty()) {
      return query;
    }
    MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams();
    raw.forEach((name, values) -> {
      String first = values.isEmpty() || values.get(0) == null ? "" : values.get(0);
      query.putIfAbsent(UriUtils.decode(name, StandardCharsets.UTF_8),
          UriUtils.decode(first.replace('+', ' '), StandardCharsets.UTF_8));
    });
    return query;
  }
}
