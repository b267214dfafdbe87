package com.example.authengine.pipeline;

import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Parses the body (JSON or form-urlencoded) and the query string, then coerces declared
 * parameters to their types. All problems are reported together as {@code VALIDATION_ERROR}.
 */
@RequiredArgsConstructor
class RequestParser {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  record Parsed(Map<String, Object> body, Map<String, Object> query) {}

  Parsed parse(AuthRequest request, RequestShape shape) {
    List<Map<String, String>> problems = new ArrayList<>();
    Map<String, Object> body = readBody(request, problems);
    Map<String, Object> query = new LinkedHashMap<>(request.query());

    coerce(shape.body(), body, "body", problems);
    coerce(shape.query(), query, "query", problems);

    if (!problems.isEmpty()) {
      throw new AuthApiException(HttpStatus.BAD_REQUEST, BaseErrorCodes.VALIDATION_ERROR.code(),
          BaseErrorCodes.VALIDATION_ERROR.message(), problems);
    }
    return new Parsed(body, query);
  }

  private Map<String, Object> readBody(AuthRequest request, List<Map<String, String>> problems) {
    if (!request.hasBody()) {
      return new LinkedHashMap<>();
    }
    String mediaType = request.mediaType();
    if (mediaType.equals("application/x-www-form-urlencoded")) {
      return parseForm(request.bodyAsString());
    }
    if (mediaType.isEmpty() || mediaType.equals("application/json") || mediaType.endsWith("+json")) {
      try {
        Map<String, Object> parsed = objectMapper.readValue(request.body(), MAP_TYPE);
        return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
      } catch (IOException e) {
        problems.add(Map.of("field", "body", "message", "Body is not a JSON object"));
        return new LinkedHashMap<>();
      }
    }
    problems.add(Map.of("field", "body", "message", "Unsupported content type " + mediaType));
    return new LinkedHashMap<>();
  }

  static Map<String, Object> parseForm(String form) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (String pair : form.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int idx = pair.indexOf('=');
      String name = URLDecoder.decode(idx < 0 ? pair : pair.substring(0, idx), StandardCharsets.UTF_8);
      String value = idx < 0 ? "" : URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
      values.putIfAbsent(name, value);
    }
    return values;
  }

  private static void coerce(List<ParamSpec> specs, Map<String, Object> values, String location,
                             List<Map<String, String>> problems) {
    for (ParamSpec spec : specs) {
      Object raw = values.get(spec.name());
      if (raw == null || "".equals(raw)) {
        values.remove(spec.name());
        if (spec.required()) {
          problems.add(Map.of("field", spec.name(), "location", location, "message", "Field is required"));
        }
        continue;
      }
      Object coerced = spec.type().coerce(raw);
      if (coerced == null) {
        problems.add(Map.of("field", spec.name(), "location", location,
            "message", "Expected " + spec.type().name().toLowerCase(Locale.ROOT)));
        continue;
      }
      values.put(spec.name(), coerced);
    }
  }
}
