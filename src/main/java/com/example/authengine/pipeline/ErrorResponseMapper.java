package com.example.authengine.pipeline;

import com.example.authengine.context.AuthContext;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.exception.ErrorCode;
import com.example.authengine.exception.OAuth2Exception;
import com.example.authengine.exception.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * The single place where errors become HTTP responses. Bodies have the shape
 * {@code {code, message, details?}}; 5xx bodies never carry internal error text.
 */
@Slf4j
public class ErrorResponseMapper {

  static final String PROVIDER_ERROR = "PROVIDER_ERROR";
  private static final String FALLBACK_BODY =
      "{\"code\":\"INTERNAL_SERVER_ERROR\",\"message\":\"Internal Server Error\"}";

  public AuthResponse map(Throwable error, AuthContext context, AuthRequest request) {
    if (error instanceof AuthApiException apiError) {
      HttpStatus status = context.getErrorCode(apiError.getCode())
          .map(ErrorCode::status)
          .orElse(apiError.getStatus());
      if (status.is5xxServerError()) {
        log.error("{} {} failed with {}", request.method(), request.path(), apiError.getCode(), apiError);
        return respond(context, status, apiError.getCode(), genericMessage(context, apiError.getCode()), null);
      }
      log.debug("{} {} rejected with {}: {}", request.method(), request.path(), apiError.getCode(),
          apiError.getMessage());
      String message = apiError.getMessage() != null
          ? apiError.getMessage()
          : context.getErrorCode(apiError.getCode()).map(ErrorCode::message).orElse(apiError.getCode());
      return respond(context, status, apiError.getCode(), message,
          apiError.getDetails().isEmpty() ? null : apiError.getDetails());
    }
    if (error instanceof OAuth2Exception oauthError) {
      log.warn("{} {} OAuth2 error {}: {}", request.method(), request.path(), oauthError.getErrorCode(),
          oauthError.getMessage());
      return respond(context, HttpStatus.BAD_REQUEST, oauthError.getErrorCode(), oauthError.getMessage(), null);
    }
    if (error instanceof ProviderException providerError && providerError.isStructured()) {
      log.warn("{} {} provider rejected the request: {}", request.method(), request.path(),
          providerError.getMessage());
      return respond(context, HttpStatus.BAD_REQUEST, PROVIDER_ERROR, providerError.getMessage(), null);
    }

    log.error("Unhandled error on {} {}", request.method(), request.path(), error);
    return respond(context, HttpStatus.INTERNAL_SERVER_ERROR, BaseErrorCodes.INTERNAL_SERVER_ERROR.code(),
        BaseErrorCodes.INTERNAL_SERVER_ERROR.message(), null);
  }

  private static String genericMessage(AuthContext context, String code) {
    return context.getErrorCode(code)
        .map(ErrorCode::message)
        .orElse(BaseErrorCodes.INTERNAL_SERVER_ERROR.message());
  }

  private static AuthResponse respond(AuthContext context, HttpStatus status, String code, String message,
                                      Object details) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("code", code);
    body.put("message", message);
    if (details != null) {
      body.put("details", details);
    }
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return new AuthResponse(status, headers, serialize(context.getObjectMapper(), body));
  }

  private static String serialize(ObjectMapper objectMapper, Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize error body", e);
      return FALLBACK_BODY;
    }
  }
}
