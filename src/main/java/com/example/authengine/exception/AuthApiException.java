package com.example.authengine.exception;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Structured error thrown by hooks and endpoint handlers.
 * The request pipeline is the only component that turns it into an HTTP response.
 */
@Getter
public class AuthApiException extends RuntimeException {

  private final HttpStatus status;
  private final String code;
  private final transient List<Map<String, String>> details;

  public AuthApiException(HttpStatus status, String code, String message) {
    this(status, code, message, Collections.emptyList(), null);
  }

  public AuthApiException(HttpStatus status, String code, String message,
                          List<Map<String, String>> details) {
    this(status, code, message, details, null);
  }

  public AuthApiException(HttpStatus status, String code, String message,
                          List<Map<String, String>> details, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.code = code;
    this.details = details == null ? Collections.emptyList() : List.copyOf(details);
  }

  public AuthApiException(ErrorCode errorCode) {
    this(errorCode.status(), errorCode.code(), errorCode.message());
  }

  public AuthApiException(ErrorCode errorCode, Throwable cause) {
    this(errorCode.status(), errorCode.code(), errorCode.message(), Collections.emptyList(), cause);
  }
}
