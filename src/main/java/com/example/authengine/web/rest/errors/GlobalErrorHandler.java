package com.example.authengine.web.rest.errors;

import com.example.authengine.exception.BaseErrorCodes;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Errors raised by the servlet layer before a request reaches the engine pipeline. The pipeline
 * maps its own errors; this keeps the {@code {code, message}} shape for everything else.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  private static final String CODE = "code";
  private static final String MESSAGE = "message";

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
    log.debug("Method not supported: {}", ex.getMethod());
    return body(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED",
        "Method " + ex.getMethod() + " is not supported");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
    log.error("Unhandled error outside the auth pipeline", ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, BaseErrorCodes.INTERNAL_SERVER_ERROR.code(),
        BaseErrorCodes.INTERNAL_SERVER_ERROR.message());
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put(CODE, code);
    body.put(MESSAGE, message);
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }
}
