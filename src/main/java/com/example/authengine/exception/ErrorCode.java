package com.example.authengine.exception;

import org.springframework.http.HttpStatus;

/**
 * A registered, machine-readable error code with its default message and HTTP status.
 */
public record ErrorCode(String code, String message, HttpStatus status) {

  public ErrorCode {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Error code cannot be blank");
    }
  }
}
