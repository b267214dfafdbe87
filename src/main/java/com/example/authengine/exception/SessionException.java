package com.example.authengine.exception;

/**
 * Session persistence or token encoding failure.
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
