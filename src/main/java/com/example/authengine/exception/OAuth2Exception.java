package com.example.authengine.exception;

import lombok.Getter;

/**
 * OAuth2 flow failure. {@code errorCode} is the machine-readable value sent back
 * to the caller as the {@code error} query parameter of the error redirect.
 */
@Getter
public class OAuth2Exception extends RuntimeException {

  private final String errorCode;

  public OAuth2Exception(String errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public OAuth2Exception(String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
