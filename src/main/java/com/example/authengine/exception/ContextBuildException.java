package com.example.authengine.exception;

import lombok.Getter;

/**
 * Fatal error raised while folding plugin contributions into the auth context.
 * Never deferred to request time.
 */
@Getter
public class ContextBuildException extends RuntimeException {

  public enum Kind {
    DUPLICATE_PLUGIN,
    DUPLICATE_ENDPOINT,
    DUPLICATE_ERROR_CODE,
    INVALID_SCHEMA,
    INVALID_CONFIGURATION
  }

  private final Kind kind;

  public ContextBuildException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }
}
