package com.example.authengine.exception;

import lombok.Getter;

/**
 * Failure talking to an external identity provider. {@code structured} is true when the
 * provider answered with an OAuth2 error body rather than failing at the transport level.
 */
@Getter
public class ProviderException extends RuntimeException {

  private final boolean structured;

  public ProviderException(String message, boolean structured) {
    super(message);
    this.structured = structured;
  }

  public ProviderException(String message, Throwable cause) {
    super(message, cause);
    this.structured = false;
  }
}
