package com.example.authengine.domain.entity;

import java.time.Instant;

/**
 * An authenticated session. In stateless mode this is a value carried inside the session
 * token rather than a stored row.
 */
public record Session(
    String id,
    String token,
    String userId,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt,
    String ipAddress,
    String userAgent
) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public Session withToken(String newToken) {
    return new Session(id, newToken, userId, createdAt, updatedAt, expiresAt, ipAddress, userAgent);
  }
}
