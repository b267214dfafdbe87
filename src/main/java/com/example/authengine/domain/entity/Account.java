package com.example.authengine.domain.entity;

import java.time.Instant;

/**
 * One identity-provider linkage of a user. {@code (providerId, accountId)} is unique.
 */
public record Account(
    String id,
    String userId,
    String providerId,
    String accountId,
    String accessToken,
    String refreshToken,
    String idToken,
    Instant accessTokenExpiresAt,
    Instant refreshTokenExpiresAt,
    String scope,
    Instant createdAt,
    Instant updatedAt
) {}
