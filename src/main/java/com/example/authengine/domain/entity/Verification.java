package com.example.authengine.domain.entity;

import java.time.Instant;

/**
 * Short-lived keyed value, used for OAuth2 flow state.
 */
public record Verification(
    String id,
    String identifier,
    String value,
    Instant expiresAt,
    Instant createdAt
) {}
