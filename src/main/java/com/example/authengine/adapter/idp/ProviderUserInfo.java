package com.example.authengine.adapter.idp;

/**
 * Provider-reported identity, already mapped out of the provider-specific user-info shape.
 */
public record ProviderUserInfo(
    String id,
    String email,
    boolean emailVerified,
    String name,
    String image
) {}
