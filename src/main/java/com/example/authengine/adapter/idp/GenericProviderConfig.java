package com.example.authengine.adapter.idp;

import java.util.List;

/**
 * Endpoints and credentials of a standard authorization-code provider.
 */
public record GenericProviderConfig(
    String id,
    String clientId,
    String clientSecret,
    String authorizationUri,
    String tokenUri,
    String userInfoUri,
    List<String> scopes,
    boolean pkce
) {
  public GenericProviderConfig {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
  }
}
