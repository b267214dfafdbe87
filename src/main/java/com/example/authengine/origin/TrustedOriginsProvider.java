package com.example.authengine.origin;

import com.example.authengine.pipeline.AuthRequest;
import java.util.List;

/**
 * Computes additional trusted origins from the inbound request. Evaluated on every request,
 * never cached. {@code request} is null when no request is in scope.
 */
@FunctionalInterface
public interface TrustedOriginsProvider {

  List<String> trustedOrigins(AuthRequest request);
}
