package com.example.authengine.context;

import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.pipeline.EndpointResult;
import java.util.Optional;

@FunctionalInterface
public interface HookHandler {

  /**
   * Runs the hook. A before-hook returning a result short-circuits the request with it.
   * The return value of an after-hook is ignored: after-hooks only add headers and cookies.
   */
  Optional<EndpointResult> handle(EndpointContext context);
}
