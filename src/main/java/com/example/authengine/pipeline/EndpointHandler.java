package com.example.authengine.pipeline;

@FunctionalInterface
public interface EndpointHandler {

  EndpointResult handle(EndpointContext context);
}
