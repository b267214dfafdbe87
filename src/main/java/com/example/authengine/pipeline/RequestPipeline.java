package com.example.authengine.pipeline;

import com.example.authengine.context.AuthContext;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.context.EndpointRegistry;
import com.example.authengine.context.Hook;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * Runs one request through resolve, parse, before-hooks, handler, after-hooks and respond.
 * Any error thrown by a stage skips the remaining stages, including after-hooks, and is mapped
 * by {@link ErrorResponseMapper}.
 */
@Slf4j
public class RequestPipeline {

  private final AuthContext context;
  private final RequestParser parser;
  private final ErrorResponseMapper errorMapper;

  public RequestPipeline(AuthContext context) {
    this.context = context;
    this.parser = new RequestParser(context.getObjectMapper());
    this.errorMapper = new ErrorResponseMapper();
  }

  public AuthResponse handle(AuthRequest rawRequest) {
    AuthRequest request = rawRequest.withPath(routePath(rawRequest.path()));
    try {
      EndpointContext endpointContext = resolveAndParse(request);

      for (Hook hook : context.getBeforeHooks(request)) {
        Optional<EndpointResult> shortCircuit = hook.handler().handle(endpointContext);
        if (shortCircuit.isPresent()) {
          log.debug("Before-hook {} answered {} {}", hook.id(), request.method(), request.path());
          return respond(endpointContext, shortCircuit.get());
        }
      }

      EndpointResult result = endpointContext.getEndpoint().handler().handle(endpointContext);
      if (result == null) {
        result = EndpointResult.json(null);
      }
      endpointContext.setResult(result);

      for (Hook hook : context.getAfterHooks(request)) {
        if (hook.handler().handle(endpointContext).isPresent()) {
          log.warn("Ignoring response replacement from after-hook {}", hook.id());
        }
      }
      return respond(endpointContext, result);
    } catch (RuntimeException e) {
      return errorMapper.map(e, context, request);
    }
  }

  private EndpointContext resolveAndParse(AuthRequest request) {
    if (request.path() == null || isDisabled(request.path())) {
      throw new AuthApiException(BaseErrorCodes.NOT_FOUND);
    }
    EndpointRegistry.Match match = context.getEndpoint(request.path(), request.method())
        .orElseThrow(() -> new AuthApiException(BaseErrorCodes.NOT_FOUND));
    RequestParser.Parsed parsed = parser.parse(request, match.endpoint().shape());
    return new EndpointContext(context, request, match.endpoint(), match.params(), parsed.body(), parsed.query());
  }

  private AuthResponse respond(EndpointContext endpointContext, EndpointResult result) {
    HttpHeaders headers = new HttpHeaders();
    headers.putAll(endpointContext.getResponseHeaders());

    if (result.isRedirect()) {
      String location = result.getRedirectUrl();
      if (!context.getOriginGuard().isTrusted(location, true, endpointContext.getRequest())) {
        log.warn("Refusing redirect to untrusted location {}", location);
        throw new AuthApiException(BaseErrorCodes.INVALID_REDIRECT_URL);
      }
      headers.set(HttpHeaders.LOCATION, location);
      return new AuthResponse(result.getStatus(), headers, null);
    }

    headers.setContentType(MediaType.APPLICATION_JSON);
    try {
      String body = context.getObjectMapper().writeValueAsString(result.getBody());
      return new AuthResponse(result.getStatus(), headers, body);
    } catch (JsonProcessingException e) {
      throw new AuthApiException(HttpStatus.INTERNAL_SERVER_ERROR,
          BaseErrorCodes.INTERNAL_SERVER_ERROR.code(), "Failed to serialize response", null, e);
    }
  }

  /**
   * Strips the base path and any trailing slash. Returns null for paths outside the base path.
   */
  String routePath(String fullPath) {
    String basePath = context.getOptions().getBasePath();
    String path = fullPath == null ? "" : fullPath;
    if (!"/".equals(basePath)) {
      if (!path.equals(basePath) && !path.startsWith(basePath + "/")) {
        return null;
      }
      path = path.substring(basePath.length());
    }
    while (path.length() > 1 && path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path.isEmpty() ? "/" : path;
  }

  private boolean isDisabled(String path) {
    AuthOptions options = context.getOptions();
    return options.getDisabledPaths().contains(path);
  }
}
