package com.example.authengine.origin;

import com.example.authengine.context.Hook;
import com.example.authengine.context.HookMatcher;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.exception.ErrorCode;
import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.pipeline.EndpointResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

/**
 * Core before-hook guarding against cross-site request forgery and open redirects. Runs ahead
 * of every other hook.
 */
@Slf4j
@RequiredArgsConstructor
public class OriginCheckHook {

  public static final String ID = "origin-check";
  private static final String CALLBACK_PREFIX = "/callback/";

  private static final Map<String, ErrorCode> REDIRECT_PARAMS = new LinkedHashMap<>();

  static {
    REDIRECT_PARAMS.put("callbackURL", BaseErrorCodes.INVALID_CALLBACK_URL);
    REDIRECT_PARAMS.put("redirectTo", BaseErrorCodes.INVALID_REDIRECT_URL);
    REDIRECT_PARAMS.put("errorCallbackURL", BaseErrorCodes.INVALID_ERROR_CALLBACK_URL);
    REDIRECT_PARAMS.put("newUserCallbackURL", BaseErrorCodes.INVALID_NEW_USER_CALLBACK_URL);
  }

  private final boolean disabled;

  public Hook hook() {
    return new Hook(ID, HookMatcher.any(), Integer.MIN_VALUE, this::check);
  }

  Optional<EndpointResult> check(EndpointContext context) {
    if (disabled) {
      return Optional.empty();
    }
    AuthRequest request = context.getRequest();
    TrustedOriginGuard guard = context.getAuthContext().getOriginGuard();

    // provider form_post callbacks are cross-site by nature; the state parameter protects them
    boolean providerCallback = request.path().startsWith(CALLBACK_PREFIX);
    if (!providerCallback && !request.cookies().isEmpty() && !HttpMethod.GET.equals(request.method())) {
      String origin = request.header(HttpHeaders.ORIGIN)
          .filter(value -> !"null".equals(value))
          .or(() -> request.header(HttpHeaders.REFERER))
          .orElse(null);
      if (origin == null || !guard.isTrusted(origin, false, request)) {
        log.warn("Rejected {} {} from untrusted origin {}", request.method(), request.path(), origin);
        throw new AuthApiException(BaseErrorCodes.INVALID_ORIGIN);
      }
    }

    for (Map.Entry<String, ErrorCode> entry : REDIRECT_PARAMS.entrySet()) {
      Optional<String> value = context.input(entry.getKey());
      if (value.isPresent() && !guard.isTrusted(value.get(), true, request)) {
        log.warn("Rejected untrusted {} on {}: {}", entry.getKey(), request.path(), value.get());
        throw new AuthApiException(entry.getValue());
      }
    }
    return Optional.empty();
  }
}
