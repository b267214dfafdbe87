package com.example.authengine.session;

import com.example.authengine.context.AuthOptions;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.pipeline.EndpointContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the session of a request from its signed cookie, applies the sliding refresh and
 * provides the session guards used by endpoints.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionResolver {

  private final SessionManager sessionManager;
  private final CookiePolicy cookiePolicy;
  private final AuthOptions options;
  private final Clock clock;

  /**
   * Resolves the session once per request and attaches the outcome to the context.
   */
  public Optional<SessionWithUser> resolve(EndpointContext context) {
    if (context.isSessionResolved()) {
      return context.getSession();
    }
    Optional<String> token = cookiePolicy.readSigned(context.getRequest(), CookiePolicy.SESSION_TOKEN);
    if (token.isEmpty()) {
      context.attachSession(null);
      return Optional.empty();
    }

    Optional<SessionWithUser> validated = sessionManager.validateSession(token.get());
    if (validated.isEmpty()) {
      context.setCookie(cookiePolicy.expire(CookiePolicy.SESSION_TOKEN));
      context.attachSession(null);
      return Optional.empty();
    }

    SessionWithUser current = validated.get();
    if (shouldRefresh(context, current.session())) {
      Optional<Session> refreshed = sessionManager.refreshSession(token.get());
      if (refreshed.isPresent()) {
        context.setCookie(cookiePolicy.sessionCookie(refreshed.get().token()));
        current = new SessionWithUser(refreshed.get(), current.user());
      }
    }
    context.attachSession(current);
    return Optional.of(current);
  }

  public SessionWithUser requireSession(EndpointContext context) {
    return resolve(context).orElseThrow(() -> new AuthApiException(BaseErrorCodes.UNAUTHORIZED));
  }

  /**
   * Requires a session created within the configured fresh age. A fresh age of zero disables
   * the check.
   */
  public SessionWithUser requireFreshSession(EndpointContext context) {
    SessionWithUser session = requireSession(context);
    Duration freshAge = options.getFreshAge();
    if (freshAge != null && !freshAge.isZero()) {
      Instant freshUntil = session.session().createdAt().plus(freshAge);
      if (clock.instant().isAfter(freshUntil)) {
        throw new AuthApiException(BaseErrorCodes.SESSION_NOT_FRESH);
      }
    }
    return session;
  }

  /**
   * Sets the cookie for a newly created session and makes it the session of this request.
   */
  public void establish(EndpointContext context, SessionWithUser session) {
    context.setCookie(cookiePolicy.sessionCookie(session.session().token()));
    context.attachSession(session);
  }

  public void clear(EndpointContext context) {
    context.setCookie(cookiePolicy.expire(CookiePolicy.SESSION_TOKEN));
    context.attachSession(null);
  }

  private boolean shouldRefresh(EndpointContext context, Session session) {
    if (options.isDisableSessionRefresh() || context.isDisableRefresh()) {
      return false;
    }
    Instant updateDue = session.expiresAt().minus(options.getExpiresIn()).plus(options.getUpdateAge());
    return !updateDue.isAfter(clock.instant());
  }
}
