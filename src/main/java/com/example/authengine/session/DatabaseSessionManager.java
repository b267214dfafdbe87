package com.example.authengine.session;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.crypto.RandomTokens;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.domain.entity.User;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.util.CookieUtil;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Sessions stored as rows with a random opaque token. Lookups are cached locally for a few
 * seconds; every revoke invalidates the cache.
 */
@Slf4j
public class DatabaseSessionManager implements SessionManager {

  private static final int TOKEN_LENGTH = 32;

  private final AuthDataStore dataStore;
  private final Clock clock;
  private final Duration expiresIn;
  private final Cache<String, SessionWithUser> sessionCache;

  public DatabaseSessionManager(AuthDataStore dataStore, AuthOptions options, Clock clock) {
    this.dataStore = dataStore;
    this.clock = clock;
    this.expiresIn = options.getExpiresIn();
    Duration ttl = options.getSessionCacheTtl();
    this.sessionCache = ttl == null || ttl.isZero()
        ? null
        : Caffeine.newBuilder()
            .maximumSize(options.getSessionCacheMaxSize())
            .expireAfterWrite(ttl)
            .build();
  }

  @Override
  public Session createSession(String userId, String ipAddress, String userAgent) {
    Instant now = clock.instant();
    Session session = new Session(
        RandomTokens.generateId(),
        RandomTokens.generate(TOKEN_LENGTH),
        userId,
        now,
        now,
        now.plus(expiresIn),
        ipAddress,
        userAgent);
    try {
      Session created = dataStore.createSession(session);
      log.info("Created session {} for user {}", CookieUtil.mask(created.token()), userId);
      return created;
    } catch (RuntimeException e) {
      throw new AuthApiException(BaseErrorCodes.FAILED_TO_CREATE_SESSION, e);
    }
  }

  @Override
  public Optional<SessionWithUser> validateSession(String token) {
    if (token == null || token.isEmpty()) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    SessionWithUser cached = sessionCache == null ? null : sessionCache.getIfPresent(token);
    if (cached != null) {
      if (!cached.session().isExpired(now)) {
        return Optional.of(cached);
      }
      sessionCache.invalidate(token);
    }

    Optional<Session> session = dataStore.findSessionByToken(token);
    if (session.isEmpty()) {
      return Optional.empty();
    }
    if (session.get().isExpired(now)) {
      log.debug("Session {} expired at {}", CookieUtil.mask(token), session.get().expiresAt());
      dataStore.deleteSession(token);
      return Optional.empty();
    }
    Optional<User> user = dataStore.findUserById(session.get().userId());
    if (user.isEmpty()) {
      log.warn("Session {} references missing user {}", CookieUtil.mask(token), session.get().userId());
      return Optional.empty();
    }
    SessionWithUser result = new SessionWithUser(session.get(), user.get());
    if (sessionCache != null) {
      sessionCache.put(token, result);
      // a revoke that ran after the row read has already invalidated; drop what we just cached
      if (dataStore.findSessionByToken(token).isEmpty()) {
        sessionCache.asMap().remove(token, result);
        log.debug("Session {} was revoked during validation", CookieUtil.mask(token));
        return Optional.empty();
      }
    }
    return Optional.of(result);
  }

  @Override
  public Optional<Session> refreshSession(String token) {
    if (validateSession(token).isEmpty()) {
      return Optional.empty();
    }
    Optional<Session> refreshed = dataStore.updateSessionExpiry(token, clock.instant().plus(expiresIn));
    invalidate(token);
    refreshed.ifPresent(s -> log.debug("Refreshed session {} until {}", CookieUtil.mask(token), s.expiresAt()));
    return refreshed;
  }

  @Override
  public void revokeSession(String token) {
    dataStore.deleteSession(token);
    invalidate(token);
    log.info("Revoked session {}", CookieUtil.mask(token));
  }

  @Override
  public void revokeAllSessions(String userId) {
    List<Session> sessions = dataStore.listSessionsForUser(userId);
    long deleted = dataStore.deleteSessionsForUser(userId);
    sessions.forEach(s -> invalidate(s.token()));
    log.info("Revoked {} session(s) for user {}", deleted, userId);
  }

  @Override
  public List<Session> listSessions(String userId) {
    Instant now = clock.instant();
    return dataStore.listSessionsForUser(userId).stream()
        .filter(s -> !s.isExpired(now))
        .toList();
  }

  @Override
  public boolean supportsRevocation() {
    return true;
  }

  private void invalidate(String token) {
    if (sessionCache != null) {
      sessionCache.invalidate(token);
    }
  }
}
