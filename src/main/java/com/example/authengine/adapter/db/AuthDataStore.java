package com.example.authengine.adapter.db;

import static com.example.authengine.schema.SchemaRegistry.ACCOUNT;
import static com.example.authengine.schema.SchemaRegistry.SESSION;
import static com.example.authengine.schema.SchemaRegistry.USER;
import static com.example.authengine.schema.SchemaRegistry.VERIFICATION;

import com.example.authengine.crypto.RandomTokens;
import com.example.authengine.domain.entity.Account;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.User;
import com.example.authengine.domain.entity.Verification;
import com.example.authengine.schema.SchemaRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Typed operations over the {@link DatabaseAdapter} for the four engine entities.
 * Emails are stored lower-cased.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthDataStore {

  private static final Set<String> USER_BASE_FIELDS =
      Set.of("id", "name", "email", "emailVerified", "image", "createdAt", "updatedAt");

  private final DatabaseAdapter adapter;
  private final SchemaRegistry schemaRegistry;
  private final Clock clock;

  // ----- users

  /**
   * Creates a user. {@code additionalFields} holds plugin field values; schema defaults are applied.
   */
  public User createUser(String name, String email, boolean emailVerified, String image,
                         Map<String, Object> additionalFields) {
    Instant now = clock.instant();
    Map<String, Object> row = new LinkedHashMap<>();
    if (additionalFields != null) {
      row.putAll(additionalFields);
    }
    row.put("id", RandomTokens.generateId());
    row.put("name", name);
    row.put("email", normalizeEmail(email));
    row.put("emailVerified", emailVerified);
    row.put("image", image);
    row.put("createdAt", now);
    row.put("updatedAt", now);
    Map<String, Object> created = adapter.create(USER, schemaRegistry.applyDefaults(USER, row));
    log.info("Created user {}", created.get("id"));
    return toUser(created);
  }

  public Optional<User> findUserById(String id) {
    return adapter.findOne(USER, List.of(Where.eq("id", id))).map(AuthDataStore::toUser);
  }

  public Optional<User> findUserByEmail(String email) {
    if (email == null) {
      return Optional.empty();
    }
    return adapter.findOne(USER, List.of(Where.eq("email", normalizeEmail(email))))
        .map(AuthDataStore::toUser);
  }

  public Optional<User> updateUser(String id, Map<String, Object> changes) {
    Map<String, Object> data = new HashMap<>(changes);
    if (data.containsKey("email")) {
      data.put("email", normalizeEmail((String) data.get("email")));
    }
    data.put("updatedAt", clock.instant());
    return adapter.update(USER, List.of(Where.eq("id", id)), data).map(AuthDataStore::toUser);
  }

  // ----- sessions

  public Session createSession(Session session) {
    return toSession(adapter.create(SESSION, fromSession(session)));
  }

  public Optional<Session> findSessionByToken(String token) {
    return adapter.findOne(SESSION, List.of(Where.eq("token", token))).map(AuthDataStore::toSession);
  }

  public List<Session> listSessionsForUser(String userId) {
    return adapter.findMany(SESSION, List.of(Where.eq("userId", userId)), SortBy.desc("createdAt"), null, null)
        .stream()
        .map(AuthDataStore::toSession)
        .toList();
  }

  public Optional<Session> updateSessionExpiry(String token, Instant expiresAt) {
    Map<String, Object> data = Map.of("expiresAt", expiresAt, "updatedAt", clock.instant());
    return adapter.update(SESSION, List.of(Where.eq("token", token)), data).map(AuthDataStore::toSession);
  }

  public void deleteSession(String token) {
    adapter.delete(SESSION, List.of(Where.eq("token", token)));
  }

  public long deleteSessionsForUser(String userId) {
    return adapter.deleteMany(SESSION, List.of(Where.eq("userId", userId)));
  }

  // ----- accounts

  public Account createAccount(Account account) {
    return toAccount(adapter.create(ACCOUNT, fromAccount(account)));
  }

  public Optional<Account> findAccount(String providerId, String accountId) {
    return adapter.findOne(ACCOUNT,
            List.of(Where.eq("providerId", providerId), Where.eq("accountId", accountId)))
        .map(AuthDataStore::toAccount);
  }

  public List<Account> listAccountsForUser(String userId) {
    return adapter.findMany(ACCOUNT, List.of(Where.eq("userId", userId)), SortBy.asc("createdAt"), null, null)
        .stream()
        .map(AuthDataStore::toAccount)
        .toList();
  }

  public Optional<Account> updateAccount(String id, Map<String, Object> changes) {
    Map<String, Object> data = new HashMap<>(changes);
    data.put("updatedAt", clock.instant());
    return adapter.update(ACCOUNT, List.of(Where.eq("id", id)), data).map(AuthDataStore::toAccount);
  }

  public void deleteAccount(String id) {
    adapter.delete(ACCOUNT, List.of(Where.eq("id", id)));
  }

  // ----- verification values

  public Verification createVerification(String identifier, String value, Instant expiresAt) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", RandomTokens.generateId());
    row.put("identifier", identifier);
    row.put("value", value);
    row.put("expiresAt", expiresAt);
    row.put("createdAt", clock.instant());
    return toVerification(adapter.create(VERIFICATION, row));
  }

  public Optional<Verification> findVerification(String identifier) {
    return adapter.findOne(VERIFICATION, List.of(Where.eq("identifier", identifier)))
        .map(AuthDataStore::toVerification);
  }

  /**
   * Deletes the verification value and reports whether a row was actually removed. Callers use
   * the result to consume a value at most once.
   */
  public boolean deleteVerification(String identifier) {
    return adapter.deleteMany(VERIFICATION, List.of(Where.eq("identifier", identifier))) > 0;
  }

  // ----- row mapping

  private static String normalizeEmail(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }

  static User toUser(Map<String, Object> row) {
    Map<String, Object> additional = new LinkedHashMap<>();
    row.forEach((key, value) -> {
      if (!USER_BASE_FIELDS.contains(key) && value != null) {
        additional.put(key, value);
      }
    });
    return new User(
        (String) row.get("id"),
        (String) row.get("name"),
        (String) row.get("email"),
        Boolean.TRUE.equals(row.get("emailVerified")),
        (String) row.get("image"),
        (Instant) row.get("createdAt"),
        (Instant) row.get("updatedAt"),
        additional);
  }

  static Session toSession(Map<String, Object> row) {
    return new Session(
        (String) row.get("id"),
        (String) row.get("token"),
        (String) row.get("userId"),
        (Instant) row.get("createdAt"),
        (Instant) row.get("updatedAt"),
        (Instant) row.get("expiresAt"),
        (String) row.get("ipAddress"),
        (String) row.get("userAgent"));
  }

  static Map<String, Object> fromSession(Session session) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", session.id());
    row.put("token", session.token());
    row.put("userId", session.userId());
    row.put("createdAt", session.createdAt());
    row.put("updatedAt", session.updatedAt());
    row.put("expiresAt", session.expiresAt());
    row.put("ipAddress", session.ipAddress());
    row.put("userAgent", session.userAgent());
    return row;
  }

  static Account toAccount(Map<String, Object> row) {
    return new Account(
        (String) row.get("id"),
        (String) row.get("userId"),
        (String) row.get("providerId"),
        (String) row.get("accountId"),
        (String) row.get("accessToken"),
        (String) row.get("refreshToken"),
        (String) row.get("idToken"),
        (Instant) row.get("accessTokenExpiresAt"),
        (Instant) row.get("refreshTokenExpiresAt"),
        (String) row.get("scope"),
        (Instant) row.get("createdAt"),
        (Instant) row.get("updatedAt"));
  }

  static Map<String, Object> fromAccount(Account account) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", account.id());
    row.put("userId", account.userId());
    row.put("providerId", account.providerId());
    row.put("accountId", account.accountId());
    row.put("accessToken", account.accessToken());
    row.put("refreshToken", account.refreshToken());
    row.put("idToken", account.idToken());
    row.put("accessTokenExpiresAt", account.accessTokenExpiresAt());
    row.put("refreshTokenExpiresAt", account.refreshTokenExpiresAt());
    row.put("scope", account.scope());
    row.put("createdAt", account.createdAt());
    row.put("updatedAt", account.updatedAt());
    return row;
  }

  static Verification toVerification(Map<String, Object> row) {
    return new Verification(
        (String) row.get("id"),
        (String) row.get("identifier"),
        (String) row.get("value"),
        (Instant) row.get("expiresAt"),
        (Instant) row.get("createdAt"));
  }
}
