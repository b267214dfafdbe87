package com.example.authengine.routes;

import static com.example.authengine.schema.SchemaRegistry.ACCOUNT;
import static com.example.authengine.schema.SchemaRegistry.SESSION;
import static com.example.authengine.schema.SchemaRegistry.USER;

import com.example.authengine.domain.entity.Account;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.domain.entity.User;
import com.example.authengine.schema.SchemaRegistry;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * JSON views of the entities, filtered through the schema so {@code returned=false} fields
 * never leave the engine.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class ResponseViews {

  static Map<String, Object> user(SchemaRegistry schema, User user) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", user.id());
    row.put("name", user.name());
    row.put("email", user.email());
    row.put("emailVerified", user.emailVerified());
    row.put("image", user.image());
    row.put("createdAt", user.createdAt());
    row.put("updatedAt", user.updatedAt());
    row.putAll(user.additionalFields());
    return schema.transformOutput(USER, row);
  }

  static Map<String, Object> session(SchemaRegistry schema, Session session) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", session.id());
    row.put("token", session.token());
    row.put("userId", session.userId());
    row.put("createdAt", session.createdAt());
    row.put("updatedAt", session.updatedAt());
    row.put("expiresAt", session.expiresAt());
    row.put("ipAddress", session.ipAddress());
    row.put("userAgent", session.userAgent());
    return schema.transformOutput(SESSION, row);
  }

  static Map<String, Object> sessionWithUser(SchemaRegistry schema, SessionWithUser value) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("session", session(schema, value.session()));
    body.put("user", user(schema, value.user()));
    return body;
  }

  static Map<String, Object> account(SchemaRegistry schema, Account account) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", account.id());
    row.put("providerId", account.providerId());
    row.put("accountId", account.accountId());
    row.put("userId", account.userId());
    row.put("accessToken", account.accessToken());
    row.put("refreshToken", account.refreshToken());
    row.put("idToken", account.idToken());
    row.put("scopes", scopes(account.scope()));
    row.put("createdAt", account.createdAt());
    row.put("updatedAt", account.updatedAt());
    return schema.transformOutput(ACCOUNT, row);
  }

  static List<String> scopes(String scope) {
    if (scope == null || scope.isBlank()) {
      return List.of();
    }
    return Arrays.stream(scope.split("[,\\s]+")).filter(s -> !s.isEmpty()).toList();
  }
}
