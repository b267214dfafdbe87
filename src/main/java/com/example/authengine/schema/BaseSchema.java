package com.example.authengine.schema;

import static com.example.authengine.schema.SchemaRegistry.ACCOUNT;
import static com.example.authengine.schema.SchemaRegistry.SESSION;
import static com.example.authengine.schema.SchemaRegistry.USER;
import static com.example.authengine.schema.SchemaRegistry.VERIFICATION;

import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Fields the engine itself reads and writes.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class BaseSchema {

  public static List<FieldAttribute> fields() {
    return List.of(
        FieldAttribute.internal(USER, "id", FieldType.STRING).withRequired(true),
        FieldAttribute.of(USER, "name", FieldType.STRING),
        FieldAttribute.internal(USER, "email", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(USER, "emailVerified", FieldType.BOOLEAN).withDefault(Boolean.FALSE),
        FieldAttribute.of(USER, "image", FieldType.STRING),
        FieldAttribute.internal(USER, "createdAt", FieldType.DATE),
        FieldAttribute.internal(USER, "updatedAt", FieldType.DATE),

        FieldAttribute.internal(SESSION, "id", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(SESSION, "token", FieldType.STRING).withRequired(true).withReturned(true),
        FieldAttribute.internal(SESSION, "userId", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(SESSION, "createdAt", FieldType.DATE),
        FieldAttribute.internal(SESSION, "updatedAt", FieldType.DATE),
        FieldAttribute.internal(SESSION, "expiresAt", FieldType.DATE).withRequired(true),
        FieldAttribute.internal(SESSION, "ipAddress", FieldType.STRING),
        FieldAttribute.internal(SESSION, "userAgent", FieldType.STRING),

        FieldAttribute.internal(ACCOUNT, "id", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(ACCOUNT, "userId", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(ACCOUNT, "providerId", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(ACCOUNT, "accountId", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(ACCOUNT, "accessToken", FieldType.STRING).withReturned(false),
        FieldAttribute.internal(ACCOUNT, "refreshToken", FieldType.STRING).withReturned(false),
        FieldAttribute.internal(ACCOUNT, "idToken", FieldType.STRING).withReturned(false),
        FieldAttribute.internal(ACCOUNT, "accessTokenExpiresAt", FieldType.DATE),
        FieldAttribute.internal(ACCOUNT, "refreshTokenExpiresAt", FieldType.DATE),
        FieldAttribute.internal(ACCOUNT, "scope", FieldType.STRING),
        FieldAttribute.internal(ACCOUNT, "createdAt", FieldType.DATE),
        FieldAttribute.internal(ACCOUNT, "updatedAt", FieldType.DATE),

        FieldAttribute.internal(VERIFICATION, "id", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(VERIFICATION, "identifier", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(VERIFICATION, "value", FieldType.STRING).withRequired(true),
        FieldAttribute.internal(VERIFICATION, "expiresAt", FieldType.DATE).withRequired(true),
        FieldAttribute.internal(VERIFICATION, "createdAt", FieldType.DATE)
    );
  }
}
