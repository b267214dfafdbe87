package com.example.authengine.exception;

import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes registered by the engine itself. Plugins may add their own but never reuse these.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class BaseErrorCodes {

  public static final ErrorCode USER_NOT_FOUND =
      new ErrorCode("USER_NOT_FOUND", "User not found", HttpStatus.NOT_FOUND);
  public static final ErrorCode FAILED_TO_CREATE_USER =
      new ErrorCode("FAILED_TO_CREATE_USER", "Failed to create user", HttpStatus.INTERNAL_SERVER_ERROR);
  public static final ErrorCode FAILED_TO_CREATE_SESSION =
      new ErrorCode("FAILED_TO_CREATE_SESSION", "Failed to create session", HttpStatus.INTERNAL_SERVER_ERROR);
  public static final ErrorCode FAILED_TO_GET_SESSION =
      new ErrorCode("FAILED_TO_GET_SESSION", "Failed to get session", HttpStatus.INTERNAL_SERVER_ERROR);
  public static final ErrorCode UNAUTHORIZED =
      new ErrorCode("UNAUTHORIZED", "Unauthorized", HttpStatus.UNAUTHORIZED);
  public static final ErrorCode PROVIDER_NOT_FOUND =
      new ErrorCode("PROVIDER_NOT_FOUND", "Provider not found", HttpStatus.NOT_FOUND);
  public static final ErrorCode INVALID_TOKEN =
      new ErrorCode("INVALID_TOKEN", "Invalid token", HttpStatus.BAD_REQUEST);
  public static final ErrorCode SESSION_EXPIRED = new ErrorCode("SESSION_EXPIRED",
      "Session expired. Re-authenticate to perform this action.", HttpStatus.UNAUTHORIZED);
  public static final ErrorCode SESSION_NOT_FRESH =
      new ErrorCode("SESSION_NOT_FRESH", "Session is not fresh", HttpStatus.FORBIDDEN);
  public static final ErrorCode ACCOUNT_NOT_FOUND =
      new ErrorCode("ACCOUNT_NOT_FOUND", "Account not found", HttpStatus.BAD_REQUEST);
  public static final ErrorCode FAILED_TO_UNLINK_LAST_ACCOUNT = new ErrorCode(
      "FAILED_TO_UNLINK_LAST_ACCOUNT", "You can't unlink your last account", HttpStatus.BAD_REQUEST);
  public static final ErrorCode SOCIAL_ACCOUNT_ALREADY_LINKED = new ErrorCode(
      "SOCIAL_ACCOUNT_ALREADY_LINKED", "Social account already linked", HttpStatus.BAD_REQUEST);
  public static final ErrorCode FAILED_TO_REFRESH_TOKEN = new ErrorCode(
      "FAILED_TO_REFRESH_TOKEN", "Failed to refresh access token", HttpStatus.BAD_REQUEST);
  public static final ErrorCode INVALID_ORIGIN =
      new ErrorCode("INVALID_ORIGIN", "Invalid origin", HttpStatus.FORBIDDEN);
  public static final ErrorCode INVALID_CALLBACK_URL =
      new ErrorCode("INVALID_CALLBACK_URL", "Invalid callbackURL", HttpStatus.FORBIDDEN);
  public static final ErrorCode INVALID_REDIRECT_URL =
      new ErrorCode("INVALID_REDIRECT_URL", "Invalid redirectURL", HttpStatus.FORBIDDEN);
  public static final ErrorCode INVALID_ERROR_CALLBACK_URL =
      new ErrorCode("INVALID_ERROR_CALLBACK_URL", "Invalid errorCallbackURL", HttpStatus.FORBIDDEN);
  public static final ErrorCode INVALID_NEW_USER_CALLBACK_URL = new ErrorCode(
      "INVALID_NEW_USER_CALLBACK_URL", "Invalid newUserCallbackURL", HttpStatus.FORBIDDEN);
  public static final ErrorCode VALIDATION_ERROR =
      new ErrorCode("VALIDATION_ERROR", "Validation Error", HttpStatus.BAD_REQUEST);
  public static final ErrorCode FIELD_NOT_ALLOWED =
      new ErrorCode("FIELD_NOT_ALLOWED", "Field not allowed to be set", HttpStatus.BAD_REQUEST);
  public static final ErrorCode MISSING_FIELD =
      new ErrorCode("MISSING_FIELD", "Field is required", HttpStatus.BAD_REQUEST);
  public static final ErrorCode NOT_FOUND =
      new ErrorCode("NOT_FOUND", "Not Found", HttpStatus.NOT_FOUND);
  public static final ErrorCode INTERNAL_SERVER_ERROR =
      new ErrorCode("INTERNAL_SERVER_ERROR", "Internal Server Error", HttpStatus.INTERNAL_SERVER_ERROR);

  public static List<ErrorCode> all() {
    return List.of(USER_NOT_FOUND, FAILED_TO_CREATE_USER, FAILED_TO_CREATE_SESSION,
        FAILED_TO_GET_SESSION, UNAUTHORIZED, PROVIDER_NOT_FOUND, INVALID_TOKEN, SESSION_EXPIRED,
        SESSION_NOT_FRESH, ACCOUNT_NOT_FOUND, FAILED_TO_UNLINK_LAST_ACCOUNT,
        SOCIAL_ACCOUNT_ALREADY_LINKED, FAILED_TO_REFRESH_TOKEN, INVALID_ORIGIN,
        INVALID_CALLBACK_URL, INVALID_REDIRECT_URL, INVALID_ERROR_CALLBACK_URL,
        INVALID_NEW_USER_CALLBACK_URL, VALIDATION_ERROR, FIELD_NOT_ALLOWED, MISSING_FIELD,
        NOT_FOUND, INTERNAL_SERVER_ERROR);
  }
}
