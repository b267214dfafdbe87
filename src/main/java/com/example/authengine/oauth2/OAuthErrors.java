package com.example.authengine.oauth2;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Machine-readable values of the {@code error} parameter on OAuth2 error redirects.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class OAuthErrors {

  public static final String STATE_NOT_FOUND = "state_not_found";
  public static final String STATE_MISMATCH = "state_mismatch";
  public static final String PLEASE_RESTART = "please_restart_the_process";
  public static final String NO_CODE = "no_code";
  public static final String INVALID_CODE = "invalid_code";
  public static final String UNABLE_TO_GET_USER_INFO = "unable_to_get_user_info";
  public static final String EMAIL_NOT_FOUND = "email_not_found";
  public static final String ACCOUNT_NOT_LINKED = "account_not_linked";
  public static final String SIGNUP_DISABLED = "signup_disabled";
  public static final String ACCOUNT_LINKED_TO_DIFFERENT_USER = "account_already_linked_to_different_user";
  public static final String EMAIL_DOES_NOT_MATCH = "email_doesn't_match";
  public static final String UNABLE_TO_LINK_ACCOUNT = "unable_to_link_account";
  public static final String INTERNAL_SERVER_ERROR = "internal_server_error";
}
