package com.example.authengine.support;

import com.example.authengine.context.AuthOptions;

public final class TestAuth {

  public static final String BASE_URL = "http://localhost:3000";
  public static final String SECRET = "test-secret-that-is-at-least-32-characters-long";

  private TestAuth() {}

  public static AuthOptions.AuthOptionsBuilder options() {
    return AuthOptions.builder()
        .baseUrl(BASE_URL)
        .secret(SECRET);
  }
}
