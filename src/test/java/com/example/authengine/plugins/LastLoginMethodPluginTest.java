package com.example.authengine.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authengine.context.AuthContext;
import com.example.authengine.context.AuthContextBuilder;
import com.example.authengine.pipeline.AuthResponse;
import com.example.authengine.pipeline.RequestPipeline;
import com.example.authengine.schema.SchemaRegistry;
import com.example.authengine.support.Browser;
import com.example.authengine.support.FakeIdentityProvider;
import com.example.authengine.support.TestAuth;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LastLoginMethodPluginTest {

  private static final String COOKIE = "auth." + LastLoginMethodPlugin.COOKIE_NAME;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private Browser browser(LastLoginMethodPlugin plugin) {
    AuthContext context = AuthContextBuilder.create(TestAuth.options().build())
        .provider(FakeIdentityProvider.github())
        .plugin(plugin)
        .build();
    return new Browser(new RequestPipeline(context));
  }

  @Test
  void successfulSignInSetsReadableCookie() {
    Browser browser = browser(new LastLoginMethodPlugin());

    AuthResponse callback = browser.signInWith("github");

    assertThat(callback.setCookies())
        .filteredOn(c -> c.startsWith(COOKIE + "="))
        .singleElement()
        .satisfies(c -> assertThat(c).doesNotContain("HttpOnly").contains("Max-Age=2592000"));
    assertThat(browser.cookies()).containsEntry(COOKIE, "github");
  }

  @Test
  void failedCallbackLeavesCookieAlone() {
    Browser browser = browser(new LastLoginMethodPlugin());

    AuthResponse callback = browser.get("/api/auth/callback/github?code=" + FakeIdentityProvider.VALID_CODE);

    assertThat(callback.location()).contains("error=state_not_found");
    assertThat(browser.cookies()).doesNotContainKey(COOKIE);
  }

  @Test
  void storesMethodOnUserWhenConfigured() throws Exception {
    Browser browser = browser(new LastLoginMethodPlugin(true, Duration.ofDays(7)));
    browser.signInWith("github");

    JsonNode session = objectMapper.readTree(browser.get("/api/auth/get-session").body());

    assertThat(session.at("/user/" + LastLoginMethodPlugin.USER_FIELD).asText()).isEqualTo("github");
  }

  @Test
  void schemaFieldOnlyContributedWhenStoringInDatabase() {
    AuthContext withField = AuthContextBuilder.create(TestAuth.options().build())
        .plugin(new LastLoginMethodPlugin(true, null))
        .build();
    AuthContext withoutField = AuthContextBuilder.create(TestAuth.options().build())
        .plugin(new LastLoginMethodPlugin())
        .build();

    assertThat(withField.getSchemaRegistry().require(SchemaRegistry.USER).has(LastLoginMethodPlugin.USER_FIELD))
        .isTrue();
    assertThat(withoutField.getSchemaRegistry().require(SchemaRegistry.USER).has(LastLoginMethodPlugin.USER_FIELD))
        .isFalse();
  }
}
