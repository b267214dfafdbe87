package com.example.authengine.adapter.idp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.authengine.exception.ProviderException;
import com.example.authengine.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GenericOAuthProviderTest {

  private static final String REDIRECT_URI = "http://localhost:3000/api/auth/callback/acme";

  private MockWebServer server;
  private final MutableClock clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
  private final OkHttpClient httpClient = new OkHttpClient.Builder().followRedirects(false).build();

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private GenericOAuthProvider provider(String clientSecret, boolean pkce) {
    GenericProviderConfig config = new GenericProviderConfig("acme", "client-1", clientSecret,
        "https://acme.example.com/oauth/authorize", server.url("/token").toString(),
        server.url("/userinfo").toString(), List.of("openid", "email"), pkce);
    return new GenericOAuthProvider(config, httpClient, new ObjectMapper(), clock);
  }

  @Test
  void authorizationUrlCarriesStateScopesAndChallenge() {
    URI uri = provider("s3cret", true)
        .createAuthorizationUrl("state-1", "challenge-1", List.of("email", "profile"), REDIRECT_URI);

    HttpUrl url = HttpUrl.get(uri.toString());
    assertThat(url.host()).isEqualTo("acme.example.com");
    assertThat(url.queryParameter("response_type")).isEqualTo("code");
    assertThat(url.queryParameter("client_id")).isEqualTo("client-1");
    assertThat(url.queryParameter("redirect_uri")).isEqualTo(REDIRECT_URI);
    assertThat(url.queryParameter("state")).isEqualTo("state-1");
    assertThat(url.queryParameter("scope")).isEqualTo("openid email profile");
    assertThat(url.queryParameter("code_challenge")).isEqualTo("challenge-1");
    assertThat(url.queryParameter("code_challenge_method")).isEqualTo("S256");
  }

  @Test
  void authorizationUrlWithoutPkceOmitsChallenge() {
    URI uri = provider("s3cret", false).createAuthorizationUrl("state-1", null, List.of(), REDIRECT_URI);

    assertThat(HttpUrl.get(uri.toString()).queryParameter("code_challenge")).isNull();
  }

  @Test
  void exchangeCodePostsFormAndParsesTokens() throws Exception {
    server.enqueue(new MockResponse()
        .setHeader("Content-Type", "application/json")
        .setBody("{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"id_token\":\"it\","
            + "\"expires_in\":3600,\"scope\":\"openid email\",\"token_type\":\"Bearer\"}"));

    OAuthTokens tokens = provider("s3cret", true).exchangeCode("code-1", "verifier-1", REDIRECT_URI);

    assertThat(tokens.accessToken()).isEqualTo("at");
    assertThat(tokens.refreshToken()).isEqualTo("rt");
    assertThat(tokens.idToken()).isEqualTo("it");
    assertThat(tokens.accessTokenExpiresAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
    assertThat(tokens.refreshTokenExpiresAt()).isNull();
    assertThat(tokens.scopes()).containsExactly("openid", "email");

    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/token");
    assertThat(request.getHeader("Authorization")).startsWith("Basic ");
    String form = request.getBody().readUtf8();
    assertThat(form).contains("grant_type=authorization_code", "code=code-1", "code_verifier=verifier-1",
        "client_id=client-1");
  }

  @Test
  void publicClientSendsNoBasicAuth() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"access_token\":\"at\"}"));

    provider(null, true).exchangeCode("code-1", "verifier-1", REDIRECT_URI);

    assertThat(server.takeRequest().getHeader("Authorization")).isNull();
  }

  @Test
  void oauthErrorBodyIsStructured() {
    server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"invalid_grant\"}"));

    assertThatThrownBy(() -> provider("s3cret", true).exchangeCode("stale", "v", REDIRECT_URI))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("invalid_grant")
        .satisfies(e -> assertThat(((ProviderException) e).isStructured()).isTrue());
  }

  @Test
  void serverFailureIsNotStructured() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

    assertThatThrownBy(() -> provider("s3cret", true).exchangeCode("code", "v", REDIRECT_URI))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("503")
        .satisfies(e -> assertThat(((ProviderException) e).isStructured()).isFalse());
  }

  @Test
  void refreshSendsRefreshGrant() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"access_token\":\"at-2\",\"refresh_token\":\"rt-2\"}"));

    OAuthTokens tokens = provider("s3cret", true).refreshAccessToken("rt-1");

    assertThat(tokens.accessToken()).isEqualTo("at-2");
    assertThat(server.takeRequest().getBody().readUtf8()).contains("grant_type=refresh_token", "refresh_token=rt-1");
  }

  @Test
  void userInfoMapsOidcClaims() throws Exception {
    server.enqueue(new MockResponse().setBody(
        "{\"sub\":\"u-1\",\"email\":\"ada@example.com\",\"email_verified\":true,\"name\":\"Ada\","
            + "\"picture\":\"https://img.example.com/ada.png\"}"));

    Optional<ProviderUserInfo> info = provider("s3cret", true).getUserInfo(tokens("at"));

    assertThat(info).contains(new ProviderUserInfo("u-1", "ada@example.com", true, "Ada",
        "https://img.example.com/ada.png"));
    assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer at");
  }

  @Test
  void userInfoFallsBackToNumericIdAndAvatar() {
    server.enqueue(new MockResponse().setBody(
        "{\"id\":1234,\"email\":\"octo@example.com\",\"avatar_url\":\"https://img.example.com/o.png\"}"));

    ProviderUserInfo info = provider("s3cret", true).getUserInfo(tokens("at")).orElseThrow();

    assertThat(info.id()).isEqualTo("1234");
    assertThat(info.emailVerified()).isFalse();
    assertThat(info.image()).isEqualTo("https://img.example.com/o.png");
  }

  @Test
  void userInfoWithoutSubjectIsEmpty() {
    server.enqueue(new MockResponse().setBody("{\"email\":\"nobody@example.com\"}"));

    assertThat(provider("s3cret", true).getUserInfo(tokens("at"))).isEmpty();
  }

  private static OAuthTokens tokens(String accessToken) {
    return new OAuthTokens(accessToken, null, null, null, null, List.of(), "Bearer");
  }
}
