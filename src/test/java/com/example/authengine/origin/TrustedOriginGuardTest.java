package com.example.authengine.origin;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authengine.pipeline.AuthRequest;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpMethod;

class TrustedOriginGuardTest {

  private final TrustedOriginGuard guard = new TrustedOriginGuard("http://localhost:3000",
      List.of("https://app.example.com", "https://*.preview.example.com", "http://localhost:*"), null);

  @Test
  void baseOriginIsAlwaysTrusted() {
    assertThat(guard.isTrusted("http://localhost:3000/dashboard?tab=1", false)).isTrue();
  }

  @Test
  void exactOriginEntryMatchesAnyPath() {
    assertThat(guard.isTrusted("https://app.example.com/welcome", false)).isTrue();
    assertThat(guard.isTrusted("http://app.example.com/welcome", false)).isFalse();
    assertThat(guard.isTrusted("https://app.example.com.evil.io/", false)).isFalse();
  }

  @Test
  void defaultPortIsTheSameOrigin() {
    assertThat(guard.isTrusted("https://app.example.com:443/welcome", false)).isTrue();
    assertThat(guard.isTrusted("https://app.example.com:8443/welcome", false)).isFalse();
    assertThat(guard.isTrusted("https://pr-12.preview.example.com:443/", false)).isTrue();

    TrustedOriginGuard plainHttp = new TrustedOriginGuard("http://example.org:80", List.of(), null);
    assertThat(plainHttp.isTrusted("http://example.org/", false)).isTrue();
    assertThat(plainHttp.isTrusted("http://example.org:80/", false)).isTrue();
  }

  @Nested
  class Wildcards {

    @Test
    void starMatchesASingleLabel() {
      assertThat(guard.isTrusted("https://pr-12.preview.example.com/", false)).isTrue();
      assertThat(guard.isTrusted("https://a.b.preview.example.com/", false)).isFalse();
      assertThat(guard.isTrusted("https://preview.example.com/", false)).isFalse();
    }

    @Test
    void patternSchemeMustMatch() {
      assertThat(guard.isTrusted("http://pr-12.preview.example.com/", false)).isFalse();
    }

    @Test
    void portWildcardMatchesAnyPort() {
      assertThat(guard.isTrusted("http://localhost:5173/", false)).isTrue();
    }
  }

  @Nested
  class RelativePaths {

    @Test
    void acceptedOnlyWhenAllowed() {
      assertThat(guard.isTrusted("/dashboard", true)).isTrue();
      assertThat(guard.isTrusted("/dashboard?tab=settings", true)).isTrue();
      assertThat(guard.isTrusted("/dashboard", false)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"//evil.com", "/\\evil.com", "/%2fevil.com", "/a b", "dashboard"})
    void protocolRelativeAndMalformedPathsAreRejected(String url) {
      assertThat(guard.isTrusted(url, true)).isFalse();
    }
  }

  @ParameterizedTest
  @ValueSource(strings = {"javascript:alert(1)", "data:text/html,hi", "ftp://localhost:3000/x", "https://evil.com", ""})
  void untrustedAbsoluteUrlsAreRejected(String url) {
    assertThat(guard.isTrusted(url, true)).isFalse();
  }

  @Test
  void dynamicOriginsAreEvaluatedPerRequest() {
    TrustedOriginGuard dynamic = new TrustedOriginGuard("http://localhost:3000", List.of(),
        request -> request != null && request.header("X-Tenant").isPresent()
            ? List.of("https://" + request.header("X-Tenant").get() + ".example.com")
            : List.of());
    AuthRequest tenantRequest = AuthRequest.builder(HttpMethod.POST, "/sign-out")
        .header("X-Tenant", "acme")
        .build();

    assertThat(dynamic.isTrusted("https://acme.example.com/", false, tenantRequest)).isTrue();
    assertThat(dynamic.isTrusted("https://acme.example.com/", false, null)).isFalse();
  }

  @Test
  void originOfNormalizesCaseAndKeepsExplicitPort() {
    assertThat(TrustedOriginGuard.originOf("HTTPS://App.Example.com:8443/path")).isEqualTo("https://app.example.com:8443");
    assertThat(TrustedOriginGuard.originOf("https://app.example.com:443/")).isEqualTo("https://app.example.com");
    assertThat(TrustedOriginGuard.originOf("http://localhost:80")).isEqualTo("http://localhost");
    assertThat(TrustedOriginGuard.originOf("mailto:a@b.c")).isNull();
  }
}
