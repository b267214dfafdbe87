package com.example.authengine.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authengine.context.AuthOptions;
import com.example.authengine.properties.ApplicationProperties;
import com.example.authengine.support.TestAuth;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

class ConfigurationValidatorTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropertiesConfig.class)
      .withPropertyValues(
          "auth.base-url=" + TestAuth.BASE_URL,
          "auth.secret=" + TestAuth.SECRET);

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ApplicationProperties.class)
  @Import(ConfigurationValidator.class)
  static class PropertiesConfig {
  }

  @Test
  void validConfigurationBindsToOptions() {
    runner.withPropertyValues(
            "auth.session.expires-in=2d",
            "auth.oauth.trusted-providers=github",
            "auth.providers.github.client-id=abc",
            "auth.providers.github.client-secret=xyz",
            "auth.providers.github.authorization-uri=https://github.com/login/oauth/authorize",
            "auth.providers.github.token-uri=https://github.com/login/oauth/access_token",
            "auth.providers.github.scopes=read:user,user:email")
        .run(context -> {
          assertThat(context).hasNotFailed();
          ApplicationProperties properties = context.getBean(ApplicationProperties.class);
          AuthOptions options = properties.toAuthOptions();
          assertThat(options.getExpiresIn()).isEqualTo(Duration.ofDays(2));
          assertThat(options.getUpdateAge()).isEqualTo(Duration.ofDays(1));
          assertThat(options.getBasePath()).isEqualTo("/api/auth");
          assertThat(options.getTrustedProviders()).containsExactly("github");
          assertThat(options.isSecureCookies()).isFalse();
          assertThat(properties.providers().get("github").toConfig("github").scopes())
              .containsExactly("read:user", "user:email");
        });
  }

  @Test
  void plainHttpOutsideLocalhostIsRejected() {
    runner.withPropertyValues("auth.base-url=http://auth.example.com")
        .run(context -> assertThat(context).getFailure()
            .rootCause()
            .hasMessageContaining("Base URL must use HTTPS"));
  }

  @Test
  void sameSiteNoneNeedsSecureCookies() {
    runner.withPropertyValues("auth.cookies.same-site=None")
        .run(context -> assertThat(context).getFailure()
            .rootCause()
            .hasMessageContaining("SameSite=None"));
  }

  @Test
  void everyProblemIsReportedTogether() {
    runner.withPropertyValues(
            "auth.base-path=/api/auth/",
            "auth.session.update-age=30d",
            "auth.providers.acme.client-id=abc",
            "auth.providers.acme.authorization-uri=not a url",
            "auth.providers.acme.token-uri=https://acme.example.com/token",
            "auth.providers.acme.pkce=false")
        .run(context -> assertThat(context).getFailure()
            .rootCause()
            .hasMessageContaining("4 error(s)")
            .hasMessageContaining("Base path must not end with '/'")
            .hasMessageContaining("updateAge")
            .hasMessageContaining("authorization URI")
            .hasMessageContaining("needs a client secret"));
  }

  @Test
  void shortSecretFailsBinding() {
    runner.withPropertyValues("auth.secret=too-short")
        .run(context -> assertThat(context).hasFailed());
  }
}
