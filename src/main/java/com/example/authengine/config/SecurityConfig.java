package com.example.authengine.config;

import com.example.authengine.properties.ApplicationProperties;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Servlet security around the engine. The engine authenticates its own requests, so Spring
 * Security only contributes headers and a deny-by-default chain.
 * <p>
 * ENGINE CHAIN (@Order(1)): everything under the auth base path, plus API docs.
 * DEFAULT CHAIN (@Order(2)): everything else is denied.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
public class SecurityConfig {

  @Bean
  @Order(1)
  public SecurityFilterChain authEngineFilterChain(HttpSecurity http, ApplicationProperties properties)
      throws Exception {
    http
        .securityMatcher(properties.basePath() + "/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // the engine runs its own origin check on cookie-bearing requests
        .csrf(AbstractHttpConfigurer::disable)
        // sessions live in the engine's store, never in the servlet container
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .requestCache(AbstractHttpConfigurer::disable)
        .headers(headers -> headers
            .frameOptions(FrameOptionsConfig::deny)
            .contentTypeOptions(contentType -> {
            })
            .referrerPolicy(referrer -> referrer.policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
            .httpStrictTransportSecurity(hsts -> hsts
                .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                .includeSubDomains(true))
            .addHeaderWriter((request, response) -> {
              // session and account responses must never be cached
              response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
              response.setHeader("Pragma", "no-cache");
            }));
  }
}
