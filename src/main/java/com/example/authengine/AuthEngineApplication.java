package com.example.authengine;

import com.example.authengine.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Auth Engine Application
 *
 * Session and OAuth2 sign-in service for browser applications:
 * - database-backed or stateless sessions in cookies
 * - authorization-code + PKCE against any configured provider
 * - plugin endpoints and hooks
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class AuthEngineApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(AuthEngineApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
