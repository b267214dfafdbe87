package com.example.authengine.config;

import com.example.authengine.properties.ApplicationProperties;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OkHttp client used for every identity-provider call.
 *
 * Shared connection pool and dispatcher so provider calls reuse connections.
 */
@Configuration
public class HttpClientConfig {

  @Bean
  public ConnectionPool sharedConnectionPool(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties http = properties.http();
    return new ConnectionPool(http.maxIdleConnections(), http.keepAlive().toMillis(), TimeUnit.MILLISECONDS);
  }

  @Bean
  public Dispatcher sharedDispatcher(ApplicationProperties properties) {
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(properties.http().maxRequests());
    dispatcher.setMaxRequestsPerHost(properties.http().maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Redirects are not followed: a token endpoint answering with a redirect is an error.
   */
  @Bean
  public OkHttpClient providerOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher,
                                           ApplicationProperties properties) {
    Duration connectTimeout = properties.http().connectTimeout();
    Duration readTimeout = properties.http().readTimeout();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(readTimeout)
        .callTimeout(properties.http().callTimeout())
        .retryOnConnectionFailure(true)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
