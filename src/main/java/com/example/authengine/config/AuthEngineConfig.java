package com.example.authengine.config;

import com.example.authengine.adapter.db.DatabaseAdapter;
import com.example.authengine.adapter.db.MemoryDatabaseAdapter;
import com.example.authengine.adapter.idp.GenericOAuthProvider;
import com.example.authengine.adapter.idp.IdentityProvider;
import com.example.authengine.context.AuthContext;
import com.example.authengine.context.AuthContextBuilder;
import com.example.authengine.context.AuthPlugin;
import com.example.authengine.pipeline.RequestPipeline;
import com.example.authengine.plugins.LastLoginMethodPlugin;
import com.example.authengine.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine: one immutable {@link AuthContext} and the pipeline in front of it.
 *
 * <p>Providers come from {@code auth.providers.*}; any extra {@link IdentityProvider},
 * {@link AuthPlugin} or {@link DatabaseAdapter} bean in the application context is picked up.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class AuthEngineConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock authClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(DatabaseAdapter.class)
  public DatabaseAdapter memoryDatabaseAdapter() {
    log.warn("No DatabaseAdapter bean found, using the in-memory adapter; data is lost on restart");
    return new MemoryDatabaseAdapter();
  }

  @Bean
  @ConditionalOnProperty(prefix = "auth.plugins.last-login-method", name = "enabled", havingValue = "true")
  public LastLoginMethodPlugin lastLoginMethodPlugin(ApplicationProperties properties) {
    ApplicationProperties.PluginProperties.LastLoginMethodProperties plugin =
        properties.plugins().lastLoginMethod();
    return new LastLoginMethodPlugin(plugin.storeInDatabase(), plugin.maxAge());
  }

  @Bean
  public AuthContext authContext(ApplicationProperties properties, DatabaseAdapter databaseAdapter,
                                 OkHttpClient providerOkHttpClient, ObjectMapper objectMapper, Clock clock,
                                 ObjectProvider<IdentityProvider> extraProviders,
                                 ObjectProvider<AuthPlugin> plugins) {
    AuthContextBuilder builder = AuthContextBuilder.create(properties.toAuthOptions())
        .adapter(databaseAdapter)
        .objectMapper(objectMapper)
        .clock(clock);

    properties.providers().forEach((id, provider) -> builder.provider(
        new GenericOAuthProvider(provider.toConfig(id), providerOkHttpClient, objectMapper, clock)));
    extraProviders.orderedStream().forEach(builder::provider);
    plugins.orderedStream().forEach(builder::plugin);

    return builder.build();
  }

  @Bean
  public RequestPipeline requestPipeline(AuthContext authContext) {
    return new RequestPipeline(authContext);
  }
}
