package com.example.authengine.context;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.adapter.db.DatabaseAdapter;
import com.example.authengine.adapter.db.MemoryDatabaseAdapter;
import com.example.authengine.adapter.idp.IdentityProvider;
import com.example.authengine.crypto.EncryptionService;
import com.example.authengine.crypto.HmacSigner;
import com.example.authengine.crypto.KeyDerivation;
import com.example.authengine.exception.ContextBuildException;
import com.example.authengine.exception.ContextBuildException.Kind;
import com.example.authengine.exception.ErrorCode;
import com.example.authengine.oauth2.AccountLinker;
import com.example.authengine.oauth2.DatabaseStateStore;
import com.example.authengine.oauth2.EncryptedStateStore;
import com.example.authengine.oauth2.OAuth2Service;
import com.example.authengine.oauth2.OAuthStateStore;
import com.example.authengine.origin.TrustedOriginGuard;
import com.example.authengine.pipeline.Endpoint;
import com.example.authengine.routes.CoreEndpoints;
import com.example.authengine.schema.BaseSchema;
import com.example.authengine.schema.FieldAttribute;
import com.example.authengine.schema.SchemaRegistry;
import com.example.authengine.session.CookiePolicy;
import com.example.authengine.session.DatabaseSessionManager;
import com.example.authengine.session.SessionManager;
import com.example.authengine.session.SessionResolver;
import com.example.authengine.session.StatelessSessionManager;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds the core contribution and every plugin contribution, in registration order, into one
 * immutable {@link AuthContext}. Any conflict fails the build.
 */
@Slf4j
public class AuthContextBuilder {

  static final String CORE_ID = CoreEndpoints.ID;
  private static final int MIN_SECRET_LENGTH = 32;

  private final AuthOptions options;
  private final List<AuthPlugin> plugins = new ArrayList<>();
  private final Map<String, IdentityProvider> providers = new LinkedHashMap<>();
  private DatabaseAdapter adapter;
  private ObjectMapper objectMapper;
  private Clock clock = Clock.systemUTC();

  private AuthContextBuilder(AuthOptions options) {
    this.options = options;
  }

  public static AuthContextBuilder create(AuthOptions options) {
    return new AuthContextBuilder(options);
  }

  public AuthContextBuilder adapter(DatabaseAdapter databaseAdapter) {
    this.adapter = databaseAdapter;
    return this;
  }

  public AuthContextBuilder provider(IdentityProvider provider) {
    if (providers.putIfAbsent(provider.id(), provider) != null) {
      throw new ContextBuildException(Kind.INVALID_CONFIGURATION,
          "Identity provider '%s' is registered twice".formatted(provider.id()));
    }
    return this;
  }

  public AuthContextBuilder plugin(AuthPlugin plugin) {
    plugins.add(plugin);
    return this;
  }

  public AuthContextBuilder objectMapper(ObjectMapper mapper) {
    this.objectMapper = mapper;
    return this;
  }

  public AuthContextBuilder clock(Clock value) {
    this.clock = value;
    return this;
  }

  public AuthContext build() {
    validateOptions();

    List<PluginContribution> contributions = new ArrayList<>();
    contributions.add(CoreEndpoints.contribution(options));
    Set<String> pluginIds = new HashSet<>(Set.of(CORE_ID));
    for (AuthPlugin plugin : plugins) {
      if (!pluginIds.add(plugin.id())) {
        throw new ContextBuildException(Kind.DUPLICATE_PLUGIN,
            "Plugin '%s' is registered twice".formatted(plugin.id()));
      }
      PluginContribution contribution = plugin.contribution(options);
      if (contribution == null || !plugin.id().equals(contribution.getId())) {
        throw new ContextBuildException(Kind.INVALID_CONFIGURATION,
            "Plugin '%s' returned a contribution with a different id".formatted(plugin.id()));
      }
      contributions.add(contribution);
    }

    EndpointRegistry endpoints = new EndpointRegistry();
    List<Hook> beforeHooks = new ArrayList<>();
    List<Hook> afterHooks = new ArrayList<>();
    Map<String, ErrorCode> errorCodes = new LinkedHashMap<>();
    Map<String, String> errorCodeOwners = new LinkedHashMap<>();
    SchemaRegistry.Builder schema = SchemaRegistry.builder();
    BaseSchema.fields().forEach(field -> schema.add(CORE_ID, field));

    for (PluginContribution contribution : contributions) {
      String owner = contribution.getId();
      for (Endpoint endpoint : contribution.getEndpoints()) {
        endpoints.register(owner, endpoint);
      }
      beforeHooks.addAll(contribution.getBeforeHooks());
      afterHooks.addAll(contribution.getAfterHooks());
      for (FieldAttribute field : contribution.getSchemaFields()) {
        schema.add(owner, field);
      }
      for (ErrorCode errorCode : contribution.getErrorCodes()) {
        String existing = errorCodeOwners.putIfAbsent(errorCode.code(), owner);
        if (existing != null) {
          throw new ContextBuildException(Kind.DUPLICATE_ERROR_CODE,
              "Error code '%s' from '%s' is already registered by '%s'"
                  .formatted(errorCode.code(), owner, existing));
        }
        errorCodes.put(errorCode.code(), errorCode);
      }
    }
    // List.sort is stable: equal priorities keep registration order
    beforeHooks.sort(Hook.BY_PRIORITY);
    afterHooks.sort(Hook.BY_PRIORITY);

    ObjectMapper mapper = configure(objectMapper == null ? new ObjectMapper() : objectMapper.copy());
    DatabaseAdapter db = adapter == null ? new MemoryDatabaseAdapter() : adapter;
    SchemaRegistry schemaRegistry = schema.build();
    AuthDataStore dataStore = new AuthDataStore(db, schemaRegistry, clock);

    HmacSigner signer = new HmacSigner(KeyDerivation.deriveKey(options.getSecret(), "cookie-signature"));
    CookiePolicy cookiePolicy = new CookiePolicy(options, signer);
    TrustedOriginGuard originGuard = new TrustedOriginGuard(
        options.getBaseOrigin(), options.getTrustedOrigins(), options.getTrustedOriginsProvider());

    SessionManager sessionManager = options.getSessionMode() == AuthOptions.SessionMode.STATELESS
        ? new StatelessSessionManager(dataStore, options, mapper, clock)
        : new DatabaseSessionManager(dataStore, options, clock);
    SessionResolver sessionResolver = new SessionResolver(sessionManager, cookiePolicy, options, clock);

    HmacSigner stateSigner = new HmacSigner(KeyDerivation.deriveKey(options.getSecret(), "oauth-state-signature"));
    OAuthStateStore stateStore = options.getStateStrategy() == AuthOptions.StateStrategy.ENCRYPTED
        ? new EncryptedStateStore(dataStore,
            new EncryptionService(KeyDerivation.deriveKey(options.getSecret(), "oauth-state-encryption")),
            stateSigner, mapper, clock)
        : new DatabaseStateStore(dataStore, stateSigner, mapper, clock);
    AccountLinker accountLinker = new AccountLinker(dataStore, options, clock);
    OAuth2Service oauth2Service = new OAuth2Service(options, providers, stateStore, accountLinker,
        dataStore, sessionManager, sessionResolver, cookiePolicy, originGuard, clock);

    List<String> ids = contributions.stream().map(PluginContribution::getId).toList();
    AuthContext context = AuthContext.builder()
        .options(options)
        .adapter(db)
        .dataStore(dataStore)
        .schemaRegistry(schemaRegistry)
        .endpoints(endpoints)
        .beforeHooks(List.copyOf(beforeHooks))
        .afterHooks(List.copyOf(afterHooks))
        .errorCodes(Map.copyOf(errorCodes))
        .cookiePolicy(cookiePolicy)
        .originGuard(originGuard)
        .sessionManager(sessionManager)
        .sessionResolver(sessionResolver)
        .oauth2Service(oauth2Service)
        .providers(Map.copyOf(providers))
        .pluginIds(ids)
        .objectMapper(mapper)
        .clock(clock)
        .build();

    log.info("Auth context built: {} route(s), {} before-hook(s), {} after-hook(s), plugins={}, "
            + "providers={}, session mode={}, adapter={}",
        endpoints.size(), beforeHooks.size(), afterHooks.size(), ids, providers.keySet(),
        options.getSessionMode(), db.id());
    log.debug("Routes: {}", endpoints.describe());
    return context;
  }

  private void validateOptions() {
    List<String> errors = new ArrayList<>();
    if (options.getSecret() == null || options.getSecret().length() < MIN_SECRET_LENGTH) {
      errors.add("secret must be at least " + MIN_SECRET_LENGTH + " characters");
    }
    if (options.getBaseUrl() == null) {
      errors.add("baseUrl is required");
    } else {
      try {
        URI uri = URI.create(options.getBaseUrl());
        if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
          errors.add("baseUrl must be an absolute http(s) URL: " + options.getBaseUrl());
        }
      } catch (IllegalArgumentException e) {
        errors.add("baseUrl is invalid: " + options.getBaseUrl());
      }
    }
    String basePath = options.getBasePath();
    if (basePath == null || !basePath.startsWith("/") || (basePath.length() > 1 && basePath.endsWith("/"))) {
      errors.add("basePath must start with '/' and must not end with '/': " + basePath);
    }
    if (options.getExpiresIn() == null || options.getExpiresIn().isNegative() || options.getExpiresIn().isZero()) {
      errors.add("session expiresIn must be positive");
    }
    if (!errors.isEmpty()) {
      throw new ContextBuildException(Kind.INVALID_CONFIGURATION,
          "Invalid auth options: " + String.join("; ", errors));
    }
  }

  private static ObjectMapper configure(ObjectMapper mapper) {
    return mapper
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }
}
