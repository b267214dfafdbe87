package com.example.authengine.plugins;

import com.example.authengine.context.AuthContext;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.context.AuthPlugin;
import com.example.authengine.context.Hook;
import com.example.authengine.context.HookMatcher;
import com.example.authengine.context.PluginContribution;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.pipeline.EndpointResult;
import com.example.authengine.schema.FieldAttribute;
import com.example.authengine.schema.FieldType;
import com.example.authengine.schema.SchemaRegistry;
import com.example.authengine.session.CookiePolicy;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

/**
 * Remembers which provider a browser last signed in with, so a login page can highlight it.
 *
 * <p>The value is written to a script-readable cookie after every successful OAuth callback and,
 * when {@code storeInDatabase} is set, to the {@code lastLoginMethod} user field.
 */
@Slf4j
public class LastLoginMethodPlugin implements AuthPlugin {

  public static final String ID = "last-login-method";
  public static final String COOKIE_NAME = "last_used_login_method";
  public static final String USER_FIELD = "lastLoginMethod";
  static final Duration DEFAULT_MAX_AGE = Duration.ofDays(30);

  private static final String CALLBACK_PREFIX = "/callback/";

  private final boolean storeInDatabase;
  private final Duration maxAge;

  public LastLoginMethodPlugin() {
    this(false, DEFAULT_MAX_AGE);
  }

  public LastLoginMethodPlugin(boolean storeInDatabase, Duration maxAge) {
    this.storeInDatabase = storeInDatabase;
    this.maxAge = maxAge == null ? DEFAULT_MAX_AGE : maxAge;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public PluginContribution contribution(AuthOptions options) {
    PluginContribution.PluginContributionBuilder builder = PluginContribution.builder()
        .id(ID)
        .afterHook(Hook.of(ID, HookMatcher.pathPrefix(CALLBACK_PREFIX).and(HookMatcher.method(HttpMethod.GET)),
            this::recordLoginMethod));
    if (storeInDatabase) {
      builder.schemaField(FieldAttribute.internal(SchemaRegistry.USER, USER_FIELD, FieldType.STRING));
    }
    return builder.build();
  }

  private Optional<EndpointResult> recordLoginMethod(EndpointContext context) {
    // only a callback that established a session is a successful sign-in
    Optional<SessionWithUser> session = context.isSessionResolved() ? context.getSession() : Optional.empty();
    Optional<String> providerId = context.param("providerId");
    if (session.isEmpty() || providerId.isEmpty()) {
      return Optional.empty();
    }

    AuthContext auth = context.getAuthContext();
    CookiePolicy cookiePolicy = auth.getCookiePolicy();
    context.setCookie(cookiePolicy.cookie(cookiePolicy.name(COOKIE_NAME), providerId.get(), maxAge, false));

    if (storeInDatabase) {
      String userId = session.get().user().id();
      auth.getDataStore().updateUser(userId, Map.of(USER_FIELD, providerId.get()));
      log.debug("Stored last login method {} for user {}", providerId.get(), userId);
    }
    return Optional.empty();
  }
}
