package com.example.authengine.routes;

import com.example.authengine.context.AuthContext;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.pipeline.Endpoint;
import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.pipeline.EndpointResult;
import com.example.authengine.pipeline.ParamSpec;
import com.example.authengine.pipeline.RequestShape;
import com.example.authengine.schema.FieldType;
import com.example.authengine.session.CookiePolicy;
import com.example.authengine.session.SessionManager;
import com.example.authengine.session.SessionResolver;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Session endpoints: read, sign out, list and revoke.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class SessionRoutes {

  private static final Map<String, Object> STATUS_OK = Map.of("status", true);

  static List<Endpoint> endpoints() {
    return List.of(
        Endpoint.get("/get-session",
            RequestShape.query(ParamSpec.optional("disableRefresh", FieldType.BOOLEAN)),
            SessionRoutes::getSession),
        Endpoint.post("/sign-out", RequestShape.NONE, SessionRoutes::signOut),
        Endpoint.get("/list-sessions", RequestShape.NONE, SessionRoutes::listSessions),
        Endpoint.post("/revoke-session",
            RequestShape.body(ParamSpec.required("token", FieldType.STRING)),
            SessionRoutes::revokeSession),
        Endpoint.post("/revoke-sessions", RequestShape.NONE, SessionRoutes::revokeSessions),
        Endpoint.post("/revoke-other-sessions", RequestShape.NONE, SessionRoutes::revokeOtherSessions));
  }

  static EndpointResult getSession(EndpointContext context) {
    if (Boolean.TRUE.equals(context.getQuery().get("disableRefresh"))) {
      context.setDisableRefresh(true);
    }
    AuthContext auth = context.getAuthContext();
    Optional<SessionWithUser> session = auth.getSessionResolver().resolve(context);
    return EndpointResult.json(session
        .map(value -> ResponseViews.sessionWithUser(auth.getSchemaRegistry(), value))
        .orElse(null));
  }

  static EndpointResult signOut(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    Optional<String> token = auth.getCookiePolicy().readSigned(context.getRequest(), CookiePolicy.SESSION_TOKEN);
    token.ifPresent(auth.getSessionManager()::revokeSession);
    auth.getSessionResolver().clear(context);
    return EndpointResult.json(Map.of("success", true));
  }

  static EndpointResult listSessions(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireSession(context);
    List<Map<String, Object>> sessions = auth.getSessionManager().listSessions(current.user().id()).stream()
        .map(session -> ResponseViews.session(auth.getSchemaRegistry(), session))
        .toList();
    return EndpointResult.json(sessions);
  }

  static EndpointResult revokeSession(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireSession(context);
    String token = context.bodyString("token").orElseThrow();
    SessionManager sessionManager = auth.getSessionManager();

    boolean owned = token.equals(current.session().token())
        || sessionManager.listSessions(current.user().id()).stream().anyMatch(s -> s.token().equals(token));
    if (!owned) {
      throw new AuthApiException(BaseErrorCodes.INVALID_TOKEN);
    }
    sessionManager.revokeSession(token);
    if (token.equals(current.session().token())) {
      auth.getSessionResolver().clear(context);
    }
    return EndpointResult.json(STATUS_OK);
  }

  static EndpointResult revokeSessions(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionResolver resolver = auth.getSessionResolver();
    SessionWithUser current = resolver.requireFreshSession(context);
    auth.getSessionManager().revokeAllSessions(current.user().id());
    resolver.clear(context);
    return EndpointResult.json(STATUS_OK);
  }

  static EndpointResult revokeOtherSessions(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireSession(context);
    SessionManager sessionManager = auth.getSessionManager();
    List<Session> others = sessionManager.listSessions(current.user().id()).stream()
        .filter(s -> !s.token().equals(current.session().token()))
        .toList();
    others.forEach(s -> sessionManager.revokeSession(s.token()));
    log.info("Revoked {} other session(s) of user {}", others.size(), current.user().id());
    return EndpointResult.json(STATUS_OK);
  }
}
