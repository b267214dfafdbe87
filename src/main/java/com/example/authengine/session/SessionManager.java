package com.example.authengine.session;

import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import java.util.List;
import java.util.Optional;

/**
 * Session lifecycle shared by the database-backed and stateless modes.
 */
public interface SessionManager {

  Session createSession(String userId, String ipAddress, String userAgent);

  /**
   * Returns the session and its user when the token is valid and unexpired.
   */
  Optional<SessionWithUser> validateSession(String token);

  /**
   * Extends the expiry of a valid session. The returned session carries the token to send to the
   * client, which differs from the input in stateless mode.
   */
  Optional<Session> refreshSession(String token);

  void revokeSession(String token);

  void revokeAllSessions(String userId);

  List<Session> listSessions(String userId);

  /**
   * Whether revocation takes effect immediately. False for stateless sessions.
   */
  boolean supportsRevocation();
}
