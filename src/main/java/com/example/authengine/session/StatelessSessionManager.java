package com.example.authengine.session;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.crypto.KeyDerivation;
import com.example.authengine.crypto.RandomTokens;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.domain.entity.User;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.exception.SessionException;
import com.example.authengine.util.CookieUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.DirectDecrypter;
import com.nimbusds.jose.crypto.DirectEncrypter;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Sessions carried entirely in the token: an HS256 JWT holding a snapshot of the session and
 * its user, optionally wrapped in a {@code dir}/{@code A256GCM} JWE so the snapshot is not
 * readable by the client. Validation never touches the database.
 *
 * <p>Revocation does not take effect before the embedded expiry; a revoked token stays valid
 * until then. Use a short {@code expiresIn} when that matters.
 */
@Slf4j
public class StatelessSessionManager implements SessionManager {

  private static final String CLAIM_SESSION = "session";
  private static final String CLAIM_USER = "user";
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final AuthDataStore dataStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Duration expiresIn;
  private final boolean encrypt;
  private final MACSigner signer;
  private final MACVerifier verifier;
  private final DirectEncrypter encrypter;
  private final DirectDecrypter decrypter;

  public StatelessSessionManager(AuthDataStore dataStore, AuthOptions options,
                                 ObjectMapper objectMapper, Clock clock) {
    this.dataStore = dataStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.expiresIn = options.getExpiresIn();
    this.encrypt = options.isEncryptStatelessTokens();
    try {
      byte[] signingKey = KeyDerivation.deriveKey(options.getSecret(), "session-jwt-signing");
      byte[] encryptionKey = KeyDerivation.deriveKey(options.getSecret(), "session-jwt-encryption");
      this.signer = new MACSigner(signingKey);
      this.verifier = new MACVerifier(signingKey);
      this.encrypter = new DirectEncrypter(encryptionKey);
      this.decrypter = new DirectDecrypter(encryptionKey);
    } catch (JOSEException e) {
      throw new SessionException("Failed to initialise stateless session keys", e);
    }
  }

  @Override
  public Session createSession(String userId, String ipAddress, String userAgent) {
    User user = dataStore.findUserById(userId)
        .orElseThrow(() -> new AuthApiException(BaseErrorCodes.USER_NOT_FOUND));
    Instant now = clock.instant();
    Session session = new Session(RandomTokens.generateId(), null, userId, now, now,
        now.plus(expiresIn), ipAddress, userAgent);
    Session issued = session.withToken(issue(session, user));
    log.info("Issued stateless session {} for user {}", session.id(), userId);
    return issued;
  }

  @Override
  public Optional<SessionWithUser> validateSession(String token) {
    if (token == null || token.isEmpty()) {
      return Optional.empty();
    }
    try {
      SignedJWT jwt = encrypt ? decryptToken(token) : SignedJWT.parse(token);
      if (!jwt.verify(verifier)) {
        log.warn("Stateless session token {} failed signature verification", CookieUtil.mask(token));
        return Optional.empty();
      }
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      Map<String, Object> sessionClaim = claims.getJSONObjectClaim(CLAIM_SESSION);
      Map<String, Object> userClaim = claims.getJSONObjectClaim(CLAIM_USER);
      if (sessionClaim == null || userClaim == null) {
        log.warn("Stateless session token {} is missing its snapshot", CookieUtil.mask(token));
        return Optional.empty();
      }
      Session session = objectMapper.convertValue(sessionClaim, Session.class).withToken(token);
      User user = objectMapper.convertValue(userClaim, User.class);
      if (session.isExpired(clock.instant())) {
        log.debug("Stateless session {} expired at {}", session.id(), session.expiresAt());
        return Optional.empty();
      }
      return Optional.of(new SessionWithUser(session, user));
    } catch (ParseException | JOSEException | IllegalArgumentException e) {
      log.debug("Rejected stateless session token: {}", e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public Optional<Session> refreshSession(String token) {
    return validateSession(token).map(current -> {
      Instant now = clock.instant();
      Session old = current.session();
      Session extended = new Session(old.id(), null, old.userId(), old.createdAt(), now,
          now.plus(expiresIn), old.ipAddress(), old.userAgent());
      return extended.withToken(issue(extended, current.user()));
    });
  }

  @Override
  public void revokeSession(String token) {
    log.warn("Stateless session {} cannot be revoked before it expires; only the cookie is cleared",
        CookieUtil.mask(token));
  }

  @Override
  public void revokeAllSessions(String userId) {
    log.warn("Stateless sessions of user {} cannot be revoked before they expire", userId);
  }

  @Override
  public List<Session> listSessions(String userId) {
    return List.of();
  }

  @Override
  public boolean supportsRevocation() {
    return false;
  }

  private String issue(Session session, User user) {
    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .jwtID(session.id())
        .subject(session.userId())
        .issueTime(Date.from(session.updatedAt()))
        .expirationTime(Date.from(session.expiresAt()))
        .claim(CLAIM_SESSION, objectMapper.convertValue(session.withToken(null), MAP_TYPE))
        .claim(CLAIM_USER, objectMapper.convertValue(user, MAP_TYPE))
        .build();
    try {
      SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      jwt.sign(signer);
      if (!encrypt) {
        return jwt.serialize();
      }
      JWEObject jwe = new JWEObject(
          new JWEHeader.Builder(JWEAlgorithm.DIR, EncryptionMethod.A256GCM).contentType("JWT").build(),
          new Payload(jwt));
      jwe.encrypt(encrypter);
      return jwe.serialize();
    } catch (JOSEException e) {
      throw new AuthApiException(BaseErrorCodes.FAILED_TO_CREATE_SESSION, e);
    }
  }

  private SignedJWT decryptToken(String token) throws ParseException, JOSEException {
    JWEObject jwe = JWEObject.parse(token);
    jwe.decrypt(decrypter);
    SignedJWT jwt = jwe.getPayload().toSignedJWT();
    if (jwt == null) {
      throw new ParseException("Encrypted payload is not a signed JWT", 0);
    }
    return jwt;
  }
}
