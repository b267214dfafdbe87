package com.example.authengine.oauth2;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.adapter.idp.OAuthTokens;
import com.example.authengine.adapter.idp.ProviderUserInfo;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.crypto.RandomTokens;
import com.example.authengine.domain.entity.Account;
import com.example.authengine.domain.entity.User;
import com.example.authengine.exception.OAuth2Exception;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a provider identity to a local user. Branches are tried in a fixed order and every
 * combination ends in exactly one outcome; unsafe combinations fail with an OAuth2 error code.
 */
@Slf4j
@RequiredArgsConstructor
public class AccountLinker {

  /**
   * @param newUser a user was created by this callback
   * @param linked  the account was attached to the user named by the link hint
   */
  public record Outcome(User user, Account account, boolean newUser, boolean linked) {}

  private final AuthDataStore dataStore;
  private final AuthOptions options;
  private final Clock clock;

  public Outcome resolve(String providerId, ProviderUserInfo info, OAuthTokens tokens,
                         OAuthStatePayload payload) {
    if (payload.link() != null) {
      return linkToCurrentUser(providerId, info, tokens, payload.link());
    }

    Optional<Account> existing = dataStore.findAccount(providerId, info.id());
    if (existing.isPresent()) {
      return signInExisting(existing.get(), tokens);
    }

    if (info.email() == null || info.email().isBlank()) {
      throw new OAuth2Exception(OAuthErrors.EMAIL_NOT_FOUND, "Provider did not report an email");
    }

    Optional<User> byEmail = dataStore.findUserByEmail(info.email());
    if (byEmail.isPresent()) {
      return linkByEmail(providerId, info, tokens, byEmail.get());
    }

    if (options.isDisableImplicitSignUp() && !payload.requestSignUp()) {
      throw new OAuth2Exception(OAuthErrors.SIGNUP_DISABLED, "Sign-up is disabled");
    }
    User user = dataStore.createUser(info.name(), info.email(), info.emailVerified(), info.image(), Map.of());
    Account account = dataStore.createAccount(newAccount(user.id(), providerId, info.id(), tokens));
    log.info("Signed up user {} via {}", user.id(), providerId);
    return new Outcome(user, account, true, false);
  }

  private Outcome linkToCurrentUser(String providerId, ProviderUserInfo info, OAuthTokens tokens,
                                    OAuthStatePayload.LinkHint link) {
    User user = dataStore.findUserById(link.userId())
        .orElseThrow(() -> new OAuth2Exception(OAuthErrors.UNABLE_TO_LINK_ACCOUNT, "Linking user no longer exists"));

    Optional<Account> existing = dataStore.findAccount(providerId, info.id());
    if (existing.isPresent()) {
      if (!existing.get().userId().equals(user.id())) {
        throw new OAuth2Exception(OAuthErrors.ACCOUNT_LINKED_TO_DIFFERENT_USER,
            "Account is already linked to a different user");
      }
      Account updated = updateTokens(existing.get(), tokens);
      return new Outcome(user, updated, false, true);
    }

    if (!options.isAllowDifferentLinkEmails()
        && (info.email() == null || !info.email().equalsIgnoreCase(link.email()))) {
      throw new OAuth2Exception(OAuthErrors.EMAIL_DOES_NOT_MATCH, "Provider email does not match");
    }

    Account account;
    try {
      account = dataStore.createAccount(newAccount(user.id(), providerId, info.id(), tokens));
    } catch (RuntimeException e) {
      throw new OAuth2Exception(OAuthErrors.UNABLE_TO_LINK_ACCOUNT, "Failed to link account", e);
    }
    if (options.isUpdateUserInfoOnLink()) {
      user = updateProfile(user, info);
    }
    log.info("Linked {} account to user {}", providerId, user.id());
    return new Outcome(user, account, false, true);
  }

  private Outcome signInExisting(Account account, OAuthTokens tokens) {
    User user = dataStore.findUserById(account.userId())
        .orElseThrow(() -> new OAuth2Exception(OAuthErrors.INTERNAL_SERVER_ERROR,
            "Account references a missing user"));
    Account current = options.isUpdateAccountOnSignIn() ? updateTokens(account, tokens) : account;
    return new Outcome(user, current, false, false);
  }

  private Outcome linkByEmail(String providerId, ProviderUserInfo info, OAuthTokens tokens, User user) {
    boolean trusted = options.getTrustedProviders().contains(providerId);
    if (!options.isAccountLinkingEnabled() || !(info.emailVerified() || trusted)) {
      log.warn("Refusing to link {} account to existing user {} (verified={}, trusted={})",
          providerId, user.id(), info.emailVerified(), trusted);
      throw new OAuth2Exception(OAuthErrors.ACCOUNT_NOT_LINKED, "Account not linked");
    }
    Account account;
    try {
      account = dataStore.createAccount(newAccount(user.id(), providerId, info.id(), tokens));
    } catch (RuntimeException e) {
      throw new OAuth2Exception(OAuthErrors.UNABLE_TO_LINK_ACCOUNT, "Failed to link account", e);
    }
    if (info.emailVerified() && !user.emailVerified()) {
      user = dataStore.updateUser(user.id(), Map.of("emailVerified", true)).orElse(user);
    }
    log.info("Linked {} account to user {} by email", providerId, user.id());
    return new Outcome(user, account, false, false);
  }

  private Account newAccount(String userId, String providerId, String accountId, OAuthTokens tokens) {
    Instant now = clock.instant();
    return new Account(
        RandomTokens.generateId(),
        userId,
        providerId,
        accountId,
        tokens.accessToken(),
        tokens.refreshToken(),
        tokens.idToken(),
        tokens.accessTokenExpiresAt(),
        tokens.refreshTokenExpiresAt(),
        tokens.scopes().isEmpty() ? null : String.join(",", tokens.scopes()),
        now,
        now);
  }

  /**
   * Stores fresh provider tokens on an account, keeping stored values the provider did not resend.
   */
  public Account updateTokens(Account account, OAuthTokens tokens) {
    Map<String, Object> changes = new HashMap<>();
    putIfPresent(changes, "accessToken", tokens.accessToken());
    putIfPresent(changes, "refreshToken", tokens.refreshToken());
    putIfPresent(changes, "idToken", tokens.idToken());
    putIfPresent(changes, "accessTokenExpiresAt", tokens.accessTokenExpiresAt());
    putIfPresent(changes, "refreshTokenExpiresAt", tokens.refreshTokenExpiresAt());
    if (!tokens.scopes().isEmpty()) {
      changes.put("scope", String.join(",", tokens.scopes()));
    }
    return dataStore.updateAccount(account.id(), changes).orElse(account);
  }

  private User updateProfile(User user, ProviderUserInfo info) {
    Map<String, Object> changes = new HashMap<>();
    putIfPresent(changes, "name", info.name());
    putIfPresent(changes, "image", info.image());
    return changes.isEmpty() ? user : dataStore.updateUser(user.id(), changes).orElse(user);
  }

  private static void putIfPresent(Map<String, Object> target, String key, Object value) {
    if (value != null) {
      target.put(key, value);
    }
  }
}
