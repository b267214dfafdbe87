package com.example.authengine.oauth2;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.adapter.idp.OAuthTokens;
import com.example.authengine.adapter.idp.ProviderUserInfo;
import com.example.authengine.context.AuthContextBuilder;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.domain.entity.Account;
import com.example.authengine.domain.entity.User;
import com.example.authengine.exception.OAuth2Exception;
import com.example.authengine.support.MutableClock;
import com.example.authengine.support.TestAuth;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AccountLinkerTest {

  private static final OAuthTokens TOKENS =
      new OAuthTokens("access-1", "refresh-1", null, null, null, List.of("read:user"), "bearer");

  private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
  private AuthDataStore dataStore;

  private AccountLinker linker(AuthOptions.AuthOptionsBuilder options) {
    AuthOptions built = options.build();
    dataStore = AuthContextBuilder.create(built).clock(clock).build().getDataStore();
    return new AccountLinker(dataStore, built, clock);
  }

  private OAuthStatePayload signIn(boolean requestSignUp) {
    return new OAuthStatePayload("csrf", "verifier", "github", "/", "/error", null,
        clock.instant().plus(Duration.ofMinutes(10)), null, requestSignUp);
  }

  private OAuthStatePayload link(User user) {
    return new OAuthStatePayload("csrf", "verifier", "github", "/", "/error", null,
        clock.instant().plus(Duration.ofMinutes(10)), new OAuthStatePayload.LinkHint(user.email(), user.id()), false);
  }

  private static ProviderUserInfo info(String id, String email, boolean verified) {
    return new ProviderUserInfo(id, email, verified, "Octo", null);
  }

  @Test
  void unknownIdentitySignsUpANewUser() {
    AccountLinker linker = linker(TestAuth.options());

    AccountLinker.Outcome outcome = linker.resolve("github", info("gh-1", "Octo@Example.com", true), TOKENS, signIn(false));

    assertThat(outcome.newUser()).isTrue();
    assertThat(outcome.linked()).isFalse();
    assertThat(outcome.user().email()).isEqualTo("octo@example.com");
    assertThat(outcome.user().emailVerified()).isTrue();
    assertThat(dataStore.findAccount("github", "gh-1")).hasValueSatisfying(account -> {
      assertThat(account.userId()).isEqualTo(outcome.user().id());
      assertThat(account.scope()).isEqualTo("read:user");
    });
  }

  @Test
  void knownAccountSignsInAndRefreshesStoredTokens() {
    AccountLinker linker = linker(TestAuth.options());
    User user = linker.resolve("github", info("gh-1", "octo@example.com", true), TOKENS, signIn(false)).user();

    OAuthTokens newer = new OAuthTokens("access-2", null, null, null, null, List.of(), "bearer");
    AccountLinker.Outcome outcome = linker.resolve("github", info("gh-1", "octo@example.com", true), newer, signIn(false));

    assertThat(outcome.newUser()).isFalse();
    assertThat(outcome.user().id()).isEqualTo(user.id());
    Account account = dataStore.findAccount("github", "gh-1").orElseThrow();
    assertThat(account.accessToken()).isEqualTo("access-2");
    assertThat(account.refreshToken()).isEqualTo("refresh-1");
  }

  @Test
  void verifiedEmailLinksToExistingUser() {
    AccountLinker linker = linker(TestAuth.options());
    User existing = dataStore.createUser("Octo", "octo@example.com", false, null, Map.of());

    AccountLinker.Outcome outcome = linker.resolve("github", info("gh-1", "octo@example.com", true), TOKENS, signIn(false));

    assertThat(outcome.user().id()).isEqualTo(existing.id());
    assertThat(outcome.user().emailVerified()).isTrue();
    assertThat(dataStore.listAccountsForUser(existing.id())).hasSize(1);
  }

  @Test
  void unverifiedEmailFromUntrustedProviderIsNotLinked() {
    AccountLinker linker = linker(TestAuth.options());
    dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());

    assertError(() -> linker.resolve("github", info("gh-1", "octo@example.com", false), TOKENS, signIn(false)),
        OAuthErrors.ACCOUNT_NOT_LINKED);
  }

  @Test
  void trustedProviderLinksEvenWithoutVerifiedEmail() {
    AccountLinker linker = linker(TestAuth.options().trustedProvider("github"));
    User existing = dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());

    assertThat(linker.resolve("github", info("gh-1", "octo@example.com", false), TOKENS, signIn(false)).user().id())
        .isEqualTo(existing.id());
  }

  @Test
  void disabledLinkingRefusesEmailMatch() {
    AccountLinker linker = linker(TestAuth.options().accountLinkingEnabled(false));
    dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());

    assertError(() -> linker.resolve("github", info("gh-1", "octo@example.com", true), TOKENS, signIn(false)),
        OAuthErrors.ACCOUNT_NOT_LINKED);
  }

  @Test
  void missingEmailIsRejected() {
    AccountLinker linker = linker(TestAuth.options());

    assertError(() -> linker.resolve("github", info("gh-1", null, false), TOKENS, signIn(false)),
        OAuthErrors.EMAIL_NOT_FOUND);
  }

  @Test
  void implicitSignUpCanBeDisabled() {
    AccountLinker linker = linker(TestAuth.options().disableImplicitSignUp(true));

    assertError(() -> linker.resolve("github", info("gh-1", "octo@example.com", true), TOKENS, signIn(false)),
        OAuthErrors.SIGNUP_DISABLED);
    assertThat(linker.resolve("github", info("gh-1", "octo@example.com", true), TOKENS, signIn(true)).newUser())
        .isTrue();
  }

  @Test
  void linkFlowAttachesAccountToCurrentUser() {
    AccountLinker linker = linker(TestAuth.options());
    User current = dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());

    AccountLinker.Outcome outcome = linker.resolve("github", info("gh-9", "OCTO@example.com", true), TOKENS, link(current));

    assertThat(outcome.linked()).isTrue();
    assertThat(outcome.user().id()).isEqualTo(current.id());
    assertThat(dataStore.findAccount("github", "gh-9")).isPresent();
  }

  @Test
  void linkFlowRejectsAccountOwnedBySomeoneElse() {
    AccountLinker linker = linker(TestAuth.options());
    linker.resolve("github", info("gh-9", "other@example.com", true), TOKENS, signIn(false));
    User current = dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());

    assertError(() -> linker.resolve("github", info("gh-9", "octo@example.com", true), TOKENS, link(current)),
        OAuthErrors.ACCOUNT_LINKED_TO_DIFFERENT_USER);
  }

  @Test
  void linkFlowRequiresMatchingEmailUnlessAllowed() {
    AccountLinker strict = linker(TestAuth.options());
    User current = dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());
    assertError(() -> strict.resolve("github", info("gh-9", "work@example.com", true), TOKENS, link(current)),
        OAuthErrors.EMAIL_DOES_NOT_MATCH);

    AccountLinker lenient = linker(TestAuth.options().allowDifferentLinkEmails(true));
    User other = dataStore.createUser("Octo", "octo@example.com", true, null, Map.of());
    assertThat(lenient.resolve("github", info("gh-9", "work@example.com", true), TOKENS, link(other)).linked())
        .isTrue();
  }

  private static void assertError(Runnable call, String errorCode) {
    assertThatThrownBy(call::run)
        .isInstanceOfSatisfying(OAuth2Exception.class, e -> assertThat(e.getErrorCode()).isEqualTo(errorCode));
  }
}
