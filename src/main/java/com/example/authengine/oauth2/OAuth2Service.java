package com.example.authengine.oauth2;

import com.example.authengine.adapter.db.AuthDataStore;
import com.example.authengine.adapter.idp.IdentityProvider;
import com.example.authengine.adapter.idp.OAuthTokens;
import com.example.authengine.adapter.idp.ProviderUserInfo;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.crypto.RandomTokens;
import com.example.authengine.domain.entity.Account;
import com.example.authengine.domain.entity.Session;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.exception.OAuth2Exception;
import com.example.authengine.exception.ProviderException;
import com.example.authengine.origin.TrustedOriginGuard;
import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.session.CookiePolicy;
import com.example.authengine.session.SessionManager;
import com.example.authengine.session.SessionResolver;
import com.nimbusds.oauth2.sdk.pkce.CodeChallenge;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * OAuth2 authorization-code flow with PKCE: starts the flow, then verifies the callback,
 * exchanges the code, resolves the local user and establishes the session.
 *
 * <p>Callback failures never surface as errors; they become a redirect to a vetted error URL
 * carrying a machine-readable {@code error} parameter.
 */
@Slf4j
public class OAuth2Service {

  private static final int CSRF_STATE_LENGTH = 32;
  private static final int CODE_VERIFIER_LENGTH = 128;

  private final AuthOptions options;
  private final Map<String, IdentityProvider> providers;
  private final OAuthStateStore stateStore;
  private final AccountLinker accountLinker;
  private final AuthDataStore dataStore;
  private final SessionManager sessionManager;
  private final SessionResolver sessionResolver;
  private final CookiePolicy cookiePolicy;
  private final TrustedOriginGuard originGuard;
  private final Clock clock;

  public OAuth2Service(AuthOptions options, Map<String, IdentityProvider> providers,
                       OAuthStateStore stateStore, AccountLinker accountLinker, AuthDataStore dataStore,
                       SessionManager sessionManager, SessionResolver sessionResolver,
                       CookiePolicy cookiePolicy, TrustedOriginGuard originGuard, Clock clock) {
    this.options = options;
    this.providers = Map.copyOf(providers);
    this.stateStore = stateStore;
    this.accountLinker = accountLinker;
    this.dataStore = dataStore;
    this.sessionManager = sessionManager;
    this.sessionResolver = sessionResolver;
    this.cookiePolicy = cookiePolicy;
    this.originGuard = originGuard;
    this.clock = clock;
  }

  /**
   * Caller-supplied parameters of a sign-in or link request.
   */
  public record FlowRequest(
      String providerId,
      String callbackURL,
      String errorCallbackURL,
      String newUserCallbackURL,
      List<String> scopes,
      boolean requestSignUp,
      OAuthStatePayload.LinkHint link
  ) {}

  public record FlowStart(URI url, String state) {}

  public IdentityProvider provider(String providerId) {
    IdentityProvider provider = providerId == null ? null : providers.get(providerId);
    if (provider == null) {
      throw new AuthApiException(BaseErrorCodes.PROVIDER_NOT_FOUND);
    }
    return provider;
  }

  /**
   * Creates the flow state, binds it to the browser through the state cookie and returns the
   * provider authorization URL.
   */
  public FlowStart start(EndpointContext context, FlowRequest request) {
    IdentityProvider provider = provider(request.providerId());

    String csrfState = RandomTokens.generate(CSRF_STATE_LENGTH, RandomTokens.URL_SAFE_ALPHABET);
    CodeVerifier codeVerifier = new CodeVerifier(
        RandomTokens.generate(CODE_VERIFIER_LENGTH, RandomTokens.URL_SAFE_ALPHABET));
    String challenge = provider.requiresPkce()
        ? CodeChallenge.compute(CodeChallengeMethod.S256, codeVerifier).getValue()
        : null;

    OAuthStatePayload payload = new OAuthStatePayload(
        csrfState,
        codeVerifier.getValue(),
        provider.id(),
        Optional.ofNullable(request.callbackURL()).orElse(options.getBaseUrl()),
        Optional.ofNullable(request.errorCallbackURL()).orElse(defaultErrorUrl()),
        request.newUserCallbackURL(),
        clock.instant().plus(options.getStateTtl()),
        request.link(),
        request.requestSignUp());

    String state = stateStore.store(payload);
    context.setCookie(cookiePolicy.signedCookie(CookiePolicy.STATE, csrfState, options.getStateTtl()));

    URI url = provider.createAuthorizationUrl(state, challenge, request.scopes(), redirectUri(provider.id()));
    log.info("Started {} flow{}", provider.id(), request.link() != null ? " (link)" : "");
    return new FlowStart(url, state);
  }

  /**
   * Handles the provider callback and returns the location to redirect the browser to.
   */
  public String callback(EndpointContext context, String providerId) {
    context.setCookie(cookiePolicy.expire(CookiePolicy.STATE));

    Optional<String> state = context.input("state");
    if (state.isEmpty()) {
      return errorRedirect(defaultErrorUrl(), OAuthErrors.STATE_NOT_FOUND);
    }

    OAuthStatePayload payload;
    try {
      payload = stateStore.consume(state.get());
    } catch (OAuth2Exception e) {
      log.warn("OAuth state rejected for {}: {}", providerId, e.getMessage());
      return errorRedirect(defaultErrorUrl(), e.getErrorCode());
    }
    String errorUrl = vetted(payload.errorURL(), context.getRequest()).orElse(defaultErrorUrl());

    try {
      verifyStateBinding(context.getRequest(), payload, providerId);

      Optional<String> providerError = context.input("error");
      if (providerError.isPresent()) {
        log.warn("Provider {} returned error {}", providerId, providerError.get());
        return errorRedirect(errorUrl, providerError.get());
      }
      String code = context.input("code")
          .orElseThrow(() -> new OAuth2Exception(OAuthErrors.NO_CODE, "No authorization code"));

      IdentityProvider provider = provider(providerId);
      OAuthTokens tokens = exchange(provider, code, payload.codeVerifier());
      ProviderUserInfo info = userInfo(provider, tokens);

      AccountLinker.Outcome outcome = accountLinker.resolve(provider.id(), info, tokens, payload);
      if (!outcome.linked()) {
        AuthRequest request = context.getRequest();
        Session session = sessionManager.createSession(outcome.user().id(), request.remoteAddress(),
            request.userAgent().orElse(null));
        sessionResolver.establish(context, new SessionWithUser(session, outcome.user()));
        log.info("User {} signed in via {}", outcome.user().id(), provider.id());
      }

      String target = outcome.newUser() && payload.newUserCallbackURL() != null
          ? payload.newUserCallbackURL()
          : payload.callbackURL();
      return vetted(target, context.getRequest()).orElseGet(() -> {
        log.warn("Discarding untrusted callback target {}", target);
        return options.getBaseUrl();
      });
    } catch (OAuth2Exception e) {
      log.warn("OAuth callback for {} failed: {} ({})", providerId, e.getErrorCode(), e.getMessage());
      return errorRedirect(errorUrl, e.getErrorCode());
    } catch (RuntimeException e) {
      log.error("OAuth callback for {} failed unexpectedly", providerId, e);
      return errorRedirect(errorUrl, OAuthErrors.INTERNAL_SERVER_ERROR);
    }
  }

  /**
   * Refreshes the stored provider tokens of one of the user's accounts.
   */
  public Account refreshTokens(String userId, String providerId, String accountId) {
    IdentityProvider provider = provider(providerId);
    Account account = dataStore.listAccountsForUser(userId).stream()
        .filter(a -> a.providerId().equals(providerId))
        .filter(a -> accountId == null || a.accountId().equals(accountId))
        .findFirst()
        .orElseThrow(() -> new AuthApiException(BaseErrorCodes.ACCOUNT_NOT_FOUND));
    if (account.refreshToken() == null) {
      throw new AuthApiException(BaseErrorCodes.FAILED_TO_REFRESH_TOKEN);
    }
    try {
      OAuthTokens tokens = provider.refreshAccessToken(account.refreshToken());
      return accountLinker.updateTokens(account, tokens);
    } catch (ProviderException e) {
      log.warn("Token refresh with {} failed: {}", providerId, e.getMessage());
      throw new AuthApiException(BaseErrorCodes.FAILED_TO_REFRESH_TOKEN, e);
    }
  }

  public String defaultErrorUrl() {
    return options.getAuthUrl() + "/error";
  }

  private void verifyStateBinding(AuthRequest request, OAuthStatePayload payload, String providerId) {
    if (!payload.providerId().equals(providerId)) {
      throw new OAuth2Exception(OAuthErrors.STATE_MISMATCH, "State was issued for another provider");
    }
    if (options.isSkipStateCookieCheck()) {
      return;
    }
    Optional<String> cookieState = cookiePolicy.readSigned(request, CookiePolicy.STATE);
    if (cookieState.isEmpty() || !cookieState.get().equals(payload.csrfState())) {
      throw new OAuth2Exception(OAuthErrors.STATE_MISMATCH, "State cookie does not match");
    }
  }

  private OAuthTokens exchange(IdentityProvider provider, String code, String codeVerifier) {
    try {
      OAuthTokens tokens = provider.exchangeCode(code, provider.requiresPkce() ? codeVerifier : null,
          redirectUri(provider.id()));
      if (tokens == null || tokens.accessToken() == null) {
        throw new OAuth2Exception(OAuthErrors.INVALID_CODE, "Token response without access token");
      }
      return tokens;
    } catch (ProviderException e) {
      throw new OAuth2Exception(OAuthErrors.INVALID_CODE, "Code exchange failed: " + e.getMessage(), e);
    }
  }

  private ProviderUserInfo userInfo(IdentityProvider provider, OAuthTokens tokens) {
    try {
      return provider.getUserInfo(tokens)
          .filter(info -> info.id() != null)
          .orElseThrow(() -> new OAuth2Exception(OAuthErrors.UNABLE_TO_GET_USER_INFO, "No user info"));
    } catch (ProviderException e) {
      throw new OAuth2Exception(OAuthErrors.UNABLE_TO_GET_USER_INFO, "User info failed: " + e.getMessage(), e);
    }
  }

  private Optional<String> vetted(String url, AuthRequest request) {
    return Optional.ofNullable(url).filter(u -> originGuard.isTrusted(u, true, request));
  }

  private String redirectUri(String providerId) {
    return options.getAuthUrl() + "/callback/" + providerId;
  }

  static String errorRedirect(String errorUrl, String error) {
    String separator = errorUrl.contains("?") ? "&" : "?";
    return errorUrl + separator + "error=" + URLEncoder.encode(error, StandardCharsets.UTF_8);
  }
}
