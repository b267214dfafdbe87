package com.example.authengine.routes;

import com.example.authengine.context.AuthContext;
import com.example.authengine.domain.entity.Account;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.pipeline.Endpoint;
import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.pipeline.EndpointResult;
import com.example.authengine.pipeline.ParamSpec;
import com.example.authengine.pipeline.RequestShape;
import com.example.authengine.schema.FieldType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class AccountRoutes {

  private static final RequestShape ACCOUNT_SELECTOR = RequestShape.body(
      ParamSpec.required("providerId", FieldType.STRING),
      ParamSpec.optional("accountId", FieldType.STRING));

  static List<Endpoint> endpoints() {
    return List.of(
        Endpoint.get("/list-accounts", RequestShape.NONE, AccountRoutes::listAccounts),
        Endpoint.post("/unlink-account", ACCOUNT_SELECTOR, AccountRoutes::unlinkAccount),
        Endpoint.post("/refresh-token", ACCOUNT_SELECTOR, AccountRoutes::refreshToken));
  }

  static EndpointResult listAccounts(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireSession(context);
    return EndpointResult.json(auth.getDataStore().listAccountsForUser(current.user().id()).stream()
        .map(account -> ResponseViews.account(auth.getSchemaRegistry(), account))
        .toList());
  }

  static EndpointResult unlinkAccount(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireFreshSession(context);
    String providerId = context.bodyString("providerId").orElseThrow();
    String accountId = context.bodyString("accountId").orElse(null);

    List<Account> accounts = auth.getDataStore().listAccountsForUser(current.user().id());
    if (accounts.size() <= 1) {
      throw new AuthApiException(BaseErrorCodes.FAILED_TO_UNLINK_LAST_ACCOUNT);
    }
    Account account = accounts.stream()
        .filter(a -> a.providerId().equals(providerId))
        .filter(a -> accountId == null || a.accountId().equals(accountId))
        .findFirst()
        .orElseThrow(() -> new AuthApiException(BaseErrorCodes.ACCOUNT_NOT_FOUND));

    auth.getDataStore().deleteAccount(account.id());
    log.info("Unlinked {} account from user {}", providerId, current.user().id());
    return EndpointResult.json(Map.of("status", true));
  }

  static EndpointResult refreshToken(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireSession(context);
    Account refreshed = auth.getOauth2Service().refreshTokens(current.user().id(),
        context.bodyString("providerId").orElseThrow(),
        context.bodyString("accountId").orElse(null));
    // tokens are hidden from account views, but this endpoint exists to hand them to the caller
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("accessToken", refreshed.accessToken());
    body.put("refreshToken", refreshed.refreshToken());
    body.put("idToken", refreshed.idToken());
    body.put("accessTokenExpiresAt", refreshed.accessTokenExpiresAt());
    body.put("refreshTokenExpiresAt", refreshed.refreshTokenExpiresAt());
    body.put("scopes", ResponseViews.scopes(refreshed.scope()));
    return EndpointResult.json(body);
  }
}
