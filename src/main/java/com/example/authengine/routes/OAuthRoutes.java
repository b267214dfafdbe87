package com.example.authengine.routes;

import com.example.authengine.context.AuthContext;
import com.example.authengine.domain.entity.SessionWithUser;
import com.example.authengine.oauth2.OAuth2Service;
import com.example.authengine.oauth2.OAuth2Service.FlowRequest;
import com.example.authengine.oauth2.OAuth2Service.FlowStart;
import com.example.authengine.oauth2.OAuthStatePayload.LinkHint;
import com.example.authengine.pipeline.Endpoint;
import com.example.authengine.pipeline.EndpointContext;
import com.example.authengine.pipeline.EndpointResult;
import com.example.authengine.pipeline.ParamSpec;
import com.example.authengine.pipeline.RequestShape;
import com.example.authengine.schema.FieldType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * OAuth2 sign-in, provider callback and account linking.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class OAuthRoutes {

  private static final List<ParamSpec> FLOW_PARAMS = List.of(
      ParamSpec.optional("callbackURL", FieldType.STRING),
      ParamSpec.optional("errorCallbackURL", FieldType.STRING),
      ParamSpec.optional("newUserCallbackURL", FieldType.STRING),
      ParamSpec.optional("scopes", FieldType.STRING_ARRAY),
      ParamSpec.optional("requestSignUp", FieldType.BOOLEAN),
      ParamSpec.optional("disableRedirect", FieldType.BOOLEAN));

  static List<Endpoint> endpoints() {
    return List.of(
        Endpoint.post("/sign-in/oauth/:providerId", new RequestShape(FLOW_PARAMS, List.of()),
            context -> signIn(context, context.param("providerId").orElse(null))),
        Endpoint.post("/sign-in/social", new RequestShape(withProvider(FLOW_PARAMS), List.of()),
            context -> signIn(context, context.bodyString("provider").orElse(null))),
        Endpoint.get("/callback/:providerId", RequestShape.NONE, OAuthRoutes::callback),
        Endpoint.post("/callback/:providerId", RequestShape.NONE, OAuthRoutes::formPostCallback),
        Endpoint.post("/link-social", new RequestShape(withProvider(List.of(
            ParamSpec.optional("callbackURL", FieldType.STRING),
            ParamSpec.optional("errorCallbackURL", FieldType.STRING),
            ParamSpec.optional("scopes", FieldType.STRING_ARRAY))), List.of()),
            OAuthRoutes::linkSocial));
  }

  static EndpointResult signIn(EndpointContext context, String providerId) {
    OAuth2Service service = context.getAuthContext().getOauth2Service();
    FlowStart start = service.start(context, new FlowRequest(
        providerId,
        context.bodyString("callbackURL").orElse(null),
        context.bodyString("errorCallbackURL").orElse(null),
        context.bodyString("newUserCallbackURL").orElse(null),
        scopes(context),
        context.bodyFlag("requestSignUp"),
        null));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("url", start.url().toString());
    body.put("state", start.state());
    body.put("redirect", !context.bodyFlag("disableRedirect"));
    return EndpointResult.json(body);
  }

  static EndpointResult callback(EndpointContext context) {
    String providerId = context.param("providerId").orElse(null);
    return EndpointResult.redirect(context.getAuthContext().getOauth2Service().callback(context, providerId));
  }

  /**
   * Providers using {@code response_mode=form_post} arrive cross-site, where Lax cookies are not
   * sent. Bounce to the GET callback so the state cookie comes along.
   */
  static EndpointResult formPostCallback(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    String providerId = context.param("providerId").orElse("");
    UriComponentsBuilder target = UriComponentsBuilder
        .fromHttpUrl(auth.getOptions().getAuthUrl() + "/callback/" + providerId);

    Map<String, Object> merged = new LinkedHashMap<>(context.getQuery());
    context.getBody().forEach(merged::putIfAbsent);
    merged.forEach((name, value) -> {
      if (value != null) {
        target.queryParam(name, value.toString());
      }
    });
    return EndpointResult.redirect(target.encode().build().toUriString());
  }

  static EndpointResult linkSocial(EndpointContext context) {
    AuthContext auth = context.getAuthContext();
    SessionWithUser current = auth.getSessionResolver().requireSession(context);
    FlowStart start = auth.getOauth2Service().start(context, new FlowRequest(
        context.bodyString("provider").orElse(null),
        context.bodyString("callbackURL").orElse(null),
        context.bodyString("errorCallbackURL").orElse(null),
        null,
        scopes(context),
        false,
        new LinkHint(current.user().email(), current.user().id())));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("url", start.url().toString());
    body.put("redirect", true);
    return EndpointResult.json(body);
  }

  @SuppressWarnings("unchecked")
  private static List<String> scopes(EndpointContext context) {
    return context.bodyValue("scopes").map(value -> (List<String>) value).orElse(List.of());
  }

  private static List<ParamSpec> withProvider(List<ParamSpec> params) {
    List<ParamSpec> all = new ArrayList<>(params.size() + 1);
    all.add(ParamSpec.required("provider", FieldType.STRING));
    all.addAll(params);
    return all;
  }
}
