package com.example.authengine.routes;

import com.example.authengine.context.AuthOptions;
import com.example.authengine.context.PluginContribution;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.origin.OriginCheckHook;
import com.example.authengine.pipeline.Endpoint;
import com.example.authengine.pipeline.EndpointResult;
import com.example.authengine.pipeline.RequestShape;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * The built-in contribution, folded into every context before any plugin.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CoreEndpoints {

  public static final String ID = "core";

  public static PluginContribution contribution(AuthOptions options) {
    return PluginContribution.builder()
        .id(ID)
        .endpoints(SessionRoutes.endpoints())
        .endpoints(OAuthRoutes.endpoints())
        .endpoints(AccountRoutes.endpoints())
        .endpoint(Endpoint.get("/ok", RequestShape.NONE, context -> EndpointResult.json(Map.of("ok", true))))
        .endpoint(Endpoint.get("/error", RequestShape.NONE, context -> EndpointResult.json(
            Map.of("error", context.queryString("error").orElse("unknown")))))
        .beforeHook(new OriginCheckHook(options.isDisableOriginCheck()).hook())
        .errorCodes(BaseErrorCodes.all())
        .build();
  }
}
