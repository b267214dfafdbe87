package com.example.authengine.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.authengine.context.AuthContext;
import com.example.authengine.context.AuthContextBuilder;
import com.example.authengine.context.AuthOptions;
import com.example.authengine.context.AuthPlugin;
import com.example.authengine.context.Hook;
import com.example.authengine.context.HookMatcher;
import com.example.authengine.context.PluginContribution;
import com.example.authengine.exception.AuthApiException;
import com.example.authengine.exception.BaseErrorCodes;
import com.example.authengine.schema.FieldType;
import com.example.authengine.support.TestAuth;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;

class RequestPipelineTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<String> afterHookCalls = new ArrayList<>();
  private final List<String> reachedStages = new ArrayList<>();
  private RequestPipeline pipeline;

  @BeforeEach
  void setUp() {
    AuthContext context = AuthContextBuilder.create(TestAuth.options().disabledPath("/hidden").build())
        .plugin(new TestPlugin())
        .build();
    pipeline = new RequestPipeline(context);
  }

  @Test
  void routesRelativeToBasePathAndIgnoresTrailingSlash() throws Exception {
    AuthResponse response = pipeline.handle(get("/api/auth/ok/"));

    assertThat(response.status()).isEqualTo(HttpStatus.OK);
    assertThat(json(response).get("ok").asBoolean()).isTrue();
  }

  @Test
  void unknownPathIsNotFound() throws Exception {
    AuthResponse response = pipeline.handle(get("/api/auth/does-not-exist"));

    assertThat(response.status()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(json(response).get("code").asText()).isEqualTo("NOT_FOUND");
  }

  @Test
  void pathOutsideBasePathIsNotFound() {
    assertThat(pipeline.handle(get("/other/ok")).status()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(pipeline.handle(get("/api/authx/ok")).status()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void disabledPathIsNotFound() {
    assertThat(pipeline.handle(get("/api/auth/hidden")).status()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void wrongMethodIsNotFound() {
    assertThat(pipeline.handle(get("/api/auth/echo")).status()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void validationProblemsAreReportedTogether() throws Exception {
    AuthResponse response = pipeline.handle(AuthRequest.builder(HttpMethod.POST, "/api/auth/echo")
        .jsonBody("{\"age\":\"old\"}")
        .build());

    assertThat(response.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    JsonNode body = json(response);
    assertThat(body.get("code").asText()).isEqualTo("VALIDATION_ERROR");
    assertThat(body.get("details")).hasSize(2);
    assertThat(body.get("details").findValuesAsText("field")).containsExactlyInAnyOrder("name", "age");
    assertThat(body.get("details").findValuesAsText("location")).containsOnly("body");
  }

  @Test
  void formBodiesAreCoercedLikeJson() throws Exception {
    AuthResponse response = pipeline.handle(AuthRequest.builder(HttpMethod.POST, "/api/auth/echo")
        .formBody("name=Ada+Lovelace&age=36")
        .build());

    assertThat(response.status()).isEqualTo(HttpStatus.OK);
    JsonNode body = json(response);
    assertThat(body.get("name").asText()).isEqualTo("Ada Lovelace");
    assertThat(body.get("age").asDouble()).isEqualTo(36.0);
  }

  @Test
  void malformedJsonIsAValidationError() throws Exception {
    AuthResponse response = pipeline.handle(AuthRequest.builder(HttpMethod.POST, "/api/auth/echo")
        .jsonBody("{not json")
        .build());

    assertThat(response.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(json(response).get("code").asText()).isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void beforeHookCanShortCircuitAndHandlerIsSkipped() throws Exception {
    AuthResponse response = pipeline.handle(get("/api/auth/guarded"));

    assertThat(response.status()).isEqualTo(HttpStatus.OK);
    assertThat(json(response).get("blocked").asBoolean()).isTrue();
    assertThat(afterHookCalls).isEmpty();
  }

  @Test
  void afterHooksSeeTheResultAndMayAddCookies() {
    AuthResponse response = pipeline.handle(get("/api/auth/ok"));

    assertThat(afterHookCalls).containsExactly("/ok");
    assertThat(response.setCookies()).anyMatch(cookie -> cookie.startsWith("seen=1"));
  }

  @Test
  void afterHooksDoNotRunWhenTheHandlerThrows() {
    pipeline.handle(get("/api/auth/boom"));

    assertThat(afterHookCalls).isEmpty();
  }

  @Test
  void throwingBeforeHookStopsTheRestOfTheRequest() throws Exception {
    AuthResponse response = pipeline.handle(get("/api/auth/rejected"));

    assertThat(response.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(json(response).get("code").asText()).isEqualTo("INVALID_TOKEN");
    assertThat(reachedStages).isEmpty();
    assertThat(afterHookCalls).isEmpty();
    assertThat(response.setCookies()).isEmpty();
  }

  @Test
  void unexpectedErrorsBecomeGeneric500() throws Exception {
    AuthResponse response = pipeline.handle(get("/api/auth/boom"));

    assertThat(response.status()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.body()).doesNotContain("kaboom");
    assertThat(json(response).get("code").asText()).isEqualTo("INTERNAL_SERVER_ERROR");
  }

  @Test
  void headersCollectedBeforeAnErrorAreDropped() {
    AuthResponse response = pipeline.handle(get("/api/auth/cookie-then-fail"));

    assertThat(response.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.setCookies()).isEmpty();
  }

  @Test
  void redirectToUntrustedLocationIsRefused() throws Exception {
    AuthResponse response = pipeline.handle(get("/api/auth/go?to=https://evil.example.net/"));

    assertThat(response.status()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(json(response).get("code").asText()).isEqualTo("INVALID_REDIRECT_URL");
  }

  @Test
  void redirectToRelativePathIsAllowed() {
    AuthResponse response = pipeline.handle(get("/api/auth/go?to=/dashboard"));

    assertThat(response.status()).isEqualTo(HttpStatus.FOUND);
    assertThat(response.location()).isEqualTo("/dashboard");
    assertThat(response.body()).isNull();
  }

  private static AuthRequest get(String pathAndQuery) {
    int idx = pathAndQuery.indexOf('?');
    if (idx < 0) {
      return AuthRequest.builder(HttpMethod.GET, pathAndQuery).build();
    }
    String[] pair = pathAndQuery.substring(idx + 1).split("=", 2);
    return AuthRequest.builder(HttpMethod.GET, pathAndQuery.substring(0, idx)).query(pair[0], pair[1]).build();
  }

  private JsonNode json(AuthResponse response) throws Exception {
    return objectMapper.readTree(response.body());
  }

  private class TestPlugin implements AuthPlugin {

    @Override
    public String id() {
      return "test";
    }

    @Override
    public PluginContribution contribution(AuthOptions options) {
      return PluginContribution.builder()
          .id(id())
          .endpoint(Endpoint.post("/echo",
              RequestShape.body(ParamSpec.required("name", FieldType.STRING), ParamSpec.optional("age", FieldType.NUMBER)),
              ctx -> EndpointResult.json(ctx.getBody())))
          .endpoint(Endpoint.get("/hidden", RequestShape.NONE, ctx -> EndpointResult.json(Map.of())))
          .endpoint(Endpoint.get("/guarded", RequestShape.NONE, ctx -> EndpointResult.json(Map.of("blocked", false))))
          .endpoint(Endpoint.get("/boom", RequestShape.NONE, ctx -> {
            throw new IllegalStateException("kaboom");
          }))
          .endpoint(Endpoint.get("/cookie-then-fail", RequestShape.NONE, ctx -> {
            ctx.setCookie(ResponseCookie.from("leak", "1").build());
            throw new AuthApiException(BaseErrorCodes.INVALID_TOKEN);
          }))
          .endpoint(Endpoint.get("/go", RequestShape.NONE,
              ctx -> EndpointResult.redirect(ctx.queryString("to").orElseThrow())))
          .endpoint(Endpoint.get("/rejected", RequestShape.NONE, ctx -> {
            reachedStages.add("handler");
            return EndpointResult.json(Map.of());
          }))
          .beforeHook(new Hook("reject", HookMatcher.path("/rejected"), 1, ctx -> {
            throw new AuthApiException(BaseErrorCodes.INVALID_TOKEN);
          }))
          .beforeHook(new Hook("after-reject", HookMatcher.path("/rejected"), 2, ctx -> {
            reachedStages.add("second before-hook");
            return Optional.empty();
          }))
          .beforeHook(Hook.of("block", HookMatcher.path("/guarded"),
              ctx -> Optional.of(EndpointResult.json(Map.of("blocked", true)))))
          .afterHook(Hook.of("record", HookMatcher.any(), ctx -> {
            ctx.getResult().ifPresent(result -> afterHookCalls.add(ctx.getRequest().path()));
            ctx.setCookie(ResponseCookie.from("seen", "1").build());
            return Optional.empty();
          }))
          .build();
    }
  }
}
