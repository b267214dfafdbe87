package com.example.authengine.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.authengine.context.AuthContext;
import com.example.authengine.context.AuthContextBuilder;
import com.example.authengine.pipeline.AuthRequest;
import com.example.authengine.pipeline.RequestPipeline;
import com.example.authengine.support.FakeIdentityProvider;
import com.example.authengine.support.TestAuth;
import com.example.authengine.web.rest.errors.GlobalErrorHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AuthRouterControllerTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    AuthContext context = AuthContextBuilder.create(TestAuth.options().build())
        .provider(FakeIdentityProvider.github())
        .build();
    mockMvc = MockMvcBuilders.standaloneSetup(new AuthRouterController(new RequestPipeline(context)))
        .setControllerAdvice(new GlobalErrorHandler())
        .addPlaceholderValue("auth.base-path", "/api/auth")
        .build();
  }

  @Test
  void okEndpointAnswersJson() throws Exception {
    mockMvc.perform(get("/api/auth/ok"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.ok").value(true));
  }

  @Test
  void unknownEndpointIsNotFound() throws Exception {
    mockMvc.perform(get("/api/auth/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void queryStringIsDecoded() throws Exception {
    mockMvc.perform(get(URI.create("/api/auth/error?error=access%20denied")))
        .andExpect(jsonPath("$.error").value("access denied"));
    mockMvc.perform(get(URI.create("/api/auth/error?error=access+denied")))
        .andExpect(jsonPath("$.error").value("access denied"));
  }

  @Test
  void unsupportedMethodIsMappedToErrorShape() throws Exception {
    mockMvc.perform(put("/api/auth/sign-out"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.code").value("METHOD_NOT_ALLOWED"));
  }

  @Test
  void signInRoundTripThroughServletLayer() throws Exception {
    MvcResult start = mockMvc.perform(post("/api/auth/sign-in/oauth/github")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"callbackURL\":\"/dashboard\"}"))
        .andExpect(status().isOk())
        .andReturn();
    String state = objectMapper.readTree(start.getResponse().getContentAsString()).get("state").asText();
    String setCookie = start.getResponse().getHeaders(HttpHeaders.SET_COOKIE).stream()
        .filter(c -> c.startsWith("auth.state="))
        .findFirst()
        .orElseThrow();
    String stateCookie = setCookie.substring("auth.state=".length(), setCookie.indexOf(';'));

    MvcResult callback = mockMvc.perform(get(URI.create("/api/auth/callback/github?code=" + FakeIdentityProvider.VALID_CODE
            + "&state=" + URLEncoder.encode(state, StandardCharsets.UTF_8)))
            .cookie(new Cookie("auth.state", stateCookie)))
        .andExpect(status().isFound())
        .andExpect(header().string(HttpHeaders.LOCATION, "/dashboard"))
        .andReturn();

    assertThat(callback.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
        .anyMatch(c -> c.startsWith("auth.session_token=") && c.contains("HttpOnly"));
  }

  @Test
  void formBodyIsPassedThrough() throws Exception {
    mockMvc.perform(post("/api/auth/callback/github")
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .content("code=abc&state=xyz"))
        .andExpect(status().isFound())
        .andExpect(header().string(HttpHeaders.LOCATION,
            TestAuth.BASE_URL + "/api/auth/callback/github?code=abc&state=xyz"));
  }

  @Test
  void toAuthRequestCopiesServletRequest() {
    MockHttpServletRequest servlet = new MockHttpServletRequest("POST", "/app/api/auth/sign-out");
    servlet.setContextPath("/app");
    servlet.setQueryString("a=1&b=two%20words&a=2");
    servlet.setRemoteAddr("203.0.113.9");
    servlet.addHeader("Origin", TestAuth.BASE_URL);
    servlet.setCookies(new Cookie("auth.session_token", "abc%2Edef"));
    servlet.setContentType(MediaType.APPLICATION_JSON_VALUE);

    AuthRequest request = AuthRouterController.toAuthRequest(servlet, "{}".getBytes(StandardCharsets.UTF_8));

    assertThat(request.method()).isEqualTo(HttpMethod.POST);
    assertThat(request.path()).isEqualTo("/api/auth/sign-out");
    assertThat(request.query()).containsEntry("a", "1").containsEntry("b", "two words");
    assertThat(request.header("origin")).contains(TestAuth.BASE_URL);
    assertThat(request.cookie("auth.session_token")).contains("abc%2Edef");
    assertThat(request.remoteAddress()).isEqualTo("203.0.113.9");
    assertThat(request.bodyAsString()).isEqualTo("{}");
  }

  @Test
  void forwardedForHeaderDoesNotOverrideTheRemoteAddress() {
    MockHttpServletRequest servlet = new MockHttpServletRequest("GET", "/api/auth/get-session");
    servlet.setRemoteAddr("203.0.113.9");
    servlet.addHeader("X-Forwarded-For", "198.51.100.4, 10.0.0.1");

    AuthRequest request = AuthRouterController.toAuthRequest(servlet, new byte[0]);

    assertThat(request.remoteAddress()).isEqualTo("203.0.113.9");
  }
}
