package com.example.authengine.web.rest.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;

@Tag(
    name = "Authentication",
    description = "Session, OAuth2 sign-in and account endpoints served by the auth engine"
)
@RequestMapping("${auth.base-path:/api/auth}")
public interface AuthRouterAPI {

  @Operation(
      summary = "Dispatch an auth engine request",
      description = "Routes every GET and POST under the base path to the engine's endpoint registry, "
          + "e.g. /get-session, /sign-in/oauth/{providerId}, /callback/{providerId}, /sign-out"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Endpoint result as JSON"),
      @ApiResponse(responseCode = "302", description = "Redirect, e.g. after an OAuth2 callback"),
      @ApiResponse(responseCode = "400", description = "Validation or OAuth2 error"),
      @ApiResponse(responseCode = "401", description = "No valid session"),
      @ApiResponse(responseCode = "403", description = "Untrusted origin or stale session"),
      @ApiResponse(responseCode = "404", description = "Unknown or disabled endpoint"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @RequestMapping(value = "/**", method = {RequestMethod.GET, RequestMethod.POST})
  ResponseEntity<String> dispatch(
      @Parameter(description = "JSON or form-urlencoded body", required = false)
      @RequestBody(required = false) byte[] body,
      HttpServletRequest request
  );
}
