package io.b2mash.pms.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;

class TokenAuthenticationEntryPointTest {

  private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
  private final TokenAuthenticationEntryPoint entryPoint =
      new TokenAuthenticationEntryPoint(objectMapper);

  private MockHttpServletResponse commence(String authorization, AuthenticationException ex)
      throws Exception {
    var request = new MockHttpServletRequest("GET", "/api/projects");
    if (authorization != null) {
      request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
    }
    var response = new MockHttpServletResponse();
    entryPoint.commence(request, response, ex);
    return response;
  }

  @Test
  void missingTokenIsReportedAsNoToken() throws Exception {
    var response =
        commence(null, new InsufficientAuthenticationException("Full authentication required"));

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getHeader(HttpHeaders.WWW_AUTHENTICATE)).startsWith("Bearer");
    String detail = JsonPath.read(response.getContentAsString(), "$.detail");
    assertThat(detail).isEqualTo("Access denied. No token provided.");
  }

  @Test
  void expiredTokenIsReportedAsExpired() throws Exception {
    var response =
        commence(
            "Bearer abc.def.ghi",
            new InvalidBearerTokenException(
                "An error occurred while attempting to decode the Jwt: Jwt expired at"
                    + " 2024-01-01T00:00:00Z"));

    assertThat(response.getStatus()).isEqualTo(401);
    String detail = JsonPath.read(response.getContentAsString(), "$.detail");
    assertThat(detail).isEqualTo("Token expired.");
  }

  @Test
  void badSignatureIsReportedAsInvalid() throws Exception {
    var response =
        commence(
            "Bearer abc.def.ghi",
            new InvalidBearerTokenException("Failed to validate the token"));

    String detail = JsonPath.read(response.getContentAsString(), "$.detail");
    assertThat(detail).isEqualTo("Invalid token.");
    assertThat(response.getHeader(HttpHeaders.WWW_AUTHENTICATE)).contains("invalid_token");
  }
}
