package io.b2mash.pms.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 responses for requests that never reach {@link UserFilter}: no bearer token, or a token that
 * fails signature, issuer or expiry checks. The {@code WWW-Authenticate} header comes from {@link
 * BearerTokenAuthenticationEntryPoint}; the body is a problem detail like every other error.
 */
@Component
public class TokenAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(TokenAuthenticationEntryPoint.class);

  static final String NO_TOKEN = "Access denied. No token provided.";
  static final String TOKEN_EXPIRED = "Token expired.";
  static final String INVALID_TOKEN = "Invalid token.";

  private final BearerTokenAuthenticationEntryPoint bearerEntryPoint =
      new BearerTokenAuthenticationEntryPoint();
  private final ObjectMapper objectMapper;

  public TokenAuthenticationEntryPoint(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    String detail = detailFor(request, authException);
    if (NO_TOKEN.equals(detail)) {
      log.debug("No bearer token on {} {}", request.getMethod(), request.getRequestURI());
    } else {
      log.warn(
          "Rejected bearer token on {} {} from {}: {}",
          request.getMethod(),
          request.getRequestURI(),
          request.getRemoteAddr(),
          authException.getMessage());
    }

    bearerEntryPoint.commence(request, response, authException);

    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Unauthorized");
    problem.setDetail(detail);
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), problem);
  }

  private static String detailFor(HttpServletRequest request, AuthenticationException ex) {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
      return NO_TOKEN;
    }
    String message = ex.getMessage();
    if (message != null && message.contains("expired")) {
      return TOKEN_EXPIRED;
    }
    return INVALID_TOKEN;
  }
}
