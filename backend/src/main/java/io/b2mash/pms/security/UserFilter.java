package io.b2mash.pms.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.pms.user.User;
import io.b2mash.pms.user.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the token subject to a stored user after signature verification. The user must still
 * exist and be approved; the stored roles replace whatever the token claimed, so role changes and
 * suspensions take effect without waiting for token expiry.
 */
@Component
public class UserFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(UserFilter.class);

  private final UserRepository userRepository;
  private final ObjectMapper objectMapper;

  public UserFilter(UserRepository userRepository, ObjectMapper objectMapper) {
    this.userRepository = userRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      // Public endpoint, nothing to resolve
      filterChain.doFilter(request, response);
      return;
    }

    Optional<User> user = resolveUser(jwtAuth.getToken().getSubject());
    if (user.isEmpty()) {
      log.warn("Token subject {} does not match a user", jwtAuth.getToken().getSubject());
      SecurityContextHolder.clearContext();
      writeProblem(response, HttpStatus.UNAUTHORIZED, "Invalid token. User not found.");
      return;
    }
    if (!user.get().isApproved()) {
      log.warn("Rejected request from unapproved user {}", user.get().getId());
      writeProblem(
          response,
          HttpStatus.FORBIDDEN,
          "Account has been suspended. Contact administrator.");
      return;
    }

    RoleSet roles = user.get().getRoles();
    var refreshed =
        new JwtAuthenticationToken(
            jwtAuth.getToken(),
            RoleJwtAuthenticationConverter.authoritiesOf(roles),
            jwtAuth.getName());
    SecurityContextHolder.getContext().setAuthentication(refreshed);

    try (var ignored = RequestScopes.bind(new Caller(user.get().getId(), roles))) {
      filterChain.doFilter(request, response);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private Optional<User> resolveUser(String subject) {
    if (subject == null) {
      return Optional.empty();
    }
    UUID userId;
    try {
      userId = UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      log.debug("Token subject is not a user id: {}", subject);
      return Optional.empty();
    }
    return userRepository.findById(userId);
  }

  private void writeProblem(HttpServletResponse response, HttpStatus status, String detail)
      throws IOException {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(status.getReasonPhrase());
    problem.setDetail(detail);
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), problem);
  }
}
