package io.b2mash.pms.auth;

import io.b2mash.pms.security.RequestScopes;
import io.b2mash.pms.user.UserResponse;
import io.b2mash.pms.user.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration, login and self-service credential endpoints. Register and login are public; the
 * rest require a bearer token.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private static final Logger log = LoggerFactory.getLogger(AuthController.class);

  private final UserService userService;

  public AuthController(UserService userService) {
    this.userService = userService;
  }

  @PostMapping("/register")
  public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
    var user =
        userService.register(
            request.email(), request.username(), request.name(), request.password());
    return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
        .body(
            new RegisterResponse(
                "Registration successful! Please wait for admin approval before you can login.",
                UserResponse.from(user)));
  }

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    var result = userService.login(request.emailOrUsername(), request.password());
    return ResponseEntity.ok(
        new LoginResponse("Login successful", result.token(), UserResponse.from(result.user())));
  }

  @GetMapping("/verify")
  public ResponseEntity<Map<String, Object>> verify() {
    var user = userService.getCurrentUser(RequestScopes.requireCaller());
    return ResponseEntity.ok(Map.of("valid", true, "user", UserResponse.from(user)));
  }

  /** Tokens are stateless; logout only records the event and lets the client discard the token. */
  @PostMapping("/logout")
  public ResponseEntity<Map<String, String>> logout() {
    log.info("User {} logged out", RequestScopes.requireUserId());
    return ResponseEntity.ok(Map.of("message", "Logout successful"));
  }

  @PutMapping("/change-password")
  public ResponseEntity<Map<String, String>> changePassword(
      @Valid @RequestBody ChangePasswordRequest request) {
    userService.changeOwnPassword(
        RequestScopes.requireCaller(), request.currentPassword(), request.newPassword());
    return ResponseEntity.ok(Map.of("message", "Password changed successfully"));
  }

  // --- DTOs ---

  public record RegisterRequest(
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      @NotBlank(message = "username is required")
          @Size(min = 3, max = 50, message = "username must be between 3 and 50 characters")
          String username,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotNull(message = "password is required") String password) {}

  public record LoginRequest(
      @NotBlank(message = "emailOrUsername is required") String emailOrUsername,
      @NotBlank(message = "password is required") String password) {}

  public record ChangePasswordRequest(
      @NotBlank(message = "currentPassword is required") String currentPassword,
      @NotNull(message = "newPassword is required") String newPassword) {}

  public record RegisterResponse(String message, UserResponse user) {}

  public record LoginResponse(String message, String token, UserResponse user) {}
}
