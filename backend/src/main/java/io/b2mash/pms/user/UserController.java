package io.b2mash.pms.user;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.project.ProjectService;
import io.b2mash.pms.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
public class UserController {

  private final UserService userService;
  private final ProjectService projectService;

  public UserController(UserService userService, ProjectService projectService) {
    this.userService = userService;
    this.projectService = projectService;
  }

  @GetMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<PagedResponse<UserResponse>> listUsers(
      @RequestParam(required = false) Boolean approved,
      @RequestParam(required = false) String search,
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    var page =
        userService.listUsers(
            RequestScopes.requireCaller(), approved, search, new PageWindow(limit, offset));
    return ResponseEntity.ok(page.map(UserResponse::from));
  }

  /** Profile with project counts when the user can work with projects. */
  @GetMapping("/{id}")
  public ResponseEntity<UserResponse> getUser(@PathVariable UUID id) {
    var user = userService.getUser(RequestScopes.requireCaller(), id);
    var stats =
        user.getRoles().canAccessProjects()
            ? projectService.getStatsForCreator(user.getId())
            : null;
    return ResponseEntity.ok(UserResponse.withStats(user, stats));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
    var user =
        userService.createUser(
            RequestScopes.requireCaller(),
            new UserService.NewUser(
                request.email(),
                request.username(),
                request.name(),
                request.password(),
                request.roles(),
                request.approved()));
    return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
        .body(UserResponse.from(user));
  }

  @PutMapping("/{id}")
  public ResponseEntity<UserResponse> updateUser(
      @PathVariable UUID id, @Valid @RequestBody UpdateUserRequest request) {
    var user =
        userService.updateUser(
            RequestScopes.requireCaller(),
            id,
            new UserService.ProfileChanges(
                request.name(),
                request.email(),
                request.username(),
                request.roles(),
                request.approved()));
    return ResponseEntity.ok(UserResponse.from(user));
  }

  @PutMapping("/{id}/password")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Map<String, String>> resetPassword(
      @PathVariable UUID id, @Valid @RequestBody ResetPasswordRequest request) {
    userService.resetPassword(RequestScopes.requireCaller(), id, request.newPassword());
    return ResponseEntity.ok(Map.of("message", "Password updated successfully"));
  }

  @PutMapping("/{id}/approve")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<UserResponse> approveUser(@PathVariable UUID id) {
    return ResponseEntity.ok(
        UserResponse.from(userService.approveUser(RequestScopes.requireCaller(), id)));
  }

  @GetMapping("/stats/overview")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<UserStats> getStats() {
    return ResponseEntity.ok(userService.getStats(RequestScopes.requireCaller()));
  }

  // --- DTOs ---

  public record CreateUserRequest(
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      @NotBlank(message = "username is required")
          @Size(min = 3, max = 50, message = "username must be between 3 and 50 characters")
          String username,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotNull(message = "password is required") String password,
      List<String> roles,
      Boolean approved) {}

  public record UpdateUserRequest(
      @Size(min = 1, max = 255, message = "name must be between 1 and 255 characters")
          String name,
      @Email(message = "email must be valid") String email,
      @Size(min = 3, max = 50, message = "username must be between 3 and 50 characters")
          String username,
      List<String> roles,
      Boolean approved) {}

  public record ResetPasswordRequest(
      @NotNull(message = "newPassword is required") String newPassword) {}
}
