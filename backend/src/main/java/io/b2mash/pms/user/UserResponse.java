package io.b2mash.pms.user;

import io.b2mash.pms.project.ProjectStats;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Public view of a user. The password hash never leaves the service layer. */
public record UserResponse(
    UUID id,
    String email,
    String username,
    String name,
    List<String> roles,
    boolean approved,
    Instant createdAt,
    Instant updatedAt,
    ProjectStats projectStats) {

  public static UserResponse from(User user) {
    return withStats(user, null);
  }

  public static UserResponse withStats(User user, ProjectStats projectStats) {
    return new UserResponse(
        user.getId(),
        user.getEmail(),
        user.getUsername(),
        user.getName(),
        user.getRoles().values(),
        user.isApproved(),
        user.getCreatedAt(),
        user.getUpdatedAt(),
        projectStats);
  }
}
