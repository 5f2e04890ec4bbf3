package io.b2mash.pms.security;

import java.util.UUID;

/** The authenticated actor of the current request, with roles as currently stored. */
public record Caller(UUID userId, RoleSet roles) {

  public boolean isSelf(UUID targetUserId) {
    return userId.equals(targetUserId);
  }
}
