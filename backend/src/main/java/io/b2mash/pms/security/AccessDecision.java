package io.b2mash.pms.security;

import io.b2mash.pms.exception.ForbiddenException;

/** Outcome of an access check. {@code reason} and {@code detail} are null when allowed. */
public record AccessDecision(boolean allowed, DenialReason reason, String detail) {

  public static final AccessDecision ALLOW = new AccessDecision(true, null, null);

  public static AccessDecision deny(DenialReason reason, String detail) {
    return new AccessDecision(false, reason, detail);
  }

  public static AccessDecision allowIf(boolean condition, DenialReason reason, String detail) {
    return condition ? ALLOW : deny(reason, detail);
  }

  /** Throws {@link ForbiddenException} carrying the denial reason when not allowed. */
  public void orThrow() {
    if (!allowed) {
      throw new ForbiddenException("Access denied", detail, reason.code());
    }
  }
}
