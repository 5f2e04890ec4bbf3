package io.b2mash.pms.security;

import static io.b2mash.pms.security.DenialReason.INSUFFICIENT_ROLE;
import static io.b2mash.pms.security.DenialReason.NOT_OWNER;

import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Role and ownership decisions for every protected resource. Decisions are pure functions of the
 * caller and the target's ownership data; callers load the target first and apply the decision
 * with {@link AccessDecision#orThrow()}.
 */
@Component
public class AccessPolicy {

  /** Profile fields a user may change on their own record. */
  public static final Set<String> SELF_EDITABLE_FIELDS = Set.of("name", "email", "username");

  /** Profile fields an admin may change on any record. */
  public static final Set<String> ADMIN_EDITABLE_FIELDS =
      Set.of("name", "email", "username", "roles", "approved");

  public AccessDecision projectAccess(Caller caller) {
    return AccessDecision.allowIf(
        caller.roles().canAccessProjects(),
        INSUFFICIENT_ROLE,
        "Access denied. Project access requires user, madmin, or admin role.");
  }

  /**
   * Read, edit and complete on a single project. Privileged callers bypass ownership, everyone
   * else must be the creator.
   */
  public AccessDecision projectInstance(Caller caller, UUID createdBy) {
    var roleCheck = projectAccess(caller);
    if (!roleCheck.allowed()) {
      return roleCheck;
    }
    if (caller.roles().isPrivileged() || caller.isSelf(createdBy)) {
      return AccessDecision.ALLOW;
    }
    return AccessDecision.deny(NOT_OWNER, "You can only access projects you created");
  }

  public AccessDecision projectDelete(Caller caller) {
    return adminOnly(caller, "Only administrators can delete projects");
  }

  public AccessDecision billing(Caller caller) {
    return AccessDecision.allowIf(
        caller.roles().canAccessBilling(),
        INSUFFICIENT_ROLE,
        "Access denied. Billing access requires madmin or admin role.");
  }

  public AccessDecision invoiceDelete(Caller caller) {
    return adminOnly(caller, "Only administrators can delete invoices");
  }

  /** Listing, creating, approving users, resetting passwords and user statistics. */
  public AccessDecision userAdministration(Caller caller) {
    return adminOnly(caller, "Access denied. Admin role required.");
  }

  public AccessDecision profileRead(Caller caller, UUID targetUserId) {
    return AccessDecision.allowIf(
        caller.isSelf(targetUserId) || caller.roles().isAdmin(),
        NOT_OWNER,
        "You can only view your own profile");
  }

  /**
   * Profile update: non-admins may only touch their own record and only the self-editable fields.
   * Unknown field names are not checked here; callers drop fields outside the admin allowlist.
   */
  public AccessDecision profileUpdate(Caller caller, UUID targetUserId, Set<String> fields) {
    if (caller.roles().isAdmin()) {
      return AccessDecision.ALLOW;
    }
    if (!caller.isSelf(targetUserId)) {
      return AccessDecision.deny(NOT_OWNER, "You can only update your own profile");
    }
    for (String field : fields) {
      if (ADMIN_EDITABLE_FIELDS.contains(field) && !SELF_EDITABLE_FIELDS.contains(field)) {
        return AccessDecision.deny(
            INSUFFICIENT_ROLE, "Only administrators can change the " + field + " field");
      }
    }
    return AccessDecision.ALLOW;
  }

  private AccessDecision adminOnly(Caller caller, String detail) {
    return AccessDecision.allowIf(caller.roles().isAdmin(), INSUFFICIENT_ROLE, detail);
  }
}
