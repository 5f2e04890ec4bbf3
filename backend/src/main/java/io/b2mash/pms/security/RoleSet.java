package io.b2mash.pms.security;

import io.b2mash.pms.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of roles held by one user. A valid set is never empty and always contains {@link
 * Role#STAFF}.
 */
public final class RoleSet {

  private static final RoleSet STAFF_ONLY = new RoleSet(EnumSet.of(Role.STAFF));

  private final Set<Role> roles;

  private RoleSet(EnumSet<Role> roles) {
    this.roles = Collections.unmodifiableSet(roles);
  }

  public static RoleSet staffOnly() {
    return STAFF_ONLY;
  }

  public static RoleSet of(Role first, Role... rest) {
    var set = EnumSet.of(first, rest);
    set.add(Role.STAFF);
    return new RoleSet(set);
  }

  /**
   * Parses wire values into a role set.
   *
   * @throws ValidationException listing every unknown value, or when staff is missing
   */
  public static RoleSet parse(Collection<String> values) {
    if (values == null || values.isEmpty()) {
      throw new ValidationException("roles", "required", "Roles must be a non-empty array");
    }
    var set = EnumSet.noneOf(Role.class);
    List<String> invalid = new ArrayList<>();
    for (String value : values) {
      Role.fromValue(value).ifPresentOrElse(set::add, () -> invalid.add(value));
    }
    if (!invalid.isEmpty()) {
      throw new ValidationException(
          "roles", "invalid_role", "Invalid roles: " + String.join(", ", invalid));
    }
    if (!set.contains(Role.STAFF)) {
      throw new ValidationException("roles", "staff_required", "All users must have staff role");
    }
    return new RoleSet(set);
  }

  /** Rebuilds a set read from storage. Storage rows are already validated, unknowns are skipped. */
  public static RoleSet fromStored(String[] values) {
    var set = EnumSet.of(Role.STAFF);
    if (values != null) {
      for (String value : values) {
        Role.fromValue(value).ifPresent(set::add);
      }
    }
    return new RoleSet(set);
  }

  public boolean has(Role role) {
    return roles.contains(role);
  }

  public boolean isAdmin() {
    return roles.contains(Role.ADMIN);
  }

  /** Privileged roles bypass ownership checks on projects. */
  public boolean isPrivileged() {
    return roles.contains(Role.MADMIN) || roles.contains(Role.ADMIN);
  }

  public boolean canAccessProjects() {
    return roles.contains(Role.USER) || isPrivileged();
  }

  public boolean canAccessBilling() {
    return isPrivileged();
  }

  public Role highest() {
    Role highest = Role.STAFF;
    for (Role role : roles) {
      if (role.compareTo(highest) > 0) {
        highest = role;
      }
    }
    return highest;
  }

  public Set<Role> asSet() {
    return roles;
  }

  public List<String> values() {
    return roles.stream().map(Role::value).toList();
  }

  public String[] toArray() {
    return values().toArray(new String[0]);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RoleSet other && roles.equals(other.roles);
  }

  @Override
  public int hashCode() {
    return roles.hashCode();
  }

  @Override
  public String toString() {
    return values().toString();
  }
}
