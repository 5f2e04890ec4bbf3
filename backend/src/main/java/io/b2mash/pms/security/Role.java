package io.b2mash.pms.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Closed set of roles, declared in ascending privilege order. */
public enum Role {
  STAFF("staff"),
  USER("user"),
  MADMIN("madmin"),
  ADMIN("admin");

  private final String value;

  Role(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Spring Security authority name, e.g. {@code ROLE_MADMIN}. */
  public String authority() {
    return "ROLE_" + name();
  }

  public static Optional<Role> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(r -> r.value.equals(value.trim())).findFirst();
  }

  @JsonCreator
  static Role fromJson(String value) {
    return fromValue(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
  }
}
