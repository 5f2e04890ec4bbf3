package io.b2mash.pms.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.pms.exception.ValidationException;
import java.util.Arrays;

public enum ProjectStatus {
  PENDING("pending"),
  ONGOING("ongoing"),
  COMPLETED("completed");

  private final String value;

  ProjectStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ProjectStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(s -> s.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new ValidationException(
                    "status", "invalid_status", "Status must be pending, ongoing, or completed"));
  }
}
