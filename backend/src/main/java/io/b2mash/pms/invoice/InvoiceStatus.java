package io.b2mash.pms.invoice;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.pms.exception.ValidationException;
import java.util.Arrays;

public enum InvoiceStatus {
  PENDING("pending"),
  PAID("paid"),
  OVERDUE("overdue"),
  CANCELLED("cancelled");

  private final String value;

  InvoiceStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static InvoiceStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(s -> s.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new ValidationException(
                    "status",
                    "invalid_status",
                    "Status must be pending, paid, overdue, or cancelled"));
  }
}
