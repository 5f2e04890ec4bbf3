package io.b2mash.pms.common;

import io.b2mash.pms.exception.ValidationException;

/** Validated limit/offset pair taken from query parameters. */
public record PageWindow(int limit, int offset) {

  public static final int MAX_LIMIT = 500;

  public PageWindow {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new ValidationException(
          "limit", "range", "limit must be between 1 and " + MAX_LIMIT);
    }
    if (offset < 0) {
      throw new ValidationException("offset", "range", "offset must not be negative");
    }
  }
}
