package io.b2mash.pms.timeentry;

import java.time.LocalDate;

/** Look-back window for time statistics. */
public enum TimePeriod {
  WEEK("week", "This Week"),
  MONTH("month", "This Month"),
  YEAR("year", "This Year");

  private final String value;
  private final String label;

  TimePeriod(String value, String label) {
    this.value = value;
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** First day included in the window ending {@code today}. */
  public LocalDate since(LocalDate today) {
    return switch (this) {
      case WEEK -> today.minusDays(7);
      case MONTH -> today.minusDays(30);
      case YEAR -> today.minusYears(1);
    };
  }

  /** Parses a query value; null or an unrecognised value selects {@link #MONTH}. */
  public static TimePeriod fromValue(String value) {
    if (value == null) {
      return MONTH;
    }
    for (TimePeriod period : values()) {
      if (period.value.equalsIgnoreCase(value)) {
        return period;
      }
    }
    return MONTH;
  }
}
