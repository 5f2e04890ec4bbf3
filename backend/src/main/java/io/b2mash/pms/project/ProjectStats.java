package io.b2mash.pms.project;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Project status summary. {@code completionRate} is the completed share in percent, rounded to two
 * decimals, and zero when there are no projects.
 */
public record ProjectStats(
    long total, long pending, long ongoing, long completed, BigDecimal completionRate) {

  public static final ProjectStats EMPTY = of(0, 0, 0, 0);

  public static ProjectStats of(long total, long pending, long ongoing, long completed) {
    BigDecimal rate =
        total == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(completed)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    return new ProjectStats(total, pending, ongoing, completed, rate);
  }

  static ProjectStats from(ProjectCountsProjection p) {
    if (p == null) {
      return EMPTY;
    }
    return of(n(p.getTotal()), n(p.getPending()), n(p.getOngoing()), n(p.getCompleted()));
  }

  private static long n(Long value) {
    return value != null ? value : 0L;
  }
}
