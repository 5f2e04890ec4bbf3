package io.b2mash.pms.timeentry;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Time tracking summary for one period. Hours cover closed sessions only; {@code
 * averageHoursPerDay} is zero when no day was worked.
 */
public record TimeStats(
    String period,
    long totalEntries,
    long completedEntries,
    long activeEntries,
    long daysWorked,
    BigDecimal totalHours,
    BigDecimal averageHoursPerDay) {

  private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

  public static TimeStats of(
      TimePeriod period,
      long totalEntries,
      long completedEntries,
      long activeEntries,
      long daysWorked,
      long workedSeconds) {
    BigDecimal hours =
        BigDecimal.valueOf(workedSeconds).divide(SECONDS_PER_HOUR, 2, RoundingMode.HALF_UP);
    BigDecimal average =
        daysWorked == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(workedSeconds)
                .divide(
                    SECONDS_PER_HOUR.multiply(BigDecimal.valueOf(daysWorked)),
                    2,
                    RoundingMode.HALF_UP);
    return new TimeStats(
        period.label(), totalEntries, completedEntries, activeEntries, daysWorked, hours, average);
  }

  static TimeStats from(TimePeriod period, TimeStatsProjection p) {
    if (p == null) {
      return of(period, 0, 0, 0, 0, 0);
    }
    return of(
        period,
        n(p.getTotalEntries()),
        n(p.getCompletedEntries()),
        n(p.getActiveEntries()),
        n(p.getDaysWorked()),
        n(p.getWorkedSeconds()));
  }

  private static long n(Long value) {
    return value != null ? value : 0L;
  }
}
