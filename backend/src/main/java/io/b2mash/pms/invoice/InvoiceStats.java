package io.b2mash.pms.invoice;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record InvoiceStats(
    long total,
    long pending,
    long paid,
    long overdue,
    long cancelled,
    BigDecimal totalRevenue,
    BigDecimal pendingRevenue,
    BigDecimal overdueRevenue,
    BigDecimal averageAmount) {

  public static final InvoiceStats EMPTY =
      new InvoiceStats(
          0, 0, 0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

  static InvoiceStats from(InvoiceStatsProjection p) {
    if (p == null) {
      return EMPTY;
    }
    return new InvoiceStats(
        n(p.getTotal()),
        n(p.getPending()),
        n(p.getPaid()),
        n(p.getOverdue()),
        n(p.getCancelled()),
        money(p.getTotalRevenue()),
        money(p.getPendingRevenue()),
        money(p.getOverdueRevenue()),
        money(p.getAverageAmount()));
  }

  private static long n(Long value) {
    return value != null ? value : 0L;
  }

  private static BigDecimal money(BigDecimal value) {
    return value != null ? value.setScale(2, RoundingMode.HALF_UP) : BigDecimal.ZERO;
  }
}
