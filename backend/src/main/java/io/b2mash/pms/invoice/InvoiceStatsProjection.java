package io.b2mash.pms.invoice;

import java.math.BigDecimal;

/** Spring Data projection interface for invoice counts and revenue by effective status. */
public interface InvoiceStatsProjection {

  Long getTotal();

  Long getPending();

  Long getPaid();

  Long getOverdue();

  Long getCancelled();

  BigDecimal getTotalRevenue();

  BigDecimal getPendingRevenue();

  BigDecimal getOverdueRevenue();

  BigDecimal getAverageAmount();
}
