package io.b2mash.pms.invoice;

import java.time.LocalDate;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  /**
   * Counts and revenue grouped by effective status: a pending invoice due before {@code today}
   * counts as overdue. Aggregates are COALESCEd so an empty table yields zeros.
   */
  @Query(
      nativeQuery = true,
      value =
          """
          SELECT
            COUNT(*) AS total,
            COALESCE(SUM(CASE WHEN status = 'PENDING' AND due_date >= :today
              THEN 1 ELSE 0 END), 0) AS pending,
            COALESCE(SUM(CASE WHEN status = 'PAID' THEN 1 ELSE 0 END), 0) AS paid,
            COALESCE(SUM(CASE WHEN status = 'OVERDUE'
              OR (status = 'PENDING' AND due_date < :today) THEN 1 ELSE 0 END), 0) AS overdue,
            COALESCE(SUM(CASE WHEN status = 'CANCELLED' THEN 1 ELSE 0 END), 0) AS cancelled,
            COALESCE(SUM(CASE WHEN status = 'PAID' THEN amount ELSE 0 END), 0) AS totalRevenue,
            COALESCE(SUM(CASE WHEN status = 'PENDING' AND due_date >= :today
              THEN amount ELSE 0 END), 0) AS pendingRevenue,
            COALESCE(SUM(CASE WHEN status = 'OVERDUE'
              OR (status = 'PENDING' AND due_date < :today) THEN amount ELSE 0 END), 0)
              AS overdueRevenue,
            COALESCE(AVG(CASE WHEN status = 'PAID' THEN amount END), 0) AS averageAmount
          FROM invoices
          """)
  InvoiceStatsProjection computeStats(@Param("today") LocalDate today);
}
