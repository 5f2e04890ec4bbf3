package io.b2mash.pms.invoice;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reserves sequential invoice numbers per calendar year from a counter table.
 *
 * <ul>
 *   <li>The counter row for a year is created on first use
 *   <li>Format: four-digit year followed by a zero-padded four-digit sequence, e.g. "20240001"
 *   <li>Numbers of deleted invoices are not reused
 * </ul>
 */
@Service
public class InvoiceNumberService {

  @PersistenceContext private EntityManager entityManager;

  /**
   * Reserves the next number for {@code year}.
   *
   * <p>INSERT ... ON CONFLICT DO UPDATE ... RETURNING takes a row lock on the year's counter, so
   * concurrent callers serialize and never receive the same number.
   */
  @Transactional
  public String reserveNumber(int year) {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO invoice_counters (year, next_number)"
                    + " VALUES (:year, 2)"
                    + " ON CONFLICT (year)"
                    + " DO UPDATE SET next_number = invoice_counters.next_number + 1"
                    + " RETURNING next_number - 1")
            .setParameter("year", year)
            .getSingleResult();

    int sequence = ((Number) result).intValue();
    return format(year, sequence);
  }

  static String format(int year, int sequence) {
    return String.format("%d%04d", year, sequence);
  }
}
