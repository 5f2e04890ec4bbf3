package io.b2mash.pms.timeentry;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** One user's entries, optionally limited to a day or a calendar month. */
@Component
public class TimeEntryListQuery {

  private final EntityManager entityManager;

  public TimeEntryListQuery(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public PagedResponse<TimeEntry> execute(
      UUID userId, LocalDate date, YearMonth month, PageWindow window) {
    var where = new StringBuilder(" WHERE t.userId = :userId");
    Map<String, Object> params = new HashMap<>();
    params.put("userId", userId);

    if (date != null) {
      where.append(" AND t.entryDate = :date");
      params.put("date", date);
    }
    if (month != null) {
      where.append(" AND t.entryDate >= :monthStart AND t.entryDate < :nextMonthStart");
      params.put("monthStart", month.atDay(1));
      params.put("nextMonthStart", month.plusMonths(1).atDay(1));
    }

    TypedQuery<TimeEntry> query =
        entityManager.createQuery(
            "SELECT t FROM TimeEntry t" + where + " ORDER BY t.clockIn DESC", TimeEntry.class);
    TypedQuery<Long> count =
        entityManager.createQuery("SELECT COUNT(t) FROM TimeEntry t" + where, Long.class);
    params.forEach(
        (name, value) -> {
          query.setParameter(name, value);
          count.setParameter(name, value);
        });
    query.setFirstResult(window.offset());
    query.setMaxResults(window.limit());

    return PagedResponse.of(
        query.getResultList(), count.getSingleResult(), window.limit(), window.offset());
  }
}
