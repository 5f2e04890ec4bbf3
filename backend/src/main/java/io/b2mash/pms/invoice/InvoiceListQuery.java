package io.b2mash.pms.invoice;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Invoice listing and export rows, joined with client and project names. The status filter matches
 * the effective status, so {@code overdue} also selects pending invoices past their due date.
 */
@Component
public class InvoiceListQuery {

  private static final String SELECT =
      "SELECT i, u.name, u.email, p.name FROM Invoice i"
          + " LEFT JOIN User u ON u.id = i.clientId"
          + " LEFT JOIN Project p ON p.id = i.projectId";

  private final EntityManager entityManager;

  public InvoiceListQuery(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public record Filter(
      InvoiceStatus status,
      UUID clientId,
      UUID projectId,
      String search,
      LocalDate fromDate,
      LocalDate toDate) {

    public static Filter forExport(InvoiceStatus status, LocalDate fromDate, LocalDate toDate) {
      return new Filter(status, null, null, null, fromDate, toDate);
    }
  }

  public PagedResponse<InvoiceView> page(Filter filter, LocalDate today, PageWindow window) {
    var where = new StringBuilder(" WHERE 1=1");
    Map<String, Object> params = new HashMap<>();
    appendPredicates(filter, today, where, params);

    TypedQuery<Object[]> query =
        entityManager.createQuery(SELECT + where + " ORDER BY i.createdAt DESC", Object[].class);
    TypedQuery<Long> count =
        entityManager.createQuery(
            "SELECT COUNT(i) FROM Invoice i LEFT JOIN User u ON u.id = i.clientId" + where,
            Long.class);
    params.forEach(
        (name, value) -> {
          query.setParameter(name, value);
          count.setParameter(name, value);
        });
    query.setFirstResult(window.offset());
    query.setMaxResults(window.limit());

    return PagedResponse.of(
        toViews(query.getResultList()),
        count.getSingleResult(),
        window.limit(),
        window.offset());
  }

  /** Every matching invoice, newest invoice date first. */
  public List<InvoiceView> all(Filter filter, LocalDate today) {
    var where = new StringBuilder(" WHERE 1=1");
    Map<String, Object> params = new HashMap<>();
    appendPredicates(filter, today, where, params);

    TypedQuery<Object[]> query =
        entityManager.createQuery(
            SELECT + where + " ORDER BY i.invoiceDate DESC, i.createdAt DESC", Object[].class);
    params.forEach(query::setParameter);
    return toViews(query.getResultList());
  }

  private void appendPredicates(
      Filter filter, LocalDate today, StringBuilder where, Map<String, Object> params) {
    if (filter.status() != null) {
      switch (filter.status()) {
        case OVERDUE -> {
          where.append(
              " AND (i.status = :overdue OR (i.status = :pending AND i.dueDate < :today))");
          params.put("overdue", InvoiceStatus.OVERDUE);
          params.put("pending", InvoiceStatus.PENDING);
          params.put("today", today);
        }
        case PENDING -> {
          where.append(" AND i.status = :pending AND i.dueDate >= :today");
          params.put("pending", InvoiceStatus.PENDING);
          params.put("today", today);
        }
        default -> {
          where.append(" AND i.status = :status");
          params.put("status", filter.status());
        }
      }
    }
    if (filter.clientId() != null) {
      where.append(" AND i.clientId = :clientId");
      params.put("clientId", filter.clientId());
    }
    if (filter.projectId() != null) {
      where.append(" AND i.projectId = :projectId");
      params.put("projectId", filter.projectId());
    }
    if (filter.search() != null && !filter.search().isBlank()) {
      where.append(
          " AND (LOWER(i.invoiceNumber) LIKE :search OR LOWER(i.description) LIKE :search"
              + " OR LOWER(u.name) LIKE :search)");
      params.put("search", "%" + filter.search().trim().toLowerCase() + "%");
    }
    if (filter.fromDate() != null) {
      where.append(" AND i.invoiceDate >= :fromDate");
      params.put("fromDate", filter.fromDate());
    }
    if (filter.toDate() != null) {
      where.append(" AND i.invoiceDate <= :toDate");
      params.put("toDate", filter.toDate());
    }
  }

  private List<InvoiceView> toViews(List<Object[]> rows) {
    return rows.stream()
        .map(r -> new InvoiceView((Invoice) r[0], (String) r[1], (String) r[2], (String) r[3]))
        .toList();
  }
}
