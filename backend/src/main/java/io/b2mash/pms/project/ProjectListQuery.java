package io.b2mash.pms.project;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Filtered, paged project listing joined with the creator's name. */
@Component
public class ProjectListQuery {

  private final EntityManager entityManager;

  public ProjectListQuery(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  /**
   * @param createdBy restricts to one creator; null lists every creator
   */
  public record Filter(ProjectStatus status, String search, UUID createdBy) {}

  public PagedResponse<ProjectView> execute(Filter filter, PageWindow window) {
    var where = new StringBuilder(" WHERE 1=1");
    Map<String, Object> params = new HashMap<>();

    if (filter.createdBy() != null) {
      where.append(" AND p.createdBy = :createdBy");
      params.put("createdBy", filter.createdBy());
    }
    if (filter.status() != null) {
      where.append(" AND p.status = :status");
      params.put("status", filter.status());
    }
    if (filter.search() != null && !filter.search().isBlank()) {
      where.append(" AND (LOWER(p.name) LIKE :search OR LOWER(p.description) LIKE :search)");
      params.put("search", "%" + filter.search().trim().toLowerCase() + "%");
    }

    TypedQuery<Object[]> query =
        entityManager.createQuery(
            "SELECT p, u.name FROM Project p LEFT JOIN User u ON u.id = p.createdBy"
                + where
                + " ORDER BY p.createdAt DESC",
            Object[].class);
    TypedQuery<Long> count =
        entityManager.createQuery("SELECT COUNT(p) FROM Project p" + where, Long.class);
    params.forEach(
        (name, value) -> {
          query.setParameter(name, value);
          count.setParameter(name, value);
        });

    query.setFirstResult(window.offset());
    query.setMaxResults(window.limit());

    List<ProjectView> rows =
        query.getResultList().stream()
            .map(r -> new ProjectView((Project) r[0], (String) r[1]))
            .toList();
    return PagedResponse.of(rows, count.getSingleResult(), window.limit(), window.offset());
  }
}
