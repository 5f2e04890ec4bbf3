package io.b2mash.pms.user;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Filtered, paged user listing. Only supplied filters become predicates. */
@Component
public class UserListQuery {

  private final EntityManager entityManager;

  public UserListQuery(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public record Filter(Boolean approved, String search) {}

  public PagedResponse<User> execute(Filter filter, PageWindow window) {
    var where = new StringBuilder(" WHERE 1=1");
    Map<String, Object> params = new HashMap<>();

    if (filter.approved() != null) {
      where.append(" AND u.approved = :approved");
      params.put("approved", filter.approved());
    }
    if (filter.search() != null && !filter.search().isBlank()) {
      where.append(
          " AND (LOWER(u.name) LIKE :search OR LOWER(u.email) LIKE :search"
              + " OR LOWER(u.username) LIKE :search)");
      params.put("search", "%" + filter.search().trim().toLowerCase() + "%");
    }

    TypedQuery<User> query =
        entityManager.createQuery(
            "SELECT u FROM User u" + where + " ORDER BY u.createdAt DESC", User.class);
    TypedQuery<Long> count =
        entityManager.createQuery("SELECT COUNT(u) FROM User u" + where, Long.class);
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
