package io.b2mash.pms.project;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  @Query("SELECT u.name FROM User u WHERE u.id = :userId")
  Optional<String> findUserName(@Param("userId") UUID userId);

  /** Status counts over all projects. Aggregates never return null. */
  @Query(
      nativeQuery = true,
      value =
          """
          SELECT
            COUNT(*) AS total,
            COALESCE(SUM(CASE WHEN status = 'PENDING' THEN 1 ELSE 0 END), 0) AS pending,
            COALESCE(SUM(CASE WHEN status = 'ONGOING' THEN 1 ELSE 0 END), 0) AS ongoing,
            COALESCE(SUM(CASE WHEN status = 'COMPLETED' THEN 1 ELSE 0 END), 0) AS completed
          FROM projects
          """)
  ProjectCountsProjection countByStatus();

  /** Status counts over the projects created by one user. */
  @Query(
      nativeQuery = true,
      value =
          """
          SELECT
            COUNT(*) AS total,
            COALESCE(SUM(CASE WHEN status = 'PENDING' THEN 1 ELSE 0 END), 0) AS pending,
            COALESCE(SUM(CASE WHEN status = 'ONGOING' THEN 1 ELSE 0 END), 0) AS ongoing,
            COALESCE(SUM(CASE WHEN status = 'COMPLETED' THEN 1 ELSE 0 END), 0) AS completed
          FROM projects
          WHERE created_by = :userId
          """)
  ProjectCountsProjection countByStatusForCreator(@Param("userId") UUID userId);
}
