package io.b2mash.pms.user;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, UUID> {

  @Query("SELECT u FROM User u WHERE LOWER(u.email) = LOWER(:email)")
  Optional<User> findByEmailIgnoreCase(@Param("email") String email);

  @Query(
      """
      SELECT u FROM User u
      WHERE LOWER(u.email) = LOWER(:login) OR LOWER(u.username) = LOWER(:login)
      """)
  Optional<User> findByEmailOrUsername(@Param("login") String login);

  @Query(
      """
      SELECT COUNT(u) > 0 FROM User u
      WHERE LOWER(u.email) = LOWER(:email) OR LOWER(u.username) = LOWER(:username)
      """)
  boolean existsByEmailOrUsername(
      @Param("email") String email, @Param("username") String username);

  /** Same check as {@link #existsByEmailOrUsername} but ignoring the user being updated. */
  @Query(
      """
      SELECT COUNT(u) > 0 FROM User u
      WHERE (LOWER(u.email) = LOWER(:email) OR LOWER(u.username) = LOWER(:username))
        AND u.id <> :excludeId
      """)
  boolean existsByEmailOrUsernameExcluding(
      @Param("email") String email,
      @Param("username") String username,
      @Param("excludeId") UUID excludeId);

  @Query(
      nativeQuery = true,
      value =
          """
          SELECT
            COUNT(*) AS total,
            COALESCE(SUM(CASE WHEN approved THEN 1 ELSE 0 END), 0) AS approved,
            COALESCE(SUM(CASE WHEN NOT approved THEN 1 ELSE 0 END), 0) AS pending,
            COALESCE(SUM(CASE WHEN 'admin' = ANY(roles) THEN 1 ELSE 0 END), 0) AS admins,
            COALESCE(SUM(CASE WHEN 'madmin' = ANY(roles) THEN 1 ELSE 0 END), 0) AS madmins,
            COALESCE(SUM(CASE WHEN 'user' = ANY(roles) THEN 1 ELSE 0 END), 0) AS users,
            COALESCE(SUM(CASE WHEN cardinality(roles) = 1 THEN 1 ELSE 0 END), 0) AS staffOnly
          FROM users
          """)
  UserStatsProjection computeStats();
}
