package io.b2mash.pms.timeentry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, UUID> {

  Optional<TimeEntry> findFirstByUserIdAndClockOutIsNullOrderByClockInDesc(UUID userId);

  boolean existsByUserIdAndClockOutIsNull(UUID userId);

  Optional<TimeEntry> findByIdAndUserId(UUID id, UUID userId);

  List<TimeEntry> findByUserIdAndEntryDateOrderByClockInAsc(UUID userId, LocalDate entryDate);

  /** Entry counts and closed-session seconds for one user since a date. */
  @Query(
      nativeQuery = true,
      value =
          """
          SELECT
            COUNT(*) AS totalEntries,
            COALESCE(SUM(CASE WHEN clock_out IS NOT NULL THEN 1 ELSE 0 END), 0) AS completedEntries,
            COALESCE(SUM(CASE WHEN clock_out IS NULL THEN 1 ELSE 0 END), 0) AS activeEntries,
            COUNT(DISTINCT entry_date) AS daysWorked,
            CAST(COALESCE(SUM(CASE WHEN clock_out IS NOT NULL
              THEN EXTRACT(EPOCH FROM (clock_out - clock_in)) ELSE 0 END), 0) AS BIGINT)
              AS workedSeconds
          FROM time_entries
          WHERE user_id = :userId AND entry_date >= :since
          """)
  TimeStatsProjection computeStats(@Param("userId") UUID userId, @Param("since") LocalDate since);
}
