package io.b2mash.pms.timeentry;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.exception.ResourceConflictException;
import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.security.Caller;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Clock-in/clock-out tracking. Every operation acts on the caller's own entries; there is no
 * cross-user access, including for administrators.
 */
@Service
public class TimeEntryService {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryService.class);

  private final TimeEntryRepository repository;
  private final TimeEntryListQuery listQuery;

  public TimeEntryService(TimeEntryRepository repository, TimeEntryListQuery listQuery) {
    this.repository = repository;
    this.listQuery = listQuery;
  }

  @Transactional(readOnly = true)
  public PagedResponse<TimeEntry> listEntries(
      Caller caller, LocalDate date, YearMonth month, PageWindow window) {
    return listQuery.execute(caller.userId(), date, month, window);
  }

  @Transactional(readOnly = true)
  public Optional<TimeEntry> getCurrentEntry(Caller caller) {
    return repository.findFirstByUserIdAndClockOutIsNullOrderByClockInDesc(caller.userId());
  }

  @Transactional(readOnly = true)
  public TodaySummary getTodaySummary(Caller caller) {
    LocalDate today = LocalDate.now();
    var entries = repository.findByUserIdAndEntryDateOrderByClockInAsc(caller.userId(), today);
    return TodaySummary.of(today, entries, Instant.now());
  }

  @Transactional(readOnly = true)
  public TimeStats getStats(Caller caller, TimePeriod period) {
    LocalDate since = period.since(LocalDate.now());
    return TimeStats.from(period, repository.computeStats(caller.userId(), since));
  }

  /**
   * Opens a new session. The partial unique index on open entries backs the existence check, so a
   * concurrent second clock-in fails with the same conflict.
   */
  @Transactional
  public TimeEntry clockIn(Caller caller) {
    if (repository.existsByUserIdAndClockOutIsNull(caller.userId())) {
      throw alreadyClockedIn();
    }
    Instant now = Instant.now();
    TimeEntry entry;
    try {
      entry = repository.saveAndFlush(new TimeEntry(caller.userId(), now, LocalDate.now()));
    } catch (DataIntegrityViolationException e) {
      log.warn("Concurrent clock-in rejected for user {}", caller.userId());
      throw alreadyClockedIn();
    }
    log.info("User {} clocked in (entry {})", caller.userId(), entry.getId());
    return entry;
  }

  /** Closes the caller's most recent open session. */
  @Transactional
  public TimeEntry clockOut(Caller caller) {
    var entry =
        repository
            .findFirstByUserIdAndClockOutIsNullOrderByClockInDesc(caller.userId())
            .orElseThrow(
                () ->
                    new ResourceConflictException(
                        "not_clocked_in",
                        "Not clocked in",
                        "You are not currently clocked in"));
    entry.clockOut(Instant.now());
    entry = repository.save(entry);
    log.info("User {} clocked out (entry {})", caller.userId(), entry.getId());
    return entry;
  }

  /** Deletes one of the caller's closed entries. Other users' entries are reported as missing. */
  @Transactional
  public void deleteEntry(Caller caller, UUID id) {
    var entry =
        repository
            .findByIdAndUserId(id, caller.userId())
            .orElseThrow(() -> new ResourceNotFoundException("Time entry", id));
    if (entry.isOpen()) {
      throw new ResourceConflictException(
          "entry_active",
          "Time entry active",
          "Cannot delete active time entry. Please clock out first.");
    }
    repository.delete(entry);
    log.info("User {} deleted time entry {}", caller.userId(), id);
  }

  private static ResourceConflictException alreadyClockedIn() {
    return new ResourceConflictException(
        "already_clocked_in",
        "Already clocked in",
        "You are already clocked in. Please clock out first.");
  }
}
