package io.b2mash.pms.timeentry;

import io.b2mash.pms.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** One clock-in/clock-out session. An entry without a clock-out is open. */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "clock_in", nullable = false)
  private Instant clockIn;

  @Column(name = "clock_out")
  private Instant clockOut;

  @Column(name = "entry_date", nullable = false)
  private LocalDate entryDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeEntry() {}

  public TimeEntry(UUID userId, Instant clockIn, LocalDate entryDate) {
    this.userId = userId;
    this.clockIn = clockIn;
    this.entryDate = entryDate;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isOpen() {
    return clockOut == null;
  }

  /**
   * Closes the session.
   *
   * @throws ResourceConflictException if the entry is already closed
   */
  public void clockOut(Instant at) {
    if (!isOpen()) {
      throw new ResourceConflictException(
          "not_clocked_in", "Not clocked in", "Time entry " + id + " is already clocked out");
    }
    this.clockOut = at;
    this.updatedAt = Instant.now();
  }

  /** Worked time; open entries count up to {@code now}. */
  public Duration workedUntil(Instant now) {
    Instant end = clockOut != null ? clockOut : now;
    return end.isBefore(clockIn) ? Duration.ZERO : Duration.between(clockIn, end);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public Instant getClockIn() {
    return clockIn;
  }

  public Instant getClockOut() {
    return clockOut;
  }

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
