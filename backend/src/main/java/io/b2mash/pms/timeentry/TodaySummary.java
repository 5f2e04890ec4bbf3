package io.b2mash.pms.timeentry;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/** A user's time entries for one day condensed into a status line. */
public record TodaySummary(
    LocalDate date,
    Instant clockInTime,
    Instant clockOutTime,
    String totalWorked,
    String status,
    boolean currentlyClockedIn,
    int entriesCount) {

  public static final String NOT_STARTED = "Not Started";
  public static final String IN_PROGRESS = "In Progress";
  public static final String COMPLETED = "Completed";

  /**
   * @param entries the day's entries in any order
   * @param now instant used to count the running session
   */
  public static TodaySummary of(LocalDate date, List<TimeEntry> entries, Instant now) {
    if (entries.isEmpty()) {
      return new TodaySummary(date, null, null, "0:00", NOT_STARTED, false, 0);
    }
    var sorted = entries.stream().sorted(Comparator.comparing(TimeEntry::getClockIn)).toList();
    boolean open = sorted.stream().anyMatch(TimeEntry::isOpen);

    Duration worked = Duration.ZERO;
    for (TimeEntry entry : sorted) {
      worked = worked.plus(entry.workedUntil(now));
    }

    Instant lastClockOut =
        open
            ? null
            : sorted.stream()
                .map(TimeEntry::getClockOut)
                .max(Comparator.naturalOrder())
                .orElse(null);

    return new TodaySummary(
        date,
        sorted.get(0).getClockIn(),
        lastClockOut,
        WorkDurations.format(worked),
        open ? IN_PROGRESS : COMPLETED,
        open,
        sorted.size());
  }
}
