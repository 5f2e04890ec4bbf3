package io.b2mash.pms.timeentry;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.exception.ValidationException;
import io.b2mash.pms.security.RequestScopes;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/time-entries")
public class TimeEntryController {

  private final TimeEntryService timeEntryService;

  public TimeEntryController(TimeEntryService timeEntryService) {
    this.timeEntryService = timeEntryService;
  }

  @GetMapping
  public ResponseEntity<PagedResponse<TimeEntryResponse>> listEntries(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date,
      @RequestParam(required = false) String month,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    var page =
        timeEntryService.listEntries(
            RequestScopes.requireCaller(), date, parseMonth(month), new PageWindow(limit, offset));
    Instant now = Instant.now();
    return ResponseEntity.ok(page.map(e -> TimeEntryResponse.from(e, now)));
  }

  @GetMapping("/current")
  public ResponseEntity<CurrentEntryResponse> getCurrentEntry() {
    Instant now = Instant.now();
    var current =
        timeEntryService
            .getCurrentEntry(RequestScopes.requireCaller())
            .map(e -> TimeEntryResponse.from(e, now))
            .orElse(null);
    return ResponseEntity.ok(new CurrentEntryResponse(current, current != null));
  }

  @GetMapping("/today")
  public ResponseEntity<TodaySummary> getTodaySummary() {
    return ResponseEntity.ok(timeEntryService.getTodaySummary(RequestScopes.requireCaller()));
  }

  @GetMapping("/stats")
  public ResponseEntity<TimeStats> getStats(@RequestParam(required = false) String period) {
    return ResponseEntity.ok(
        timeEntryService.getStats(RequestScopes.requireCaller(), TimePeriod.fromValue(period)));
  }

  @PostMapping("/clock-in")
  public ResponseEntity<TimeEntryResponse> clockIn() {
    var entry = timeEntryService.clockIn(RequestScopes.requireCaller());
    return ResponseEntity.created(URI.create("/api/time-entries/" + entry.getId()))
        .body(TimeEntryResponse.from(entry, Instant.now()));
  }

  @PutMapping("/clock-out")
  public ResponseEntity<TimeEntryResponse> clockOut() {
    var entry = timeEntryService.clockOut(RequestScopes.requireCaller());
    return ResponseEntity.ok(TimeEntryResponse.from(entry, Instant.now()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteEntry(@PathVariable UUID id) {
    timeEntryService.deleteEntry(RequestScopes.requireCaller(), id);
    return ResponseEntity.noContent().build();
  }

  private static YearMonth parseMonth(String month) {
    if (month == null) {
      return null;
    }
    try {
      return YearMonth.parse(month);
    } catch (DateTimeParseException e) {
      throw new ValidationException("month", "format", "month must use the YYYY-MM format");
    }
  }

  // --- DTOs ---

  /**
   * @param duration worked time as H:MM for closed entries, null while open
   * @param currentDuration running time as H:MM for open entries, null once closed
   */
  public record TimeEntryResponse(
      UUID id,
      UUID userId,
      LocalDate date,
      Instant clockIn,
      Instant clockOut,
      String duration,
      String currentDuration,
      Instant createdAt,
      Instant updatedAt) {

    public static TimeEntryResponse from(TimeEntry entry, Instant now) {
      String worked = WorkDurations.format(entry.workedUntil(now));
      return new TimeEntryResponse(
          entry.getId(),
          entry.getUserId(),
          entry.getEntryDate(),
          entry.getClockIn(),
          entry.getClockOut(),
          entry.isOpen() ? null : worked,
          entry.isOpen() ? worked : null,
          entry.getCreatedAt(),
          entry.getUpdatedAt());
    }
  }

  public record CurrentEntryResponse(TimeEntryResponse currentEntry, boolean clockedIn) {}
}
