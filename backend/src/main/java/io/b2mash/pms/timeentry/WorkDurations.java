package io.b2mash.pms.timeentry;

import java.time.Duration;

/** Formatting for worked time. */
public final class WorkDurations {

  /** Formats as hours and zero-padded minutes, e.g. {@code 7:05}. Seconds are truncated. */
  public static String format(Duration duration) {
    long totalMinutes = Math.max(0, duration.toMinutes());
    return String.format("%d:%02d", totalMinutes / 60, totalMinutes % 60);
  }

  private WorkDurations() {}
}
