package io.b2mash.pms.timeentry;

/** Spring Data projection interface for per-user time aggregation over a period. */
public interface TimeStatsProjection {

  Long getTotalEntries();

  Long getCompletedEntries();

  Long getActiveEntries();

  Long getDaysWorked();

  Long getWorkedSeconds();
}
