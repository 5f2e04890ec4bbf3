package io.b2mash.pms.project;

/** Spring Data projection interface for project status counts. */
public interface ProjectCountsProjection {

  Long getTotal();

  Long getPending();

  Long getOngoing();

  Long getCompleted();
}
