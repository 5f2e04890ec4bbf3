package io.b2mash.pms.user;

/** Spring Data projection interface for the user overview counts. */
public interface UserStatsProjection {

  Long getTotal();

  Long getApproved();

  Long getPending();

  Long getAdmins();

  Long getMadmins();

  Long getUsers();

  Long getStaffOnly();
}
