package io.b2mash.pms.user;

public record UserStats(
    long total,
    long approved,
    long pending,
    long admins,
    long madmins,
    long users,
    long staffOnly) {

  public static final UserStats EMPTY = new UserStats(0, 0, 0, 0, 0, 0, 0);

  static UserStats from(UserStatsProjection p) {
    if (p == null) {
      return EMPTY;
    }
    return new UserStats(
        n(p.getTotal()),
        n(p.getApproved()),
        n(p.getPending()),
        n(p.getAdmins()),
        n(p.getMadmins()),
        n(p.getUsers()),
        n(p.getStaffOnly()));
  }

  private static long n(Long value) {
    return value != null ? value : 0L;
  }
}
