package io.b2mash.pms.security;

public enum DenialReason {
  INSUFFICIENT_ROLE("insufficient_role"),
  NOT_OWNER("not_owner");

  private final String code;

  DenialReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
