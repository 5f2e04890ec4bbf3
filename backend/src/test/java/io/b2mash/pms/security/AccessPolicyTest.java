package io.b2mash.pms.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.pms.exception.ForbiddenException;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AccessPolicyTest {

  private final AccessPolicy policy = new AccessPolicy();

  private static Caller caller(RoleSet roles) {
    return new Caller(UUID.randomUUID(), roles);
  }

  @Test
  void staffOnlyCannotAccessProjects() {
    var decision = policy.projectAccess(caller(RoleSet.staffOnly()));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo(DenialReason.INSUFFICIENT_ROLE);
  }

  @Test
  void userCanOpenOwnProject() {
    var user = caller(RoleSet.of(Role.USER));

    assertThat(policy.projectInstance(user, user.userId()).allowed()).isTrue();
  }

  @Test
  void userIsDeniedOtherUsersProjectAsNotOwner() {
    var decision = policy.projectInstance(caller(RoleSet.of(Role.USER)), UUID.randomUUID());

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo(DenialReason.NOT_OWNER);
  }

  @Test
  void madminBypassesOwnership() {
    assertThat(
            policy.projectInstance(caller(RoleSet.of(Role.MADMIN)), UUID.randomUUID()).allowed())
        .isTrue();
  }

  @Test
  void onlyAdminDeletesProjectsAndInvoices() {
    var madmin = caller(RoleSet.of(Role.MADMIN));
    var admin = caller(RoleSet.of(Role.ADMIN));

    assertThat(policy.projectDelete(madmin).allowed()).isFalse();
    assertThat(policy.invoiceDelete(madmin).allowed()).isFalse();
    assertThat(policy.projectDelete(admin).allowed()).isTrue();
    assertThat(policy.invoiceDelete(admin).allowed()).isTrue();
  }

  @Test
  void billingRequiresPrivilegedRole() {
    assertThat(policy.billing(caller(RoleSet.of(Role.USER))).allowed()).isFalse();
    assertThat(policy.billing(caller(RoleSet.of(Role.MADMIN))).allowed()).isTrue();
  }

  @Test
  void profileRead_selfOrAdmin() {
    var user = caller(RoleSet.of(Role.USER));

    assertThat(policy.profileRead(user, user.userId()).allowed()).isTrue();
    assertThat(policy.profileRead(user, UUID.randomUUID()).reason())
        .isEqualTo(DenialReason.NOT_OWNER);
    assertThat(policy.profileRead(caller(RoleSet.of(Role.ADMIN)), UUID.randomUUID()).allowed())
        .isTrue();
  }

  @Test
  void profileUpdate_selfMayChangeIdentityFields() {
    var user = caller(RoleSet.staffOnly());

    assertThat(policy.profileUpdate(user, user.userId(), Set.of("name", "email")).allowed())
        .isTrue();
  }

  @Test
  void profileUpdate_selfCannotChangeRoles() {
    var user = caller(RoleSet.of(Role.MADMIN));

    var decision = policy.profileUpdate(user, user.userId(), Set.of("name", "roles"));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo(DenialReason.INSUFFICIENT_ROLE);
  }

  @Test
  void profileUpdate_adminMayChangeAnything() {
    assertThat(
            policy
                .profileUpdate(
                    caller(RoleSet.of(Role.ADMIN)),
                    UUID.randomUUID(),
                    Set.of("roles", "approved"))
                .allowed())
        .isTrue();
  }

  @Test
  void orThrow_carriesReasonCode() {
    var decision = policy.projectInstance(caller(RoleSet.of(Role.USER)), UUID.randomUUID());

    assertThatThrownBy(decision::orThrow)
        .isInstanceOfSatisfying(
            ForbiddenException.class,
            e -> {
              assertThat(e.getReason()).isEqualTo("not_owner");
              assertThat(e.getBody().getProperties()).containsEntry("reason", "not_owner");
            });
  }
}
