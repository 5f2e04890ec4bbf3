package io.b2mash.pms.testutil;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;

import io.b2mash.pms.security.Role;
import io.b2mash.pms.security.RoleSet;
import io.b2mash.pms.user.User;
import io.b2mash.pms.user.UserRepository;
import java.util.UUID;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;

/** Shared test utility for seeding users and authenticating requests as them. */
public final class TestUsers {

  public static final String PASSWORD = "secret123";

  private TestUsers() {}

  /**
   * Saves an approved user with a unique email and username derived from {@code prefix}. Staff is
   * always included in the roles.
   */
  public static User approved(
      UserRepository repository, PasswordEncoder encoder, String prefix, Role... roles) {
    return save(repository, encoder, prefix, true, roles);
  }

  public static User pending(UserRepository repository, PasswordEncoder encoder, String prefix) {
    return save(repository, encoder, prefix, false);
  }

  /**
   * Mock JWT whose subject is the user's id. Authorities are resolved from the stored roles by the
   * user filter, so none are set here.
   */
  public static JwtRequestPostProcessor jwtFor(User user) {
    return jwtFor(user.getId());
  }

  public static JwtRequestPostProcessor jwtFor(UUID userId) {
    return jwt().jwt(j -> j.subject(userId.toString()));
  }

  private static User save(
      UserRepository repository,
      PasswordEncoder encoder,
      String prefix,
      boolean approved,
      Role... roles) {
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    String username = prefix + "_" + suffix;
    RoleSet roleSet = roles.length == 0 ? RoleSet.staffOnly() : RoleSet.of(Role.STAFF, roles);
    return repository.save(
        new User(
            username + "@test.com",
            username,
            prefix + " " + suffix,
            encoder.encode(PASSWORD),
            roleSet,
            approved));
  }
}
