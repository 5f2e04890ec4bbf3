package io.b2mash.pms.user;

import io.b2mash.pms.exception.ResourceConflictException;
import io.b2mash.pms.exception.ValidationException;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Write-time rules for user records: identity uniqueness and password strength. */
@Component
public class UserValidator {

  public static final int MIN_PASSWORD_LENGTH = 6;

  private final UserRepository userRepository;

  public UserValidator(UserRepository userRepository) {
    this.userRepository = userRepository;
  }

  public void validatePassword(String field, String password) {
    if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
      throw new ValidationException(
          field,
          "min_length",
          "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
    }
  }

  /** Rejects an email or username already held by another user. */
  public void requireUniqueIdentity(String email, String username, UUID excludeUserId) {
    boolean taken =
        excludeUserId == null
            ? userRepository.existsByEmailOrUsername(email, username)
            : userRepository.existsByEmailOrUsernameExcluding(email, username, excludeUserId);
    if (taken) {
      throw duplicateIdentity();
    }
  }

  static ResourceConflictException duplicateIdentity() {
    return new ResourceConflictException(
        "duplicate", "Duplicate user", "User with this email or username already exists");
  }
}
