package io.b2mash.pms.user;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.exception.ForbiddenException;
import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.exception.UnauthorizedException;
import io.b2mash.pms.exception.ValidationException;
import io.b2mash.pms.security.AccessPolicy;
import io.b2mash.pms.security.Caller;
import io.b2mash.pms.security.RoleSet;
import io.b2mash.pms.security.TokenService;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final UserListQuery userListQuery;
  private final UserValidator userValidator;
  private final AccessPolicy accessPolicy;
  private final PasswordEncoder passwordEncoder;
  private final TokenService tokenService;

  public UserService(
      UserRepository userRepository,
      UserListQuery userListQuery,
      UserValidator userValidator,
      AccessPolicy accessPolicy,
      PasswordEncoder passwordEncoder,
      TokenService tokenService) {
    this.userRepository = userRepository;
    this.userListQuery = userListQuery;
    this.userValidator = userValidator;
    this.accessPolicy = accessPolicy;
    this.passwordEncoder = passwordEncoder;
    this.tokenService = tokenService;
  }

  /** Fields an admin supplies when creating a user directly. */
  public record NewUser(
      String email,
      String username,
      String name,
      String password,
      List<String> roles,
      Boolean approved) {}

  /** Partial profile update. Null means "not supplied". */
  public record ProfileChanges(
      String name, String email, String username, List<String> roles, Boolean approved) {

    Set<String> suppliedFields() {
      var fields = new LinkedHashSet<String>();
      if (name != null) {
        fields.add("name");
      }
      if (email != null) {
        fields.add("email");
      }
      if (username != null) {
        fields.add("username");
      }
      if (roles != null) {
        fields.add("roles");
      }
      if (approved != null) {
        fields.add("approved");
      }
      return fields;
    }
  }

  public record LoginResult(User user, String token) {}

  // --- Self-service ---

  /** Self-registration. New accounts hold only the staff role and wait for admin approval. */
  @Transactional
  public User register(String email, String username, String name, String password) {
    userValidator.validatePassword("password", password);
    userValidator.requireUniqueIdentity(email, username, null);

    var user =
        new User(
            email, username, name, passwordEncoder.encode(password), RoleSet.staffOnly(), false);
    user = saveUnique(user);
    log.info("Registered user {} ({}), pending approval", user.getId(), user.getUsername());
    return user;
  }

  /**
   * Verifies credentials and issues a token.
   *
   * @throws UnauthorizedException for an unknown login or wrong password
   * @throws ForbiddenException when the account is not approved
   */
  @Transactional(readOnly = true)
  public LoginResult login(String emailOrUsername, String password) {
    var user =
        userRepository
            .findByEmailOrUsername(emailOrUsername.trim())
            .orElseThrow(() -> new UnauthorizedException("Invalid email/username or password"));

    if (!passwordEncoder.matches(password, user.getPasswordHash())) {
      log.warn("Failed login for user {}", user.getId());
      throw new UnauthorizedException("Invalid email/username or password");
    }
    if (!user.isApproved()) {
      log.warn("Login refused for unapproved user {}", user.getId());
      throw new ForbiddenException(
          "Account pending approval",
          "Your account is pending admin approval. Please contact an administrator.");
    }

    String token =
        tokenService.issueToken(user.getId(), user.getEmail(), user.getUsername(), user.getRoles());
    log.info("User {} logged in", user.getId());
    return new LoginResult(user, token);
  }

  @Transactional(readOnly = true)
  public User getCurrentUser(Caller caller) {
    return userRepository
        .findById(caller.userId())
        .orElseThrow(() -> new ResourceNotFoundException("User", caller.userId()));
  }

  @Transactional
  public void changeOwnPassword(Caller caller, String currentPassword, String newPassword) {
    userValidator.validatePassword("newPassword", newPassword);
    var user = getCurrentUser(caller);
    if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
      throw new ValidationException(
          "currentPassword", "mismatch", "Current password is incorrect");
    }
    user.changePasswordHash(passwordEncoder.encode(newPassword));
    userRepository.save(user);
    log.info("User {} changed their password", user.getId());
  }

  // --- Profiles ---

  @Transactional(readOnly = true)
  public User getUser(Caller caller, UUID id) {
    accessPolicy.profileRead(caller, id).orThrow();
    return userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User", id));
  }

  /**
   * Applies a partial profile update. Non-admins may change name, email and username on their own
   * record; admins may also change roles and approval on any record.
   */
  @Transactional
  public User updateUser(Caller caller, UUID id, ProfileChanges changes) {
    Set<String> fields = changes.suppliedFields();
    if (fields.isEmpty()) {
      throw new ValidationException(null, "empty_update", "No valid fields to update");
    }
    accessPolicy.profileUpdate(caller, id, fields).orThrow();

    var user =
        userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User", id));

    if (changes.email() != null || changes.username() != null) {
      String email = changes.email() != null ? changes.email() : user.getEmail();
      String username = changes.username() != null ? changes.username() : user.getUsername();
      userValidator.requireUniqueIdentity(email, username, id);
    }
    RoleSet roles = changes.roles() != null ? RoleSet.parse(changes.roles()) : null;

    user.updateProfile(changes.name(), changes.email(), changes.username());
    if (roles != null) {
      user.assignRoles(roles);
    }
    if (changes.approved() != null) {
      user.setApproved(changes.approved());
    }
    user = saveUnique(user);
    log.info("Updated user {} fields {} by {}", id, fields, caller.userId());
    return user;
  }

  // --- Administration ---

  @Transactional(readOnly = true)
  public PagedResponse<User> listUsers(
      Caller caller, Boolean approved, String search, PageWindow window) {
    accessPolicy.userAdministration(caller).orThrow();
    return userListQuery.execute(new UserListQuery.Filter(approved, search), window);
  }

  @Transactional
  public User createUser(Caller caller, NewUser request) {
    accessPolicy.userAdministration(caller).orThrow();
    userValidator.validatePassword("password", request.password());
    RoleSet roles =
        request.roles() != null ? RoleSet.parse(request.roles()) : RoleSet.staffOnly();
    userValidator.requireUniqueIdentity(request.email(), request.username(), null);

    boolean approved = request.approved() == null || request.approved();
    var user =
        new User(
            request.email(),
            request.username(),
            request.name(),
            passwordEncoder.encode(request.password()),
            roles,
            approved);
    user = saveUnique(user);
    log.info("Admin {} created user {} with roles {}", caller.userId(), user.getId(), roles);
    return user;
  }

  @Transactional
  public void resetPassword(Caller caller, UUID id, String newPassword) {
    accessPolicy.userAdministration(caller).orThrow();
    userValidator.validatePassword("newPassword", newPassword);
    var user =
        userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User", id));
    user.changePasswordHash(passwordEncoder.encode(newPassword));
    userRepository.save(user);
    log.info("Admin {} reset password for user {}", caller.userId(), id);
  }

  @Transactional
  public User approveUser(Caller caller, UUID id) {
    accessPolicy.userAdministration(caller).orThrow();
    var user =
        userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User", id));
    user.approve();
    user = userRepository.save(user);
    log.info("Admin {} approved user {}", caller.userId(), id);
    return user;
  }

  @Transactional(readOnly = true)
  public UserStats getStats(Caller caller) {
    accessPolicy.userAdministration(caller).orThrow();
    return UserStats.from(userRepository.computeStats());
  }

  /** Saves and flushes so a lost uniqueness race surfaces here as a conflict. */
  private User saveUnique(User user) {
    try {
      return userRepository.saveAndFlush(user);
    } catch (DataIntegrityViolationException e) {
      log.warn("Uniqueness violation saving user {}: {}", user.getUsername(), e.getMessage());
      throw UserValidator.duplicateIdentity();
    }
  }
}
