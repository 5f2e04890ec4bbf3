package io.b2mash.pms.user;

import io.b2mash.pms.exception.ResourceConflictException;
import io.b2mash.pms.security.RoleSet;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "username", nullable = false, length = 100)
  private String username;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "password_hash", nullable = false, length = 255)
  private String passwordHash;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "roles", nullable = false, columnDefinition = "text[]")
  private String[] roles;

  @Column(name = "approved", nullable = false)
  private boolean approved;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected User() {}

  public User(
      String email,
      String username,
      String name,
      String passwordHash,
      RoleSet roles,
      boolean approved) {
    this.email = email;
    this.username = username;
    this.name = name;
    this.passwordHash = passwordHash;
    this.roles = roles.toArray();
    this.approved = approved;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getUsername() {
    return username;
  }

  public String getName() {
    return name;
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public RoleSet getRoles() {
    return RoleSet.fromStored(roles);
  }

  public boolean isApproved() {
    return approved;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void updateProfile(String name, String email, String username) {
    if (name != null) {
      this.name = name;
    }
    if (email != null) {
      this.email = email;
    }
    if (username != null) {
      this.username = username;
    }
    this.updatedAt = Instant.now();
  }

  public void assignRoles(RoleSet roles) {
    this.roles = roles.toArray();
    this.updatedAt = Instant.now();
  }

  public void setApproved(boolean approved) {
    this.approved = approved;
    this.updatedAt = Instant.now();
  }

  /** Approves a pending account. Approving twice is a conflict, not a no-op. */
  public void approve() {
    if (approved) {
      throw new ResourceConflictException(
          "already_approved", "User already approved", "User " + id + " is already approved");
    }
    setApproved(true);
  }

  public void changePasswordHash(String passwordHash) {
    this.passwordHash = passwordHash;
    this.updatedAt = Instant.now();
  }
}
