package com.codeheadsystems.bastion.server.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * An authenticatable identity. Immutable: every mutator returns a copy with {@code updatedAt}
 * stamped to the supplied instant.
 * <p>
 * The identifier is assigned once by {@link #create} and never changes. The role set is never
 * empty.
 *
 * @param id           stable identifier, a random UUID string
 * @param username     unique username
 * @param email        unique email address
 * @param passwordHash encoded password hash, never exposed outside the core
 * @param roles        role labels, sorted
 * @param active       whether the principal may authenticate
 * @param createdAt    creation time
 * @param updatedAt    time of the last change
 */
public record Principal(String id,
                        String username,
                        String email,
                        String passwordHash,
                        Set<String> roles,
                        boolean active,
                        Instant createdAt,
                        Instant updatedAt) {

  /**
   * Administrator role, required by the principal management operations.
   */
  public static final String ROLE_ADMIN = "admin";
  /**
   * Role granted when registration supplies none.
   */
  public static final String ROLE_USER = "user";
  /**
   * Read-only role.
   */
  public static final String ROLE_GUEST = "guest";

  public Principal {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(passwordHash, "passwordHash");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (roles == null || roles.isEmpty()) {
      throw new IllegalArgumentException("A principal must hold at least one role");
    }
    roles = sorted(roles);
  }

  /**
   * Creates a new active principal with a freshly assigned identifier.
   *
   * @param username     the username
   * @param email        the email
   * @param passwordHash the encoded password hash
   * @param roles        initial roles, must not be empty
   * @param now          creation time
   * @return the principal
   */
  public static Principal create(String username, String email, String passwordHash,
                                 Collection<String> roles, Instant now) {
    return new Principal(UUID.randomUUID().toString(), username, email, passwordHash,
        new TreeSet<>(roles), true, now, now);
  }

  /**
   * Has role.
   *
   * @param role the role
   * @return true if held
   */
  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  /**
   * Is admin boolean.
   *
   * @return the boolean
   */
  public boolean isAdmin() {
    return hasRole(ROLE_ADMIN);
  }

  /**
   * Returns a copy holding the additional role. Granting a held role changes nothing but the
   * timestamp.
   *
   * @param role the role
   * @param now  the change time
   * @return the principal
   */
  public Principal grantRole(String role, Instant now) {
    SortedSet<String> updated = new TreeSet<>(roles);
    updated.add(role);
    return new Principal(id, username, email, passwordHash, updated, active, createdAt, now);
  }

  /**
   * Returns a copy without the role.
   *
   * @param role the role
   * @param now  the change time
   * @return the principal
   * @throws IllegalStateException if the role is the only one held
   */
  public Principal revokeRole(String role, Instant now) {
    SortedSet<String> updated = new TreeSet<>(roles);
    updated.remove(role);
    if (updated.isEmpty()) {
      throw new IllegalStateException("Cannot revoke the last role of a principal");
    }
    return new Principal(id, username, email, passwordHash, updated, active, createdAt, now);
  }

  public Principal activate(Instant now) {
    return new Principal(id, username, email, passwordHash, roles, true, createdAt, now);
  }

  public Principal deactivate(Instant now) {
    return new Principal(id, username, email, passwordHash, roles, false, createdAt, now);
  }

  // Keep the hash out of logs.
  @Override
  public String toString() {
    return "Principal[id=" + id + ", username=" + username + ", roles=" + roles
        + ", active=" + active + "]";
  }

  private static Set<String> sorted(Set<String> roles) {
    return Collections.unmodifiableSortedSet(new TreeSet<>(roles));
  }
}
