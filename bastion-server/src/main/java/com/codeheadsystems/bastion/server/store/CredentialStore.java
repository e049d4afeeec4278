package com.codeheadsystems.bastion.server.store;

import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.bastion.server.exception.StoreUnavailableException;
import com.codeheadsystems.bastion.server.model.Principal;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for principal records.
 * <p>
 * Implementations must be thread-safe and must enforce username and email uniqueness
 * atomically on {@link #create}. Typical production implementations back this with a
 * relational database. Any backend failure is reported as a {@link StoreUnavailableException};
 * callers do not retry.
 */
public interface CredentialStore {

  /**
   * Finds a principal by identifier.
   *
   * @param id the principal identifier
   * @return the principal, or empty if none exists
   */
  Optional<Principal> findById(String id);

  /**
   * Finds a principal by username.
   *
   * @param username exact username
   * @return the principal, or empty if none exists
   */
  Optional<Principal> findByUsername(String username);

  /**
   * Finds a principal by email address.
   *
   * @param email exact email address
   * @return the principal, or empty if none exists
   */
  Optional<Principal> findByEmail(String email);

  /**
   * Exists by username.
   *
   * @param username the username
   * @return true if a principal holds the username
   */
  default boolean existsByUsername(String username) {
    return findByUsername(username).isPresent();
  }

  /**
   * Exists by email.
   *
   * @param email the email
   * @return true if a principal holds the email address
   */
  default boolean existsByEmail(String email) {
    return findByEmail(email).isPresent();
  }

  /**
   * Persists a new principal.
   *
   * @param principal the principal
   * @return the stored principal
   * @throws DuplicateHandleException  if the username is taken
   * @throws DuplicateAddressException if the email is taken
   */
  Principal create(Principal principal);

  /**
   * Replaces an existing principal, matched by identifier.
   *
   * @param principal the updated principal
   * @return the stored principal
   * @throws PrincipalNotFoundException if no principal has the identifier
   */
  Principal update(Principal principal);

  /**
   * Removes a principal, if present.
   *
   * @param id the principal identifier
   * @return true if a principal was removed
   */
  boolean delete(String id);

  /**
   * Lists every principal.
   *
   * @return all principals, in no particular order
   */
  List<Principal> listAll();
}
