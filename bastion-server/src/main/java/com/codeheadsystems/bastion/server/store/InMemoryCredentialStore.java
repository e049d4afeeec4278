package com.codeheadsystems.bastion.server.store;

import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.bastion.server.model.Principal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Reads are lock-free. Writes are serialized so that the uniqueness check and the insert
 * happen atomically. All principals are lost on server restart; use for development and
 * integration testing only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, Principal> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> idByUsername = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> idByEmail = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore: principals will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public Optional<Principal> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<Principal> findByUsername(String username) {
    return Optional.ofNullable(idByUsername.get(username)).map(byId::get);
  }

  @Override
  public Optional<Principal> findByEmail(String email) {
    return Optional.ofNullable(idByEmail.get(email)).map(byId::get);
  }

  @Override
  public synchronized Principal create(Principal principal) {
    if (idByUsername.containsKey(principal.username())) {
      throw new DuplicateHandleException("Username already registered");
    }
    if (idByEmail.containsKey(principal.email())) {
      throw new DuplicateAddressException("Email already registered");
    }
    byId.put(principal.id(), principal);
    idByUsername.put(principal.username(), principal.id());
    idByEmail.put(principal.email(), principal.id());
    log.debug("Created principal id={}", principal.id());
    return principal;
  }

  @Override
  public synchronized Principal update(Principal principal) {
    Principal existing = byId.get(principal.id());
    if (existing == null) {
      throw new PrincipalNotFoundException("Principal not found");
    }
    String usernameOwner = idByUsername.get(principal.username());
    if (usernameOwner != null && !usernameOwner.equals(principal.id())) {
      throw new DuplicateHandleException("Username already registered");
    }
    String emailOwner = idByEmail.get(principal.email());
    if (emailOwner != null && !emailOwner.equals(principal.id())) {
      throw new DuplicateAddressException("Email already registered");
    }
    idByUsername.remove(existing.username());
    idByEmail.remove(existing.email());
    byId.put(principal.id(), principal);
    idByUsername.put(principal.username(), principal.id());
    idByEmail.put(principal.email(), principal.id());
    log.debug("Updated principal id={}", principal.id());
    return principal;
  }

  @Override
  public synchronized boolean delete(String id) {
    Principal removed = byId.remove(id);
    if (removed == null) {
      return false;
    }
    idByUsername.remove(removed.username());
    idByEmail.remove(removed.email());
    log.debug("Deleted principal id={}", id);
    return true;
  }

  @Override
  public List<Principal> listAll() {
    return List.copyOf(byId.values());
  }
}
