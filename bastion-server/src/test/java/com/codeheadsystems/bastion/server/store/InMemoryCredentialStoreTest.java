package com.codeheadsystems.bastion.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.bastion.server.model.Principal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryCredentialStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private InMemoryCredentialStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryCredentialStore();
  }

  @Test
  void createAndFind_byEveryKey() {
    Principal alice = store.create(principal("alice", "alice@x.com"));

    assertThat(store.findById(alice.id())).contains(alice);
    assertThat(store.findByUsername("alice")).contains(alice);
    assertThat(store.findByEmail("alice@x.com")).contains(alice);
    assertThat(store.existsByUsername("alice")).isTrue();
    assertThat(store.existsByEmail("alice@x.com")).isTrue();
    assertThat(store.findByUsername("bob")).isEmpty();
  }

  @Test
  void create_duplicateUsernameOrEmail_throws() {
    store.create(principal("alice", "alice@x.com"));

    assertThatThrownBy(() -> store.create(principal("alice", "other@x.com")))
        .isInstanceOf(DuplicateHandleException.class);
    assertThatThrownBy(() -> store.create(principal("other", "alice@x.com")))
        .isInstanceOf(DuplicateAddressException.class);
    assertThat(store.listAll()).hasSize(1);
  }

  @Test
  void create_concurrentSameUsername_exactlyOneWins() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        int n = i;
        results.add(pool.submit(() -> {
          start.await();
          try {
            store.create(principal("alice", "alice" + n + "@x.com"));
            return true;
          } catch (DuplicateHandleException e) {
            return false;
          }
        }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
      assertThat(store.listAll()).hasSize(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void update_reindexesChangedEmail() {
    Principal alice = store.create(principal("alice", "alice@x.com"));
    Principal moved = new Principal(alice.id(), "alice", "new@x.com", alice.passwordHash(),
        alice.roles(), true, alice.createdAt(), NOW.plusSeconds(1));

    store.update(moved);

    assertThat(store.findByEmail("alice@x.com")).isEmpty();
    assertThat(store.findByEmail("new@x.com")).contains(moved);
  }

  @Test
  void update_unknownOrConflicting_throws() {
    Principal alice = store.create(principal("alice", "alice@x.com"));
    store.create(principal("bob", "bob@x.com"));
    Principal stealsEmail = new Principal(alice.id(), "alice", "bob@x.com", alice.passwordHash(),
        alice.roles(), true, alice.createdAt(), NOW);

    assertThatThrownBy(() -> store.update(principal("ghost", "ghost@x.com")))
        .isInstanceOf(PrincipalNotFoundException.class);
    assertThatThrownBy(() -> store.update(stealsEmail))
        .isInstanceOf(DuplicateAddressException.class);
  }

  @Test
  void delete_removesAllIndexes() {
    Principal alice = store.create(principal("alice", "alice@x.com"));

    assertThat(store.delete(alice.id())).isTrue();
    assertThat(store.delete(alice.id())).isFalse();
    assertThat(store.findByUsername("alice")).isEmpty();
    assertThat(store.existsByEmail("alice@x.com")).isFalse();
  }

  private static Principal principal(String username, String email) {
    return Principal.create(username, email, "hash", List.of(Principal.ROLE_USER), NOW);
  }
}
