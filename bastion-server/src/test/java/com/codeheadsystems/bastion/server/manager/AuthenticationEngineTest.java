package com.codeheadsystems.bastion.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.bastion.server.MutableClock;
import com.codeheadsystems.bastion.server.crypto.PasswordHasher;
import com.codeheadsystems.bastion.server.exception.AccessDeniedException;
import com.codeheadsystems.bastion.server.exception.AccountInactiveException;
import com.codeheadsystems.bastion.server.exception.AuthenticationFailedException;
import com.codeheadsystems.bastion.server.exception.DuplicateAddressException;
import com.codeheadsystems.bastion.server.exception.DuplicateHandleException;
import com.codeheadsystems.bastion.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.bastion.server.exception.StoreUnavailableException;
import com.codeheadsystems.bastion.server.exception.TokenExpiredException;
import com.codeheadsystems.bastion.server.exception.TokenVerificationException;
import com.codeheadsystems.bastion.server.exception.ValidationFailedException;
import com.codeheadsystems.bastion.server.key.KeyManager;
import com.codeheadsystems.bastion.server.model.Principal;
import com.codeheadsystems.bastion.server.store.CredentialStore;
import com.codeheadsystems.bastion.server.store.InMemoryCredentialStore;
import com.codeheadsystems.bastion.server.token.TokenClaims;
import com.codeheadsystems.bastion.server.token.TokenCodec;
import com.codeheadsystems.bastion.server.token.TokenKind;
import com.codeheadsystems.bastion.server.token.TokenPair;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuthenticationEngineTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  @TempDir
  static Path keysDir;

  private static KeyManager keyManager;
  private static PasswordHasher hasher;

  private MutableClock clock;
  private InMemoryCredentialStore store;
  private TokenCodec codec;
  private AuthenticationEngine engine;

  @BeforeAll
  static void generateKeys() {
    keyManager = new KeyManager(keysDir);
    keyManager.ensureKeys();
    hasher = new PasswordHasher(1024, 1, 1);
  }

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryCredentialStore();
    codec = new TokenCodec(keyManager, "test-issuer", clock);
    engine = new AuthenticationEngine(store, hasher, codec, clock);
  }

  @Test
  void aliceScenario_registerLoginRefreshDeactivate() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    assertThat(alice.roles()).containsExactly(Principal.ROLE_USER);
    assertThat(alice.active()).isTrue();

    assertThatThrownBy(() -> engine.register("alice", "other@x.com", "secret1", null))
        .isInstanceOf(DuplicateHandleException.class);

    TokenPair pair = engine.issueTokenPair(engine.login("alice", "secret1"));
    TokenClaims original = codec.verify(pair.accessToken());
    assertThat(pair.expiresInSeconds()).isEqualTo(1800);

    clock.advance(Duration.ofMinutes(5));
    TokenPair refreshed = engine.refresh(pair.refreshToken());
    TokenClaims renewed = codec.verify(refreshed.accessToken());
    assertThat(refreshed.refreshToken()).isEqualTo(pair.refreshToken());
    assertThat(renewed.subject()).isEqualTo(original.subject());
    assertThat(renewed.issuedAt()).isAfter(original.issuedAt());
    assertThat(renewed.expiresAt()).isAfter(original.expiresAt());

    assertThatThrownBy(() -> engine.login("alice", "wrong"))
        .isInstanceOf(AuthenticationFailedException.class)
        .hasMessage("Invalid username or password");

    store.update(store.findById(alice.id()).orElseThrow().deactivate(clock.instant()));
    assertThatThrownBy(() -> engine.login("alice", "secret1"))
        .isInstanceOf(AccountInactiveException.class);
  }

  @Test
  void login_unknownUser_failsWithSameMessageAsWrongPassword() {
    engine.register("alice", "alice@x.com", "secret1", null);

    Throwable unknown = catchThrowable(() -> engine.login("nobody", "secret1"));
    Throwable wrong = catchThrowable(() -> engine.login("alice", "wrong1"));

    assertThat(unknown).isInstanceOf(AuthenticationFailedException.class);
    assertThat(wrong).isInstanceOf(AuthenticationFailedException.class);
    assertThat(unknown.getMessage()).isEqualTo(wrong.getMessage());
  }

  @Test
  void login_inactiveCheckedBeforePassword() {
    Principal bob = engine.register("bob", "bob@x.com", "secret1", null);
    store.update(bob.deactivate(clock.instant()));

    assertThatThrownBy(() -> engine.login("bob", "not-the-password"))
        .isInstanceOf(AccountInactiveException.class);
  }

  @Test
  void register_reportsEveryViolation() {
    assertThatThrownBy(() -> engine.register("al", "not-an-email", "12345", List.of("root")))
        .isInstanceOfSatisfying(ValidationFailedException.class, e ->
            assertThat(e.getViolations()).containsExactly(
                "Username must be at least 3 characters long",
                "Email must be a valid address",
                "Password must be at least 6 characters long",
                "Unknown role: root"));
  }

  @Test
  void register_duplicateEmail_throwsDuplicateAddress() {
    engine.register("alice", "alice@x.com", "secret1", null);

    assertThatThrownBy(() -> engine.register("alice2", "alice@x.com", "secret1", null))
        .isInstanceOf(DuplicateAddressException.class);
  }

  @Test
  void register_suppliedRoles_areKept() {
    Principal carol = engine.register("carol", "carol@x.com", "secret1", List.of("guest", "user"));

    assertThat(carol.roles()).containsExactly("guest", "user");
  }

  @Test
  void register_storesHashNotPassword() {
    Principal dave = engine.register("dave", "dave@x.com", "secret1", null);

    assertThat(dave.passwordHash()).doesNotContain("secret1").startsWith("$argon2id$");
  }

  @Test
  void refresh_withAccessToken_failsBeforeAnyLookup() {
    CredentialStore mockStore = mock(CredentialStore.class);
    AuthenticationEngine isolated = new AuthenticationEngine(mockStore, hasher, codec, clock);
    Principal alice = Principal.create("alice", "alice@x.com", "hash", List.of("user"), START);
    String access = codec.mintAccess(alice);

    assertThatThrownBy(() -> isolated.refresh(access))
        .isInstanceOf(TokenVerificationException.class);
    verify(mockStore, never()).findById(anyString());
  }

  @Test
  void refresh_usesCurrentRoles() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    TokenPair pair = engine.issueTokenPair(engine.login("alice", "secret1"));
    store.update(alice.grantRole(Principal.ROLE_ADMIN, clock.instant()));

    TokenPair refreshed = engine.refresh(pair.refreshToken());

    assertThat(codec.verify(pair.accessToken()).roles()).containsExactly("user");
    assertThat(codec.verify(refreshed.accessToken()).roles()).containsExactlyInAnyOrder("admin", "user");
  }

  @Test
  void refresh_deletedPrincipal_throwsVerification() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    TokenPair pair = engine.issueTokenPair(alice);
    store.delete(alice.id());

    assertThatThrownBy(() -> engine.refresh(pair.refreshToken()))
        .isInstanceOf(TokenVerificationException.class);
  }

  @Test
  void refresh_inactivePrincipal_throwsInactive() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    TokenPair pair = engine.issueTokenPair(alice);
    store.update(alice.deactivate(clock.instant()));

    assertThatThrownBy(() -> engine.refresh(pair.refreshToken()))
        .isInstanceOf(AccountInactiveException.class);
  }

  @Test
  void refresh_expiredRefreshToken_throwsExpired() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    TokenPair pair = engine.issueTokenPair(alice);
    clock.advance(Duration.ofDays(8));

    assertThatThrownBy(() -> engine.refresh(pair.refreshToken()))
        .isInstanceOf(TokenExpiredException.class);
  }

  @Test
  void introspect_reportsActiveAndInactive() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    TokenPair pair = engine.issueTokenPair(alice);

    assertThat(engine.introspect(pair.accessToken()))
        .hasValueSatisfying(claims -> assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS));
    assertThat(engine.introspect("garbage")).isEmpty();

    clock.advance(Duration.ofHours(1));
    assertThat(engine.introspect(pair.accessToken())).isEmpty();
  }

  @Test
  void currentPrincipal_rejectsRefreshToken() {
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);
    TokenPair pair = engine.issueTokenPair(alice);

    assertThat(engine.currentPrincipal(pair.accessToken()).id()).isEqualTo(alice.id());
    assertThatThrownBy(() -> engine.currentPrincipal(pair.refreshToken()))
        .isInstanceOf(TokenVerificationException.class);
  }

  @Test
  void adminOperations_requireAdmin() {
    Principal admin = engine.register("admin", "admin@x.com", "secret1", List.of("admin"));
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);

    assertThatThrownBy(() -> engine.listPrincipals(alice)).isInstanceOf(AccessDeniedException.class);
    assertThatThrownBy(() -> engine.setActive(alice, admin.id(), false))
        .isInstanceOf(AccessDeniedException.class);

    assertThat(engine.listPrincipals(admin)).hasSize(2);
    Principal deactivated = engine.setActive(admin, alice.id(), false);
    assertThat(deactivated.active()).isFalse();
    assertThat(engine.setActive(admin, alice.id(), true).active()).isTrue();
  }

  @Test
  void grantAndRevokeRole() {
    Principal admin = engine.register("admin", "admin@x.com", "secret1", List.of("admin"));
    Principal alice = engine.register("alice", "alice@x.com", "secret1", null);

    assertThat(engine.grantRole(admin, alice.id(), "guest").roles()).containsExactly("guest", "user");
    assertThat(engine.revokeRole(admin, alice.id(), "user").roles()).containsExactly("guest");
    assertThatThrownBy(() -> engine.revokeRole(admin, alice.id(), "guest"))
        .isInstanceOf(ValidationFailedException.class);
    assertThatThrownBy(() -> engine.grantRole(admin, alice.id(), "superuser"))
        .isInstanceOf(ValidationFailedException.class);
    assertThatThrownBy(() -> engine.grantRole(admin, "missing-id", "guest"))
        .isInstanceOf(PrincipalNotFoundException.class);
  }

  @Test
  void storeFailure_propagatesWithoutRetry() {
    CredentialStore mockStore = mock(CredentialStore.class);
    when(mockStore.findByUsername("alice")).thenThrow(new StoreUnavailableException("down"));
    AuthenticationEngine isolated = new AuthenticationEngine(mockStore, hasher, codec, clock);

    assertThatThrownBy(() -> isolated.login("alice", "secret1"))
        .isInstanceOf(StoreUnavailableException.class);
    verify(mockStore).findByUsername("alice");
  }
}
