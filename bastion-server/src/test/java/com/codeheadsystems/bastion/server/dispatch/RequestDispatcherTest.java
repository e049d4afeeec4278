package com.codeheadsystems.bastion.server.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bastion.server.dispatch.command.LoginCommand;
import com.codeheadsystems.bastion.server.dispatch.command.RefreshCommand;
import com.codeheadsystems.bastion.server.exception.UnroutableCommandException;
import com.codeheadsystems.bastion.server.token.TokenPair;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestDispatcherTest {

  private RequestDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = new RequestDispatcher();
  }

  @Test
  void dispatch_routesToRegisteredHandler() {
    dispatcher.register(CommandType.REFRESH, RefreshCommand.class,
        c -> new TokenPair("access-for-" + c.refreshToken(), c.refreshToken(), Duration.ofMinutes(30)));

    TokenPair result = dispatcher.dispatch(new RefreshCommand("r1"));

    assertThat(result.accessToken()).isEqualTo("access-for-r1");
    assertThat(result.refreshToken()).isEqualTo("r1");
  }

  @Test
  void register_lastWriteWins() {
    dispatcher.register(CommandType.REFRESH, RefreshCommand.class,
        c -> new TokenPair("first", c.refreshToken(), Duration.ofSeconds(1)));
    dispatcher.register(CommandType.REFRESH, RefreshCommand.class,
        c -> new TokenPair("second", c.refreshToken(), Duration.ofSeconds(1)));

    assertThat(dispatcher.dispatch(new RefreshCommand("r1")).accessToken()).isEqualTo("second");
  }

  @Test
  void dispatch_unregisteredType_throwsUnroutable() {
    assertThat(dispatcher.isRegistered(CommandType.REFRESH)).isFalse();

    assertThatThrownBy(() -> dispatcher.dispatch(new RefreshCommand("r1")))
        .isInstanceOfSatisfying(UnroutableCommandException.class,
            e -> assertThat(e.getCommandType()).isEqualTo(CommandType.REFRESH));
  }

  @Test
  void dispatch_handlerRegisteredUnderWrongType_throwsUnroutable() {
    // A login handler wired under the refresh tag.
    dispatcher.register(CommandType.REFRESH, LoginCommand.class,
        c -> new TokenPair("access", "refresh", Duration.ofSeconds(1)));

    assertThat(dispatcher.isRegistered(CommandType.REFRESH)).isTrue();
    assertThatThrownBy(() -> dispatcher.dispatch(new RefreshCommand("r1")))
        .isInstanceOfSatisfying(UnroutableCommandException.class,
            e -> assertThat(e.getCommandType()).isEqualTo(CommandType.REFRESH));
  }

  @Test
  void dispatch_handlerFailure_propagatesUnchanged() {
    IllegalStateException failure = new IllegalStateException("boom");
    dispatcher.register(CommandType.REFRESH, RefreshCommand.class, c -> {
      throw failure;
    });

    assertThatThrownBy(() -> dispatcher.dispatch(new RefreshCommand("r1"))).isSameAs(failure);
  }
}
