package com.codeheadsystems.bastion.server.dispatch;

/**
 * An immutable per-request input routed by {@link RequestDispatcher}.
 *
 * @param <R> the result type its handler produces
 */
public interface Command<R> {

  /**
   * The routing tag.
   *
   * @return the command type
   */
  CommandType type();
}
