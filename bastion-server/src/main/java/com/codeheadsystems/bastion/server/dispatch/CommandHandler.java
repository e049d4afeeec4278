package com.codeheadsystems.bastion.server.dispatch;

/**
 * Produces the result for one command type.
 *
 * @param <C> the command
 * @param <R> the result
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<R>, R> {

  R handle(C command);
}
