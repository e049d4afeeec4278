package com.codeheadsystems.bastion.server.exception;

/**
 * The authenticated principal lacks the role an operation requires.
 */
public class AccessDeniedException extends BastionException {

  public AccessDeniedException(String message) {
    super(message);
  }
}
