package com.codeheadsystems.bastion.server.exception;

/**
 * The principal exists but has been deactivated.
 */
public class AccountInactiveException extends BastionException {

  public AccountInactiveException(String message) {
    super(message);
  }
}
