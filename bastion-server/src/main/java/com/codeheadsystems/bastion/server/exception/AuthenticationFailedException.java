package com.codeheadsystems.bastion.server.exception;

/**
 * Credential exchange failed: unknown username or wrong password. The message is deliberately the same for both.
 */
public class AuthenticationFailedException extends BastionException {

  public AuthenticationFailedException(String message) {
    super(message);
  }
}
