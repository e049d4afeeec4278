package com.codeheadsystems.bastion.server.exception;

/**
 * No principal exists with the requested identifier.
 */
public class PrincipalNotFoundException extends BastionException {

  public PrincipalNotFoundException(String message) {
    super(message);
  }
}
