package com.codeheadsystems.bastion.server.exception;

/**
 * Registration rejected because the username is already taken.
 */
public class DuplicateHandleException extends BastionException {

  public DuplicateHandleException(String message) {
    super(message);
  }
}
