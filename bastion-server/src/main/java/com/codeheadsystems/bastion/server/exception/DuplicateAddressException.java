package com.codeheadsystems.bastion.server.exception;

/**
 * Registration rejected because the email address is already registered.
 */
public class DuplicateAddressException extends BastionException {

  public DuplicateAddressException(String message) {
    super(message);
  }
}
