package com.codeheadsystems.bastion.server.exception;

/**
 * The credential store could not be reached. Propagated to the caller without retry.
 */
public class StoreUnavailableException extends BastionException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
