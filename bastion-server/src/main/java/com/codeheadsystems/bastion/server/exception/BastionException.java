package com.codeheadsystems.bastion.server.exception;

/**
 * Base type for every failure the identity core reports to its callers. Transport adapters
 * map subclasses onto protocol status codes; see {@code BastionExceptionMapper}.
 */
public abstract class BastionException extends RuntimeException {

  protected BastionException(String message) {
    super(message);
  }

  protected BastionException(String message, Throwable cause) {
    super(message, cause);
  }
}
