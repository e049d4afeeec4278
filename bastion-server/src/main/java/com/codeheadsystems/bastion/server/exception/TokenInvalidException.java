package com.codeheadsystems.bastion.server.exception;

/**
 * Token is malformed, carries a bad signature, or declares an unknown kind.
 */
public class TokenInvalidException extends BastionException {

  public TokenInvalidException(String message) {
    super(message);
  }

  public TokenInvalidException(String message, Throwable cause) {
    super(message, cause);
  }
}
