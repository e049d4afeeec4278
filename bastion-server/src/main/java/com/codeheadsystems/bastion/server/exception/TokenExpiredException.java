package com.codeheadsystems.bastion.server.exception;

/**
 * Token signature is valid but the expiry has passed.
 */
public class TokenExpiredException extends TokenInvalidException {

  public TokenExpiredException(String message, Throwable cause) {
    super(message, cause);
  }
}
