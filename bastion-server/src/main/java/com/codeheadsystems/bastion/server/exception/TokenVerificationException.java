package com.codeheadsystems.bastion.server.exception;

/**
 * A token verified but cannot be used for the requested operation, e.g. a refresh with an access token or for a principal that no longer exists.
 */
public class TokenVerificationException extends BastionException {

  public TokenVerificationException(String message) {
    super(message);
  }
}
