package com.codeheadsystems.bastion.server.exception;

/**
 * The signing key pair could not be generated, written, read or parsed. Fatal at startup.
 */
public class KeyStorageException extends RuntimeException {

  public KeyStorageException(String message) {
    super(message);
  }

  public KeyStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
