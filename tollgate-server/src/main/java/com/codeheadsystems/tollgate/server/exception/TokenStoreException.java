package com.codeheadsystems.tollgate.server.exception;

/**
 * The key-value store call failed. Never retried by this library.
 */
public class TokenStoreException extends RuntimeException {

  /**
   * Instantiates a new token store exception.
   *
   * @param message the message
   */
  public TokenStoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new token store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TokenStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
