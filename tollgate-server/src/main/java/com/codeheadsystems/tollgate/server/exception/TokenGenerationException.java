package com.codeheadsystems.tollgate.server.exception;

/**
 * The secure random source could not produce a token key.
 */
public class TokenGenerationException extends RuntimeException {

  /**
   * Instantiates a new token generation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TokenGenerationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
