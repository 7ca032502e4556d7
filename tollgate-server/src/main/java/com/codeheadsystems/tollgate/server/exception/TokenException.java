package com.codeheadsystems.tollgate.server.exception;

/**
 * Base type for every way a presented token can be refused.
 * <p>
 * Callers that only need an allow/deny answer can catch this type; callers that alert on
 * tampering can catch {@link UnexpectedSigningMethodException} separately.
 */
public abstract class TokenException extends RuntimeException {

  /**
   * Instantiates a new token exception.
   *
   * @param message the message
   */
  protected TokenException(final String message) {
    super(message);
  }
}
