package com.codeheadsystems.tollgate.server.exception;

/**
 * The default deny: bad signature, malformed or expired token, or a stateful key that is no
 * longer in the store. The message never says which.
 */
public class InvalidTokenException extends TokenException {

  /**
   * Instantiates a new invalid token exception.
   */
  public InvalidTokenException() {
    super("invalid token");
  }
}
