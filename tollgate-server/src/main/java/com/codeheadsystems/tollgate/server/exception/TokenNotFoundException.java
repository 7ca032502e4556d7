package com.codeheadsystems.tollgate.server.exception;

/**
 * The store holds no value for a key. Used between the store bridge and the lifecycle
 * services, and reported to callers as {@link InvalidTokenException}.
 */
public class TokenNotFoundException extends TokenException {

  /**
   * Instantiates a new token not found exception.
   */
  public TokenNotFoundException() {
    super("not found");
  }
}
