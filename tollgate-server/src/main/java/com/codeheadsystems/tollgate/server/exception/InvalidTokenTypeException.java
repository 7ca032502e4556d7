package com.codeheadsystems.tollgate.server.exception;

import com.codeheadsystems.tollgate.model.TokenType;

/**
 * The token is genuine but was issued for a different purpose than the caller asked for.
 */
public class InvalidTokenTypeException extends TokenException {

  private final TokenType expected;
  private final TokenType actual;

  /**
   * Instantiates a new invalid token type exception.
   *
   * @param expected the type the caller asked for
   * @param actual   the type embedded in the token
   */
  public InvalidTokenTypeException(final TokenType expected, final TokenType actual) {
    super("invalid token type");
    this.expected = expected;
    this.actual = actual;
  }

  public TokenType getExpected() {
    return expected;
  }

  public TokenType getActual() {
    return actual;
  }
}
