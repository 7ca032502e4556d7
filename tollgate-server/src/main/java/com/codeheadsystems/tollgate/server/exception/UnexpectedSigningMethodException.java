package com.codeheadsystems.tollgate.server.exception;

/**
 * The token header names a signing algorithm other than the configured one.
 * <p>
 * Raised before any signature check is attempted. Operators should treat this as an attack
 * signal (for example a forged {@code alg: none} token).
 */
public class UnexpectedSigningMethodException extends TokenException {

  private final String algorithm;

  /**
   * Instantiates a new unexpected signing method exception.
   *
   * @param algorithm the algorithm named in the token header, may be null
   */
  public UnexpectedSigningMethodException(final String algorithm) {
    super("unexpected token signing method");
    this.algorithm = algorithm;
  }

  public String getAlgorithm() {
    return algorithm;
  }
}
