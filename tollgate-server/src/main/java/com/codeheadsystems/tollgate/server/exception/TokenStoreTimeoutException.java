package com.codeheadsystems.tollgate.server.exception;

/**
 * The caller's deadline passed before the store answered. The store call has been cancelled.
 */
public class TokenStoreTimeoutException extends TokenStoreException {

  private final String operation;

  /**
   * Instantiates a new token store timeout exception.
   *
   * @param operation the store operation that was abandoned
   */
  public TokenStoreTimeoutException(final String operation) {
    super("Token store operation timed out: " + operation);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
