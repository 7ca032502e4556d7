package com.codeheadsystems.tollgate.server.exception;

/**
 * The caller cancelled the operation, or the waiting thread was interrupted, while a store call
 * was in flight. The store call has been cancelled.
 */
public class OperationCancelledException extends TokenStoreException {

  private final String operation;

  /**
   * Instantiates a new operation cancelled exception.
   *
   * @param operation the store operation that was abandoned
   */
  public OperationCancelledException(final String operation) {
    super("Token store operation cancelled: " + operation);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
