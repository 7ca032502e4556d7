package com.codeheadsystems.tollgate.server.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The external key-value store that holds stateful tokens.
 * <p>
 * Calls are asynchronous so that the caller's deadline can abandon them. Implementations should
 * abort the underlying network call when a returned future is cancelled. Single-key operations
 * must be atomic; nothing else is assumed. Implementations must be thread-safe.
 */
public interface KeyValueStore {

  /**
   * Stores {@code value} under {@code key}, replacing any previous value, expiring after
   * {@code ttl}.
   *
   * @param key   the key
   * @param value the value
   * @param ttl   time to live, positive
   * @return completes when the store acknowledged the write
   */
  CompletableFuture<Void> set(String key, String value, Duration ttl);

  /**
   * Reads the value under {@code key}.
   *
   * @param key the key
   * @return the value, or empty if the key does not exist or has expired
   */
  CompletableFuture<Optional<String>> get(String key);

  /**
   * Reads and removes {@code key} in one atomic step. Of any number of concurrent callers for
   * the same key, at most one receives the value.
   *
   * @param key the key
   * @return the value that was removed, or empty if the key does not exist or has expired
   */
  CompletableFuture<Optional<String>> getAndDelete(String key);

  /**
   * Removes {@code key}. Removing a key that does not exist succeeds.
   *
   * @param key the key
   * @return completes when the store acknowledged the delete
   */
  CompletableFuture<Void> delete(String key);
}
