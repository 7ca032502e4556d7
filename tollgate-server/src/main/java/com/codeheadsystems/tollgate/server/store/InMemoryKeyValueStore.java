package com.codeheadsystems.tollgate.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link KeyValueStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired entries are lazily evicted on {@link #get}. Every call completes synchronously. All
 * tokens are lost on restart and are not shared between instances. Suitable for development
 * and testing only.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  private record Entry(String value, Instant expiresAt) {
  }

  private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
  private final Clock clock;

  /**
   * Creates a store that expires entries against the system clock.
   */
  public InMemoryKeyValueStore() {
    this(Clock.systemUTC());
  }

  /**
   * Creates a store.
   *
   * @param clock the clock entry expiry is measured against
   */
  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryKeyValueStore. Tokens will NOT survive restarts. "
        + "Replace with a networked KeyValueStore for production.");
  }

  @Override
  public CompletableFuture<Void> set(String key, String value, Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("ttl must be positive"));
    }
    store.put(key, new Entry(value, clock.instant().plus(ttl)));
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Optional<String>> get(String key) {
    Entry entry = store.get(key);
    if (entry == null) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    if (!entry.expiresAt().isAfter(clock.instant())) {
      store.remove(key, entry);
      return CompletableFuture.completedFuture(Optional.empty());
    }
    return CompletableFuture.completedFuture(Optional.of(entry.value()));
  }

  @Override
  public CompletableFuture<Optional<String>> getAndDelete(String key) {
    Entry entry = store.remove(key);
    if (entry == null || !entry.expiresAt().isAfter(clock.instant())) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    return CompletableFuture.completedFuture(Optional.of(entry.value()));
  }

  @Override
  public CompletableFuture<Void> delete(String key) {
    store.remove(key);
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Number of entries held, including expired ones not yet evicted.
   *
   * @return the entry count
   */
  public int size() {
    return store.size();
  }
}
