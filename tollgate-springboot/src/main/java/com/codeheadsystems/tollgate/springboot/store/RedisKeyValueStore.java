package com.codeheadsystems.tollgate.springboot.store;

import com.codeheadsystems.tollgate.server.exception.TokenStoreException;
import com.codeheadsystems.tollgate.server.store.KeyValueStore;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

/**
 * {@link KeyValueStore} over Redis using {@link ReactiveStringRedisTemplate}.
 * <p>
 * Keys are namespaced with a prefix so tokens can share a Redis database with other data.
 * Expiry is Redis' own ({@code SET key value PX ttl}). {@link #getAndDelete} uses {@code GETDEL},
 * which needs Redis 6.2 or later. Cancelling a returned future cancels the
 * reactive subscription and with it the pending command.
 */
public class RedisKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

  private final ReactiveStringRedisTemplate redisTemplate;
  private final String keyPrefix;

  /**
   * Creates the store.
   *
   * @param redisTemplate the reactive template
   * @param keyPrefix     prepended to every key, may be null for none
   */
  public RedisKeyValueStore(ReactiveStringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    log.debug("Redis token store using key prefix '{}'", this.keyPrefix);
  }

  @Override
  public CompletableFuture<Void> set(String key, String value, Duration ttl) {
    return redisTemplate.opsForValue().set(prefixed(key), value, ttl)
        .flatMap(acknowledged -> acknowledged
            ? Mono.<Void>empty()
            : Mono.<Void>error(new TokenStoreException("Redis SET was not acknowledged")))
        .toFuture();
  }

  @Override
  public CompletableFuture<Optional<String>> get(String key) {
    return redisTemplate.opsForValue().get(prefixed(key))
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .toFuture();
  }

  @Override
  public CompletableFuture<Optional<String>> getAndDelete(String key) {
    return redisTemplate.opsForValue().getAndDelete(prefixed(key))
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .toFuture();
  }

  @Override
  public CompletableFuture<Void> delete(String key) {
    return redisTemplate.delete(prefixed(key)).then().toFuture();
  }

  private String prefixed(String key) {
    return keyPrefix + key;
  }
}
