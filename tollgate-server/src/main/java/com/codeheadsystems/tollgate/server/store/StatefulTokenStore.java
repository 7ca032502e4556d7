package com.codeheadsystems.tollgate.server.store;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.server.auth.ClaimsSigner;
import com.codeheadsystems.tollgate.server.context.OperationContext;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.codeheadsystems.tollgate.server.exception.TokenNotFoundException;
import com.codeheadsystems.tollgate.server.random.SecureTokenGenerator;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the claims of stateful tokens in a {@link KeyValueStore} under random keys.
 * <p>
 * Every method is one store round trip awaited through the caller's {@link OperationContext}.
 * Nothing is cached and nothing is retried; store failures reach the caller unchanged.
 */
public class StatefulTokenStore {

  private static final Logger log = LoggerFactory.getLogger(StatefulTokenStore.class);

  private final KeyValueStore keyValueStore;
  private final SecureTokenGenerator generator;
  private final ClaimsSigner signer;
  private final StoredTokenCodec codec;

  /**
   * Creates the store bridge.
   *
   * @param keyValueStore the external store
   * @param generator     source of new keys
   * @param signer        signs the claims kept under each key
   * @param codec         writes and reads the stored record
   */
  public StatefulTokenStore(KeyValueStore keyValueStore,
                            SecureTokenGenerator generator,
                            ClaimsSigner signer,
                            StoredTokenCodec codec) {
    this.keyValueStore = keyValueStore;
    this.generator = generator;
    this.signer = signer;
    this.codec = codec;
  }

  /**
   * Stores claims under a fresh random key.
   *
   * @param claims  the claims
   * @param ttl     how long the key stays valid
   * @param context the caller's deadline and cancellation
   * @return the new key
   */
  public String put(TokenClaims claims, Duration ttl, OperationContext context) {
    String key = generator.generate();
    String value = codec.encode(StoredToken.of(signer.sign(claims, ttl)));
    context.await(keyValueStore.set(key, value, ttl), "set");
    log.debug("Stored {} token (ttl={})", claims.tokenType(), ttl);
    return key;
  }

  /**
   * Whether the key is currently in the store.
   *
   * @param key     the token key
   * @param context the caller's deadline and cancellation
   * @return false if the key was never stored, has expired or was deleted
   */
  public boolean exists(String key, OperationContext context) {
    return context.await(keyValueStore.get(key), "get").isPresent();
  }

  /**
   * Reads the record under the key.
   *
   * @param key     the token key
   * @param context the caller's deadline and cancellation
   * @return the record
   * @throws TokenNotFoundException if the key is not in the store
   * @throws InvalidTokenException  if a value is present but is not a readable record
   */
  public StoredToken load(String key, OperationContext context) {
    Optional<String> value = context.await(keyValueStore.get(key), "get");
    return codec.decode(value.orElseThrow(TokenNotFoundException::new));
  }

  /**
   * Removes the key and returns the record that was under it, atomically. A concurrent
   * {@code take} of the same key finds nothing.
   *
   * @param key     the token key
   * @param context the caller's deadline and cancellation
   * @return the record
   * @throws TokenNotFoundException if the key is not in the store
   * @throws InvalidTokenException  if a value was removed but is not a readable record
   */
  public StoredToken take(String key, OperationContext context) {
    Optional<String> value = context.await(keyValueStore.getAndDelete(key), "getAndDelete");
    StoredToken storedToken = codec.decode(value.orElseThrow(TokenNotFoundException::new));
    log.debug("Took token key");
    return storedToken;
  }

  /**
   * Deletes the key. Deleting an absent key succeeds.
   *
   * @param key     the token key
   * @param context the caller's deadline and cancellation
   */
  public void delete(String key, OperationContext context) {
    context.await(keyValueStore.delete(key), "delete");
    log.debug("Deleted token key");
  }
}
