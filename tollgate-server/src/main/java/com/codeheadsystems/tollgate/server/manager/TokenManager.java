package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.auth.ClaimsSigner;
import com.codeheadsystems.tollgate.server.auth.JwtClaimsSigner;
import com.codeheadsystems.tollgate.server.config.TokenManagerConfig;
import com.codeheadsystems.tollgate.server.context.OperationContext;
import com.codeheadsystems.tollgate.server.random.SecureTokenGenerator;
import com.codeheadsystems.tollgate.server.store.KeyValueStore;
import com.codeheadsystems.tollgate.server.store.StatefulTokenStore;
import com.codeheadsystems.tollgate.server.store.StoredTokenCodec;
import java.time.Clock;
import java.time.Duration;

/**
 * Framework-agnostic entry point for issuing, validating and revoking tokens.
 * <p>
 * Composes the stateless {@link AccessTokenOperations} and the store-backed
 * {@link StatefulTokenOperations} so that framework adapters only need one collaborator.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to their own responses):
 * <ul>
 *   <li>{@code InvalidTokenException}            - token refused, reason withheld</li>
 *   <li>{@code InvalidTokenTypeException}        - token valid but issued for another purpose</li>
 *   <li>{@code UnexpectedSigningMethodException} - forged algorithm header, worth alerting on</li>
 *   <li>{@code TokenStoreException}              - store failure, timeout or cancellation</li>
 *   <li>{@link IllegalArgumentException}         - caller misuse, e.g. storing an access token</li>
 * </ul>
 */
public class TokenManager implements AccessTokenOperations, StatefulTokenOperations {

  private final AccessTokenOperations accessTokens;
  private final StatefulTokenOperations statefulTokens;

  /**
   * Creates a manager over already wired services. See {@link #create} for the defaults.
   *
   * @param accessTokens   the stateless operations
   * @param statefulTokens the store-backed operations
   */
  public TokenManager(AccessTokenOperations accessTokens, StatefulTokenOperations statefulTokens) {
    this.accessTokens = accessTokens;
    this.statefulTokens = statefulTokens;
  }

  /**
   * Wires a manager with the default JWT signer and a 32-byte key generator.
   *
   * @param config        the signing configuration
   * @param keyValueStore where stateful tokens are kept
   * @return the manager
   */
  public static TokenManager create(TokenManagerConfig config, KeyValueStore keyValueStore) {
    return create(config, keyValueStore, new SecureTokenGenerator(), Clock.systemUTC());
  }

  /**
   * Wires a manager with the default JWT signer.
   *
   * @param config        the signing configuration
   * @param keyValueStore where stateful tokens are kept
   * @param generator     source of token keys
   * @param clock         source of token times
   * @return the manager
   */
  public static TokenManager create(TokenManagerConfig config, KeyValueStore keyValueStore,
                                    SecureTokenGenerator generator, Clock clock) {
    ClaimsSigner signer = new JwtClaimsSigner(config, clock);
    StatefulTokenStore tokenStore =
        new StatefulTokenStore(keyValueStore, generator, signer, new StoredTokenCodec());
    return new TokenManager(
        new AccessTokenService(signer, clock),
        new StatefulTokenService(tokenStore, signer));
  }

  // ── Stateless ─────────────────────────────────────────────────────────────

  @Override
  public String generateAccessToken(String subject, Duration ttl) {
    return accessTokens.generateAccessToken(subject, ttl);
  }

  @Override
  public AccessTokenResult decodeAccessToken(String token) {
    return accessTokens.decodeAccessToken(token);
  }

  @Override
  public TokenClaims verifyAccessToken(String token) {
    return accessTokens.verifyAccessToken(token);
  }

  // ── Stateful ──────────────────────────────────────────────────────────────

  @Override
  public String generateToken(TokenType tokenType, TokenClaims claims, Duration ttl,
                              OperationContext context) {
    return statefulTokens.generateToken(tokenType, claims, ttl, context);
  }

  @Override
  public TokenClaims decodeToken(String key, TokenType expectedType, OperationContext context) {
    return statefulTokens.decodeToken(key, expectedType, context);
  }

  @Override
  public void destroyToken(String key, OperationContext context) {
    statefulTokens.destroyToken(key, context);
  }

  @Override
  public boolean isTokenActive(String key, OperationContext context) {
    return statefulTokens.isTokenActive(key, context);
  }

  @Override
  public TokenClaims consumeToken(String key, TokenType expectedType, OperationContext context) {
    return statefulTokens.consumeToken(key, expectedType, context);
  }
}
