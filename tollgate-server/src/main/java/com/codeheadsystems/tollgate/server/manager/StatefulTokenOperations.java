package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.context.OperationContext;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenTypeException;
import java.time.Duration;

/**
 * Stateful tokens: random keys whose claims live in the key-value store until they expire or
 * are destroyed.
 * <p>
 * Intended for {@link TokenType#RESET_PASSWORD}, {@link TokenType#VERIFY_EMAIL} and
 * {@link TokenType#REFRESH_TOKEN}. Never use these methods for access tokens; they have their
 * own stateless path in {@link AccessTokenOperations}.
 * <p>
 * Each method has an overload without an {@link OperationContext} that waits on the store
 * without a deadline.
 */
public interface StatefulTokenOperations {

  /**
   * Stores the claims under a new random key.
   *
   * @param tokenType the type being issued, must match {@code claims}
   * @param claims    the claims
   * @param ttl       how long the key stays valid
   * @param context   the caller's deadline and cancellation
   * @return the token key
   * @throws IllegalArgumentException for {@link TokenType#ACCESS_TOKEN} or mismatched claims
   */
  String generateToken(TokenType tokenType, TokenClaims claims, Duration ttl,
                       OperationContext context);

  default String generateToken(TokenType tokenType, TokenClaims claims, Duration ttl) {
    return generateToken(tokenType, claims, ttl, OperationContext.background());
  }

  /**
   * Builds fresh claims for the subject and stores them under a new random key.
   *
   * @param tokenType the type being issued
   * @param subject   the subject identifier
   * @param ttl       how long the key stays valid
   * @param context   the caller's deadline and cancellation
   * @return the token key
   */
  default String generateToken(TokenType tokenType, String subject, Duration ttl,
                               OperationContext context) {
    return generateToken(tokenType, TokenClaims.newClaims(subject, tokenType), ttl, context);
  }

  default String generateToken(TokenType tokenType, String subject, Duration ttl) {
    return generateToken(tokenType, subject, ttl, OperationContext.background());
  }

  /**
   * Looks up a key and returns its claims.
   *
   * @param key          the token key
   * @param expectedType the type the caller requires
   * @param context      the caller's deadline and cancellation
   * @return the claims
   * @throws InvalidTokenException     if the key was never issued, has expired or was destroyed
   * @throws InvalidTokenTypeException if the key was issued for another type
   */
  TokenClaims decodeToken(String key, TokenType expectedType, OperationContext context);

  default TokenClaims decodeToken(String key, TokenType expectedType) {
    return decodeToken(key, expectedType, OperationContext.background());
  }

  /**
   * Revokes a key immediately. Destroying an unknown key succeeds.
   *
   * @param key     the token key
   * @param context the caller's deadline and cancellation
   */
  void destroyToken(String key, OperationContext context);

  default void destroyToken(String key) {
    destroyToken(key, OperationContext.background());
  }

  /**
   * Whether the key is still in the store, without decoding it.
   *
   * @param key     the token key
   * @param context the caller's deadline and cancellation
   * @return true if the key exists
   */
  boolean isTokenActive(String key, OperationContext context);

  default boolean isTokenActive(String key) {
    return isTokenActive(key, OperationContext.background());
  }

  /**
   * Claims a single-use token: the key is removed from the store and its claims are returned.
   * Only one of several concurrent callers can succeed. The key is spent once removed, even if
   * its claims then fail verification.
   *
   * @param key          the token key
   * @param expectedType the type the caller requires
   * @param context      the caller's deadline and cancellation
   * @return the claims
   * @throws InvalidTokenException     if the key is not valid
   * @throws InvalidTokenTypeException if the key was issued for another type
   */
  TokenClaims consumeToken(String key, TokenType expectedType, OperationContext context);

  default TokenClaims consumeToken(String key, TokenType expectedType) {
    return consumeToken(key, expectedType, OperationContext.background());
  }
}
