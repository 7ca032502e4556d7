package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.auth.ClaimsSigner;
import com.codeheadsystems.tollgate.server.context.OperationContext;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.codeheadsystems.tollgate.server.exception.TokenNotFoundException;
import com.codeheadsystems.tollgate.server.store.StatefulTokenStore;
import com.codeheadsystems.tollgate.server.store.StoredToken;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StatefulTokenOperations} backed by a {@link StatefulTokenStore}.
 * <p>
 * A key is accepted only while it is in the store and its stored claims verify; expired and
 * destroyed keys look the same to the caller.
 */
public class StatefulTokenService implements StatefulTokenOperations {

  private static final Logger log = LoggerFactory.getLogger(StatefulTokenService.class);

  private final StatefulTokenStore tokenStore;
  private final ClaimsSigner signer;

  /**
   * Creates the service.
   *
   * @param tokenStore where token records are kept
   * @param signer     verifies the claims read back from the store
   */
  public StatefulTokenService(StatefulTokenStore tokenStore, ClaimsSigner signer) {
    this.tokenStore = tokenStore;
    this.signer = signer;
  }

  @Override
  public String generateToken(TokenType tokenType, TokenClaims claims, Duration ttl,
                              OperationContext context) {
    if (tokenType.stateless()) {
      throw new IllegalArgumentException(tokenType + " tokens are not stored; use generateAccessToken");
    }
    if (claims.tokenType() != tokenType) {
      throw new IllegalArgumentException(
          "Claims of type " + claims.tokenType() + " cannot be issued as " + tokenType);
    }
    return tokenStore.put(claims, ttl, context);
  }

  @Override
  public TokenClaims decodeToken(String key, TokenType expectedType, OperationContext context) {
    if (key == null || key.isBlank()) {
      throw new InvalidTokenException();
    }
    StoredToken storedToken;
    try {
      storedToken = tokenStore.load(key, context);
    } catch (TokenNotFoundException e) {
      log.debug("{} token key not found (expired, destroyed or never issued)", expectedType);
      throw new InvalidTokenException();
    }
    return signer.verify(storedToken.signedClaims(), expectedType);
  }

  @Override
  public TokenClaims consumeToken(String key, TokenType expectedType, OperationContext context) {
    if (key == null || key.isBlank()) {
      throw new InvalidTokenException();
    }
    StoredToken storedToken;
    try {
      storedToken = tokenStore.take(key, context);
    } catch (TokenNotFoundException e) {
      log.debug("{} token key not found or already consumed", expectedType);
      throw new InvalidTokenException();
    }
    return signer.verify(storedToken.signedClaims(), expectedType);
  }

  @Override
  public void destroyToken(String key, OperationContext context) {
    if (key == null || key.isBlank()) {
      return;
    }
    tokenStore.delete(key, context);
  }

  @Override
  public boolean isTokenActive(String key, OperationContext context) {
    if (key == null || key.isBlank()) {
      return false;
    }
    return tokenStore.exists(key, context);
  }
}
