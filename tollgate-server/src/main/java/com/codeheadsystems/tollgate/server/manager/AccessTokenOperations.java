package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.server.exception.TokenException;
import java.time.Duration;

/**
 * Stateless access tokens: signed strings checked by signature and expiry only.
 * No store is involved, so revocation before expiry is not possible.
 */
public interface AccessTokenOperations {

  /**
   * Issues an access token.
   *
   * @param subject the subject identifier
   * @param ttl     lifetime of the token
   * @return the signed token
   */
  String generateAccessToken(String subject, Duration ttl);

  /**
   * Checks an access token without throwing for refused tokens.
   *
   * @param token the signed token
   * @return the outcome, carrying the claims or the reason for refusal
   */
  AccessTokenResult decodeAccessToken(String token);

  /**
   * Checks an access token.
   *
   * @param token the signed token
   * @return the token's claims
   * @throws TokenException if the token is refused
   */
  TokenClaims verifyAccessToken(String token);
}
