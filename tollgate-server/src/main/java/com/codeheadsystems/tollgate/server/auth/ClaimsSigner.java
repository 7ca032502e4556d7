package com.codeheadsystems.tollgate.server.auth;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenTypeException;
import com.codeheadsystems.tollgate.server.exception.UnexpectedSigningMethodException;
import java.time.Duration;

/**
 * Turns claims into a compact signed string and back.
 * <p>
 * Implementations sign with exactly one algorithm and refuse tokens that name any other.
 */
public interface ClaimsSigner {

  /**
   * Signs the claims with an expiry {@code ttl} from now.
   *
   * @param claims the claims to sign
   * @param ttl    time until the token expires, must be positive
   * @return the compact signed token
   */
  String sign(TokenClaims claims, Duration ttl);

  /**
   * Verifies a signed token and returns its claims.
   *
   * @param token        the compact signed token
   * @param expectedType the type the caller requires
   * @return the claims, including issue and expiry times
   * @throws UnexpectedSigningMethodException if the token names a different algorithm
   * @throws InvalidTokenException            if the token is malformed, forged or expired
   * @throws InvalidTokenTypeException        if the token is genuine but of another type
   */
  TokenClaims verify(String token, TokenType expectedType);
}
