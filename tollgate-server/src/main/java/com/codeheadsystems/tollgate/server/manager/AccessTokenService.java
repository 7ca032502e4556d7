package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.auth.ClaimsSigner;
import com.codeheadsystems.tollgate.server.exception.TokenException;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AccessTokenOperations} backed by a {@link ClaimsSigner}.
 */
public class AccessTokenService implements AccessTokenOperations {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);

  private final ClaimsSigner signer;
  private final Clock clock;

  /**
   * Creates the service.
   *
   * @param signer signs and verifies access tokens
   * @param clock  source of the claims' creation time
   */
  public AccessTokenService(ClaimsSigner signer, Clock clock) {
    this.signer = signer;
    this.clock = clock;
  }

  @Override
  public String generateAccessToken(String subject, Duration ttl) {
    return signer.sign(TokenClaims.newClaims(subject, TokenType.ACCESS_TOKEN, clock), ttl);
  }

  @Override
  public AccessTokenResult decodeAccessToken(String token) {
    try {
      return AccessTokenResult.valid(verifyAccessToken(token));
    } catch (TokenException e) {
      log.debug("Access token refused: {}", e.getMessage());
      return AccessTokenResult.invalid(e);
    }
  }

  @Override
  public TokenClaims verifyAccessToken(String token) {
    return signer.verify(token, TokenType.ACCESS_TOKEN);
  }
}
