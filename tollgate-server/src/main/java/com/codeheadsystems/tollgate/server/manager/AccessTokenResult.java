package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.server.exception.TokenException;
import java.util.Optional;

/**
 * Outcome of {@link AccessTokenOperations#decodeAccessToken(String)}.
 *
 * @param valid  true if the token was accepted
 * @param claims the token's claims when valid
 * @param error  the reason for refusal when not valid
 */
public record AccessTokenResult(boolean valid, Optional<TokenClaims> claims,
                                Optional<TokenException> error) {

  static AccessTokenResult valid(TokenClaims claims) {
    return new AccessTokenResult(true, Optional.of(claims), Optional.empty());
  }

  static AccessTokenResult invalid(TokenException error) {
    return new AccessTokenResult(false, Optional.empty(), Optional.of(error));
  }
}
