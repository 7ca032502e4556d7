package com.codeheadsystems.tollgate.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.Verification;
import com.codeheadsystems.tollgate.model.TokenClaims;
import com.codeheadsystems.tollgate.model.TokenType;
import com.codeheadsystems.tollgate.server.config.TokenManagerConfig;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.codeheadsystems.tollgate.server.exception.InvalidTokenTypeException;
import com.codeheadsystems.tollgate.server.exception.UnexpectedSigningMethodException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClaimsSigner} producing HMAC-SHA512 JWTs.
 * <p>
 * The header algorithm is compared with {@code HS512} before the signature is looked at, so a
 * token claiming {@code none} or any other algorithm never reaches cryptographic verification.
 * Every other failure is reported as {@link InvalidTokenException} without the parser's detail.
 */
public class JwtClaimsSigner implements ClaimsSigner {

  static final String CLAIM_CREATED_AT = "createdAt";
  static final String CLAIM_TOKEN_TYPE = "tokenType";

  private static final Logger log = LoggerFactory.getLogger(JwtClaimsSigner.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Clock clock;

  /**
   * Creates a signer on the system clock.
   *
   * @param config supplies the HMAC secret and optional issuer
   */
  public JwtClaimsSigner(TokenManagerConfig config) {
    this(config, Clock.systemUTC());
  }

  /**
   * Creates a signer.
   *
   * @param config supplies the HMAC secret and optional issuer
   * @param clock  source of iat / exp and of "now" during verification
   */
  public JwtClaimsSigner(TokenManagerConfig config, Clock clock) {
    this.algorithm = Algorithm.HMAC512(config.privateKey());
    this.issuer = config.issuer();
    this.clock = clock;
    Verification verification = JWT.require(algorithm)
        .withClaimPresence(RegisteredClaims.EXPIRES_AT)
        .withClaimPresence(RegisteredClaims.SUBJECT);
    if (issuer != null) {
      verification = verification.withIssuer(issuer);
    }
    this.verifier = ((JWTVerifier.BaseVerification) verification).build(clock);
  }

  @Override
  public String sign(TokenClaims claims, Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    Instant now = clock.instant();
    JWTCreator.Builder builder = JWT.create()
        .withSubject(claims.subject())
        .withClaim(CLAIM_CREATED_AT, claims.createdAt().toEpochMilli())
        .withClaim(CLAIM_TOKEN_TYPE, claims.tokenType().name())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt(now, ttl));
    if (issuer != null) {
      builder.withIssuer(issuer);
    }
    String token = builder.sign(algorithm);
    log.debug("Signed {} token", claims.tokenType());
    return token;
  }

  // exp is written in whole seconds. Rounding up keeps the signed expiry at or after the store TTL.
  static Instant expiresAt(Instant now, Duration ttl) {
    Instant exact = now.plus(ttl);
    Instant seconds = exact.truncatedTo(ChronoUnit.SECONDS);
    return seconds.equals(exact) ? exact : seconds.plusSeconds(1);
  }

  @Override
  public TokenClaims verify(String token, TokenType expectedType) {
    if (token == null || token.isBlank()) {
      throw new InvalidTokenException();
    }
    DecodedJWT decoded;
    try {
      decoded = JWT.decode(token);
    } catch (JWTDecodeException e) {
      log.debug("Token could not be decoded: {}", e.getMessage());
      throw new InvalidTokenException();
    }
    if (!algorithm.getName().equals(decoded.getAlgorithm())) {
      log.debug("Token names signing algorithm {}", decoded.getAlgorithm());
      throw new UnexpectedSigningMethodException(decoded.getAlgorithm());
    }
    try {
      verifier.verify(decoded);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      throw new InvalidTokenException();
    }
    TokenClaims claims = toClaims(decoded);
    if (claims.tokenType() != expectedType) {
      throw new InvalidTokenTypeException(expectedType, claims.tokenType());
    }
    return claims;
  }

  private TokenClaims toClaims(DecodedJWT decoded) {
    Claim createdAt = decoded.getClaim(CLAIM_CREATED_AT);
    Claim tokenType = decoded.getClaim(CLAIM_TOKEN_TYPE);
    try {
      Long createdAtMillis = createdAt.asLong();
      if (createdAtMillis == null) {
        throw new InvalidTokenException();
      }
      return new TokenClaims(
          decoded.getSubject(),
          Instant.ofEpochMilli(createdAtMillis),
          TokenType.fromClaim(tokenType.asString()),
          decoded.getIssuedAtAsInstant(),
          decoded.getExpiresAtAsInstant());
    } catch (IllegalArgumentException | JWTDecodeException e) {
      log.debug("Token claims are incomplete: {}", e.getMessage());
      throw new InvalidTokenException();
    }
  }
}
