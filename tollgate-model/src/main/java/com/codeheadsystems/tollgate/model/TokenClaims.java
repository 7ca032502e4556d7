package com.codeheadsystems.tollgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * The payload bound to a token.
 * <p>
 * Claims are built fresh for every issuance and never mutated. {@code issuedAt} and
 * {@code expiresAt} are the standard JWT {@code iat} / {@code exp} values: they are null on
 * claims created with {@link #newClaims(String, TokenType)} and are filled in on the claims
 * returned after a token has been verified.
 * <p>
 * {@code createdAt} is kept at millisecond precision so that it survives encoding unchanged.
 *
 * @param subject   opaque identifier of the principal the token was issued for
 * @param createdAt when the claims were built
 * @param tokenType the kind of token, checked against the caller's expectation on decode
 * @param issuedAt  when the token was signed, null until signed
 * @param expiresAt when the token stops being valid, null until signed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenClaims(
    @JsonProperty("subject") String subject,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("tokenType") TokenType tokenType,
    @JsonProperty("issuedAt") Instant issuedAt,
    @JsonProperty("expiresAt") Instant expiresAt) {

  /**
   * Validates the required components.
   */
  public TokenClaims {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(tokenType, "tokenType");
  }

  /**
   * Builds claims for a new token, stamped with the current time.
   *
   * @param subject   the subject identifier, not validated
   * @param tokenType the token type
   * @return new claims
   */
  public static TokenClaims newClaims(String subject, TokenType tokenType) {
    return newClaims(subject, tokenType, Clock.systemUTC());
  }

  /**
   * Builds claims for a new token, stamped with the given clock's time.
   *
   * @param subject   the subject identifier, not validated
   * @param tokenType the token type
   * @param clock     source of {@code createdAt}
   * @return new claims
   */
  public static TokenClaims newClaims(String subject, TokenType tokenType, Clock clock) {
    return new TokenClaims(subject, clock.instant().truncatedTo(ChronoUnit.MILLIS), tokenType,
        null, null);
  }

  /**
   * Returns a copy carrying the validity window of a signed token.
   *
   * @param issuedAt  the iat value
   * @param expiresAt the exp value
   * @return new claims with the same subject, createdAt and type
   */
  public TokenClaims withValidity(Instant issuedAt, Instant expiresAt) {
    return new TokenClaims(subject, createdAt, tokenType, issuedAt, expiresAt);
  }

  /**
   * The iat value, if these claims came from a verified token.
   *
   * @return the issue time
   */
  @JsonIgnore
  public Optional<Instant> issuedAtTime() {
    return Optional.ofNullable(issuedAt);
  }

  /**
   * The exp value, if these claims came from a verified token.
   *
   * @return the expiry time
   */
  @JsonIgnore
  public Optional<Instant> expiresAtTime() {
    return Optional.ofNullable(expiresAt);
  }
}
