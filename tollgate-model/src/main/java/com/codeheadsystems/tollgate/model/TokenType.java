package com.codeheadsystems.tollgate.model;

/**
 * The closed set of token kinds the token manager issues.
 * <p>
 * The type is embedded in every token's claims and must match the type the caller expects when
 * the token is decoded. It also selects the lifecycle path: {@link #ACCESS_TOKEN} is a
 * self-contained signed string, every other type is an opaque key whose claims live in the
 * key-value store until they expire or are destroyed.
 */
public enum TokenType {

  /**
   * Single-use password reset link token. Stateful.
   */
  RESET_PASSWORD(false),

  /**
   * Single-use email address verification token. Stateful.
   */
  VERIFY_EMAIL(false),

  /**
   * Short-lived bearer token verified by signature alone.
   */
  ACCESS_TOKEN(true),

  /**
   * Long-lived token used to obtain new access tokens. Stateful so it can be revoked.
   */
  REFRESH_TOKEN(false);

  private final boolean stateless;

  TokenType(boolean stateless) {
    this.stateless = stateless;
  }

  /**
   * Whether tokens of this type are verified without a store lookup.
   *
   * @return true for signature-only tokens
   */
  public boolean stateless() {
    return stateless;
  }

  /**
   * Resolves the claim value written into a token.
   *
   * @param name the enum constant name
   * @return the token type
   * @throws IllegalArgumentException if {@code name} is null or not a known type
   */
  public static TokenType fromClaim(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Token type claim is missing");
    }
    return TokenType.valueOf(name);
  }
}
