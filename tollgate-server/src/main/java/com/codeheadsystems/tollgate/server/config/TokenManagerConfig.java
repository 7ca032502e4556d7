package com.codeheadsystems.tollgate.server.config;

import java.util.Optional;

/**
 * Immutable configuration handed to the token manager at construction.
 *
 * @param privateKey HMAC secret used to sign and verify every token
 * @param issuer     optional issuer written to and required from every token; null for none
 */
public record TokenManagerConfig(String privateKey, String issuer) {

  /**
   * Validates the private key and normalises a blank issuer to none.
   */
  public TokenManagerConfig {
    if (privateKey == null || privateKey.isBlank()) {
      throw new IllegalArgumentException("A non-blank private key is required");
    }
    if (issuer != null && issuer.isBlank()) {
      issuer = null;
    }
  }

  /**
   * Configuration with only a private key.
   *
   * @param privateKey the HMAC secret
   * @return the config
   */
  public static TokenManagerConfig of(String privateKey) {
    return new TokenManagerConfig(privateKey, null);
  }

  /**
   * The issuer, if configured.
   *
   * @return the issuer
   */
  public Optional<String> issuerName() {
    return Optional.ofNullable(issuer);
  }

  @Override
  public String toString() {
    return "TokenManagerConfig[privateKey=****, issuer=" + issuer + "]";
  }
}
