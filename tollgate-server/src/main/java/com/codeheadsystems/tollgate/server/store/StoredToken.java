package com.codeheadsystems.tollgate.server.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The value kept in the key-value store under a stateful token key.
 * <p>
 * Serialized as {@code {"v":1,"jws":"<compact HS512 JWS>"}}. The claims travel as a signed JWT
 * so that a value altered inside the store fails verification.
 *
 * @param version      encoding version, currently {@value #CURRENT_VERSION}
 * @param signedClaims the claims as a compact JWS whose expiry matches the store TTL
 */
public record StoredToken(
    @JsonProperty("v") int version,
    @JsonProperty("jws") String signedClaims) {

  /**
   * The only version this release reads and writes.
   */
  public static final int CURRENT_VERSION = 1;

  /**
   * Wraps signed claims in the current encoding version.
   *
   * @param signedClaims the compact JWS
   * @return the record
   */
  public static StoredToken of(String signedClaims) {
    return new StoredToken(CURRENT_VERSION, signedClaims);
  }
}
