package com.codeheadsystems.tollgate.server.random;

import com.codeheadsystems.tollgate.server.exception.TokenGenerationException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Produces the opaque random keys that identify stateful tokens.
 * <p>
 * Keys are {@value #DEFAULT_BYTE_LENGTH} bytes from a {@link SecureRandom}, encoded as unpadded
 * base64url so they are safe in URLs and store keys.
 */
public class SecureTokenGenerator {

  /**
   * Number of random bytes in a token key.
   */
  public static final int DEFAULT_BYTE_LENGTH = 32;

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final SecureRandom random;
  private final int byteLength;

  /**
   * Creates a generator over a default {@link SecureRandom}.
   */
  public SecureTokenGenerator() {
    this(new SecureRandom(), DEFAULT_BYTE_LENGTH);
  }

  /**
   * Creates a generator.
   *
   * @param random     the random source
   * @param byteLength random bytes per key, must be positive
   */
  public SecureTokenGenerator(SecureRandom random, int byteLength) {
    if (byteLength <= 0) {
      throw new IllegalArgumentException("byteLength must be positive: " + byteLength);
    }
    this.random = random;
    this.byteLength = byteLength;
  }

  /**
   * Generates a key of the configured length.
   *
   * @return base64url encoded random key
   * @throws TokenGenerationException if the random source fails
   */
  public String generate() {
    return generate(byteLength);
  }

  /**
   * Generates a key of {@code len} random bytes.
   *
   * @param len the number of random bytes
   * @return base64url encoded random key
   * @throws TokenGenerationException if the random source fails
   */
  public String generate(int len) {
    if (len <= 0) {
      throw new IllegalArgumentException("len must be positive: " + len);
    }
    byte[] out = new byte[len];
    try {
      random.nextBytes(out);
    } catch (RuntimeException e) {
      throw new TokenGenerationException("Secure random source unavailable", e);
    }
    return B64URL.encodeToString(out);
  }

  public int byteLength() {
    return byteLength;
  }
}
