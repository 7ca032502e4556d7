package com.codeheadsystems.tollgate.server.store;

import com.codeheadsystems.tollgate.server.exception.InvalidTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link StoredToken} values as JSON.
 */
public class StoredTokenCodec {

  private static final Logger log = LoggerFactory.getLogger(StoredTokenCodec.class);

  private final ObjectMapper objectMapper;

  /**
   * Creates a codec with a default {@link ObjectMapper}.
   */
  public StoredTokenCodec() {
    this(new ObjectMapper());
  }

  /**
   * Creates a codec.
   *
   * @param objectMapper the mapper used for the JSON form
   */
  public StoredTokenCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes a record.
   *
   * @param storedToken the record
   * @return its JSON form
   */
  public String encode(StoredToken storedToken) {
    try {
      return objectMapper.writeValueAsString(storedToken);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode stored token", e);
    }
  }

  /**
   * Decodes a record read from the store.
   *
   * @param value the stored JSON
   * @return the record
   * @throws InvalidTokenException if the value is not a record of a supported version
   */
  public StoredToken decode(String value) {
    StoredToken storedToken;
    try {
      storedToken = objectMapper.readValue(value, StoredToken.class);
    } catch (JsonProcessingException e) {
      log.debug("Stored token value is not readable: {}", e.getOriginalMessage());
      throw new InvalidTokenException();
    }
    if (storedToken == null
        || storedToken.version() != StoredToken.CURRENT_VERSION
        || storedToken.signedClaims() == null) {
      log.debug("Stored token value has unsupported version or no claims");
      throw new InvalidTokenException();
    }
    return storedToken;
  }
}
