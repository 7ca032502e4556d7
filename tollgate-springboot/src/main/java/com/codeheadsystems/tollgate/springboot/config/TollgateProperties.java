package com.codeheadsystems.tollgate.springboot.config;

import com.codeheadsystems.tollgate.server.random.SecureTokenGenerator;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tollgate")
public class TollgateProperties {

  private String privateKey = "";
  private String issuer = "";
  private int tokenByteLength = SecureTokenGenerator.DEFAULT_BYTE_LENGTH;
  private final Redis redis = new Redis();

  public String getPrivateKey() {
    return privateKey;
  }

  public void setPrivateKey(String privateKey) {
    this.privateKey = privateKey;
  }

  public String getIssuer() {
    return issuer;
  }

  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  public int getTokenByteLength() {
    return tokenByteLength;
  }

  public void setTokenByteLength(int tokenByteLength) {
    this.tokenByteLength = tokenByteLength;
  }

  public Redis getRedis() {
    return redis;
  }

  public static class Redis {

    private String keyPrefix = "tollgate:token:";

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }
}
