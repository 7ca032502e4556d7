package com.codeheadsystems.tollgate.springboot.config;

import com.codeheadsystems.tollgate.server.auth.ClaimsSigner;
import com.codeheadsystems.tollgate.server.auth.JwtClaimsSigner;
import com.codeheadsystems.tollgate.server.config.TokenManagerConfig;
import com.codeheadsystems.tollgate.server.manager.AccessTokenService;
import com.codeheadsystems.tollgate.server.manager.StatefulTokenService;
import com.codeheadsystems.tollgate.server.manager.TokenManager;
import com.codeheadsystems.tollgate.server.random.SecureTokenGenerator;
import com.codeheadsystems.tollgate.server.store.InMemoryKeyValueStore;
import com.codeheadsystems.tollgate.server.store.KeyValueStore;
import com.codeheadsystems.tollgate.server.store.StatefulTokenStore;
import com.codeheadsystems.tollgate.server.store.StoredTokenCodec;
import com.codeheadsystems.tollgate.springboot.store.RedisKeyValueStore;
import java.security.SecureRandom;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration")
@EnableConfigurationProperties(TollgateProperties.class)
@Import({TollgateAutoConfiguration.RedisStoreConfiguration.class,
    TollgateAutoConfiguration.InMemoryStoreConfiguration.class})
public class TollgateAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TollgateAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance for token keys.  Override this bean to supply a custom
   * implementation (e.g. a specific algorithm or provider).
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * Fails startup when {@code tollgate.private-key} is missing or blank.
   */
  @Bean
  @ConditionalOnMissingBean
  public TokenManagerConfig tokenManagerConfig(TollgateProperties props) {
    return new TokenManagerConfig(props.getPrivateKey(), props.getIssuer());
  }

  @Bean
  @ConditionalOnMissingBean
  public SecureTokenGenerator secureTokenGenerator(TollgateProperties props, SecureRandom secureRandom) {
    return new SecureTokenGenerator(secureRandom, props.getTokenByteLength());
  }

  @Bean
  @ConditionalOnMissingBean
  public ClaimsSigner claimsSigner(TokenManagerConfig config) {
    return new JwtClaimsSigner(config);
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenManager tokenManager(ClaimsSigner signer, SecureTokenGenerator generator,
                                   KeyValueStore keyValueStore) {
    StatefulTokenStore tokenStore =
        new StatefulTokenStore(keyValueStore, generator, signer, new StoredTokenCodec());
    return new TokenManager(
        new AccessTokenService(signer, Clock.systemUTC()),
        new StatefulTokenService(tokenStore, signer));
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(ReactiveStringRedisTemplate.class)
  @ConditionalOnBean(ReactiveStringRedisTemplate.class)
  static class RedisStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore redisKeyValueStore(ReactiveStringRedisTemplate redisTemplate, TollgateProperties props) {
      return new RedisKeyValueStore(redisTemplate, props.getRedis().getKeyPrefix());
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class InMemoryStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore inMemoryKeyValueStore() {
      log.warn("No ReactiveStringRedisTemplate available, using in-memory token store. "
          + "Tokens will be lost on restart. Do not use in production.");
      return new InMemoryKeyValueStore();
    }
  }
}
