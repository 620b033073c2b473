package org.budgetanalyzer.finance.config;

import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;

/**
 * Redis cache configuration for the Finance Service.
 *
 * <p>Only currency metadata is cached. Exchange rates and user records are read fresh for every
 * request, and the conversion context built from them is discarded when the request ends.
 */
@Configuration
@EnableCaching
public class CacheConfig {

  /** Cache name for currency metadata lists. */
  public static final String CURRENCIES_CACHE = "currencies";

  /**
   * Creates a GenericJackson2JsonRedisSerializer with polymorphic type handling.
   *
   * @param objectMapper application-wide ObjectMapper
   * @return configured serializer with type information
   */
  @Bean
  public GenericJackson2JsonRedisSerializer redisSerializer(ObjectMapper objectMapper) {
    // Copy so the application-wide mapper keeps its settings
    var mapper = objectMapper.copy();

    var typeValidator =
        BasicPolymorphicTypeValidator.builder()
            .allowIfBaseType(Object.class)
            .allowIfSubType("org.budgetanalyzer")
            .allowIfSubType("java.util")
            .build();

    mapper.activateDefaultTyping(typeValidator, ObjectMapper.DefaultTyping.NON_FINAL);

    return new GenericJackson2JsonRedisSerializer(mapper);
  }

  /**
   * Configures the currencies cache.
   *
   * <p>Currency metadata changes rarely and is maintained outside this service, so entries expire
   * after {@code finance-service.cache.currencies-ttl} instead of being evicted explicitly. Keys
   * are prefixed with {@code finance-service:} to avoid collisions with other services sharing the
   * Redis instance.
   *
   * @param redisSerializer configured serializer with type information
   * @param properties service properties
   * @return customizer for RedisCacheManager
   */
  @Bean
  public RedisCacheManagerBuilderCustomizer redisCacheManagerBuilderCustomizer(
      GenericJackson2JsonRedisSerializer redisSerializer, FinanceServiceProperties properties) {
    return builder ->
        builder.withCacheConfiguration(
            CURRENCIES_CACHE,
            RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(properties.getCache().getCurrenciesTtl())
                .disableCachingNullValues()
                .serializeKeysWith(
                    RedisSerializationContext.SerializationPair.fromSerializer(
                        new StringRedisSerializer()))
                .serializeValuesWith(
                    RedisSerializationContext.SerializationPair.fromSerializer(redisSerializer))
                .prefixCacheNameWith("finance-service:"));
  }
}
