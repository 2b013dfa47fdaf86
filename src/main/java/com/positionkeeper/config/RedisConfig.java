package com.positionkeeper.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the mutation token ledger.
 *
 * <p>All keys are prefixed with "pk:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   pk:mutation:token:{token}   → token state (DISPATCHED / APPLIED / FAILED), TTL-bound
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "pk:";

    public static final String KEY_PREFIX_MUTATION_TOKEN = KEY_PREFIX + "mutation:token:";

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(24);

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
