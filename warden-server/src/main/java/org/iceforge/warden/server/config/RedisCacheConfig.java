package org.iceforge.warden.server.config;

import org.iceforge.warden.server.cache.RedisCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Shared cache store for multi-instance deployments. Connection settings come from {@code spring.data.redis.*}.
 * <p>
 * Opt-in via: warden.cache.store=redis
 */
@Configuration
@ConditionalOnProperty(prefix = "warden.cache", name = "store", havingValue = "redis")
public class RedisCacheConfig {
    private static final Logger log = LoggerFactory.getLogger(RedisCacheConfig.class);

    @Bean
    public RedisCacheStore redisCacheStore(RedisConnectionFactory connectionFactory) {
        log.info("Using Redis cache store");
        return new RedisCacheStore(new StringRedisTemplate(connectionFactory));
    }
}
