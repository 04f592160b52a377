package com.gatediscovery.engine.lock;

import com.gatediscovery.engine.config.GateDiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Picks the {@link SessionCycleLock} implementation.
 *
 * - gate-discovery.lock.strategy=local (or unset): {@link LocalSessionCycleLock}
 * - gate-discovery.lock.strategy=redis: {@link RedisSessionCycleLock}
 */
@Slf4j
@Configuration
public class SessionCycleLockConfig {

    @Bean
    @ConditionalOnProperty(name = "gate-discovery.lock.strategy", havingValue = "local", matchIfMissing = true)
    public SessionCycleLock localSessionCycleLock() {
        log.info("Using in-process session cycle locks");
        return new LocalSessionCycleLock();
    }

    @Bean
    @ConditionalOnProperty(name = "gate-discovery.lock.strategy", havingValue = "redis")
    public SessionCycleLock redisSessionCycleLock(StringRedisTemplate redisTemplate,
                                                  GateDiscoveryProperties properties) {
        long ttlSeconds = properties.getLock().getTtlSeconds();
        log.info("Using Redis session cycle locks, TTL {}s", ttlSeconds);
        return new RedisSessionCycleLock(redisTemplate, Duration.ofSeconds(ttlSeconds));
    }
}
