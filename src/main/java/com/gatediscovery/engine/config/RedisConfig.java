package com.gatediscovery.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatediscovery.engine.dto.GateSnapshot;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the gate snapshot cache.
 *
 * Snapshots are stored as plain JSON of {@link GateSnapshot} under
 * "gate:snapshot:{sessionId}:{gateId}". The serializer is bound to that one
 * type, so no class hints end up in the stored values.
 *
 * The auto-configured {@code StringRedisTemplate} is used for the cycle locks.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, GateSnapshot> gateSnapshotRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                         ObjectMapper objectMapper) {
        RedisTemplate<String, GateSnapshot> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        Jackson2JsonRedisSerializer<GateSnapshot> serializer =
            new Jackson2JsonRedisSerializer<>(objectMapper, GateSnapshot.class);
        template.setValueSerializer(serializer);
        template.setHashValueSerializer(serializer);

        template.afterPropertiesSet();
        return template;
    }
}
