package com.streetsweeping.engine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the reminder store.
 *
 * The engine persists two JSON documents (the reminder set and the preference list)
 * and serializes them itself with Jackson, so the template stores raw bytes under
 * String keys. Only active when {@code sweeping.store.type=redis}.
 */
@Configuration
@ConditionalOnProperty(name = "sweeping.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public RedisTemplate<String, byte[]> documentRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        // Keys like "sweeping:reminder-set"
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();
        return template;
    }
}
