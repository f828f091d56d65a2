package com.streetsweeping.engine.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Redis-backed store. Documents are written without TTL; the engine prunes them itself.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "sweeping.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisKeyValueStore implements KeyValueStore {

    private final RedisTemplate<String, byte[]> documentRedisTemplate;

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(documentRedisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, byte[] value) {
        documentRedisTemplate.opsForValue().set(key, value);
    }
}
