package com.streetsweeping.engine.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for development and tests ({@code sweeping.store.type=memory}).
 */
@Component
@ConditionalOnProperty(name = "sweeping.store.type", havingValue = "memory")
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = entries.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void set(String key, byte[] value) {
        entries.put(key, value.clone());
    }
}
