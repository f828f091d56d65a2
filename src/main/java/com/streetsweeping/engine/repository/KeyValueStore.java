package com.streetsweeping.engine.repository;

import java.util.Optional;

/**
 * Minimal byte-oriented key/value store the engine persists its documents in.
 *
 * Implementations throw unchecked exceptions on I/O failure; callers decide whether
 * to retry.
 */
public interface KeyValueStore {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);
}
