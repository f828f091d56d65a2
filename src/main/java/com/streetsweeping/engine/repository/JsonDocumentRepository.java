package com.streetsweeping.engine.repository;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Stores one JSON document under a fixed key.
 *
 * Every change is a read-modify-write of the whole document under a single lock, so
 * concurrent updates within this process never interleave. Store failures are retried
 * once and then surfaced as {@link StoreUnavailableException}.
 *
 * @param <T> document type
 */
@Slf4j
public abstract class JsonDocumentRepository<T> {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final String key;
    private final JavaType documentType;
    private final ReentrantLock lock = new ReentrantLock();

    protected JsonDocumentRepository(KeyValueStore store, ObjectMapper objectMapper,
                                     String key, Class<T> documentClass) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.key = key;
        this.documentType = objectMapper.getTypeFactory().constructType(documentClass);
    }

    /**
     * Document returned when nothing is stored yet.
     */
    protected abstract T emptyDocument();

    public T load() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code change} to the current document and stores the result.
     *
     * @return the stored document
     */
    public T update(UnaryOperator<T> change) {
        lock.lock();
        try {
            T updated = change.apply(read());
            write(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public void save(T document) {
        lock.lock();
        try {
            write(document);
        } finally {
            lock.unlock();
        }
    }

    private T read() {
        byte[] bytes = withRetry("read", () -> store.get(key).orElse(null));
        if (bytes == null) {
            return emptyDocument();
        }
        try {
            return objectMapper.readValue(bytes, documentType);
        } catch (IOException e) {
            // A corrupt document cannot be repaired by retrying; start over.
            log.error("Stored document '{}' is unreadable, replacing it with an empty one", key, e);
            return emptyDocument();
        }
    }

    private void write(T document) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize document '" + key + "'", e);
        }
        withRetry("write", () -> {
            store.set(key, bytes);
            return null;
        });
    }

    private <R> R withRetry(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (RuntimeException first) {
            log.warn("Store {} of '{}' failed, retrying once: {}", operation, key, first.getMessage());
            try {
                return action.get();
            } catch (RuntimeException second) {
                if (second != first) {
                    second.addSuppressed(first);
                }
                throw new StoreUnavailableException("Store " + operation + " of '" + key + "' failed", second);
            }
        }
    }
}
