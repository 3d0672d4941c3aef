package com.beapvault.storage;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backend. Used by the {@code memory} storage profile and by tests.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }
}
