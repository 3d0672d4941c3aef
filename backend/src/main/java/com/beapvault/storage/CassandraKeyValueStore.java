package com.beapvault.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link KeyValueStore} over the {@code kv_store} Cassandra table.
 *
 * <p>The vault core is synchronous, so every reactive repository call is blocked on
 * with the configured storage timeout. Callers on the Netty event loop must hop to a
 * bounded-elastic scheduler first; the HTTP controllers do.
 */
public class CassandraKeyValueStore implements KeyValueStore {

    private final KeyValueRepository repository;
    private final Duration timeout;
    private final Clock clock;

    public CassandraKeyValueStore(KeyValueRepository repository, Duration timeout, Clock clock) {
        this.repository = repository;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return repository.findById(key)
                .map(KeyValueEntry::getValue)
                .blockOptional(timeout);
    }

    @Override
    public void set(String key, String value) {
        repository.save(new KeyValueEntry(key, value, clock.millis())).block(timeout);
    }

    @Override
    public void remove(String key) {
        repository.deleteById(key).block(timeout);
    }
}
