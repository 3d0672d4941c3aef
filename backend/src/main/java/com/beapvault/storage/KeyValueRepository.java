package com.beapvault.storage;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface KeyValueRepository extends ReactiveCassandraRepository<KeyValueEntry, String> {
    // Inherits: findById(key), save(entry), deleteById(key)
}
