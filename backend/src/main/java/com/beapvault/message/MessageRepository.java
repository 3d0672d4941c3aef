package com.beapvault.message;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MessageRepository extends ReactiveCassandraRepository<MessageEntity, String> {
    // Inherits: findById(id), save(entity)
}
