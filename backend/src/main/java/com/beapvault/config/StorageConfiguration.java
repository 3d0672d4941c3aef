package com.beapvault.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.beapvault.message.BeapMessageStore;
import com.beapvault.message.CassandraBeapMessageStore;
import com.beapvault.message.InMemoryBeapMessageStore;
import com.beapvault.message.MessageRepository;
import com.beapvault.storage.CassandraKeyValueStore;
import com.beapvault.storage.InMemoryKeyValueStore;
import com.beapvault.storage.KeyValueRepository;
import com.beapvault.storage.KeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Selects the persistence backend from {@code beap.storage.backend}.
 * {@code cassandra} is the default; {@code memory} keeps everything in-process.
 */
@Configuration
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "beap.storage", name = "backend", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore() {
        log.warn("Using in-memory key-value store; audit chains will not survive a restart");
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "beap.storage", name = "backend", havingValue = "memory")
    public BeapMessageStore inMemoryMessageStore() {
        return new InMemoryBeapMessageStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "beap.storage", name = "backend", havingValue = "cassandra", matchIfMissing = true)
    public KeyValueStore cassandraKeyValueStore(KeyValueRepository repository, BeapProperties properties, Clock clock) {
        return new CassandraKeyValueStore(repository, properties.storage().timeout(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "beap.storage", name = "backend", havingValue = "cassandra", matchIfMissing = true)
    public BeapMessageStore cassandraMessageStore(MessageRepository repository, ObjectMapper objectMapper,
                                                  BeapProperties properties) {
        return new CassandraBeapMessageStore(repository, objectMapper, properties.storage().timeout());
    }
}
