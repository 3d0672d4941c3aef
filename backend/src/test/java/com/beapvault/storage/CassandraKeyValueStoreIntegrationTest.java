package com.beapvault.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

import com.beapvault.CassandraContainerInitializer;
import com.beapvault.audit.AuditActor;
import com.beapvault.audit.AuditEventType;
import com.beapvault.audit.AuditLedger;

/**
 * Key-value store and audit ledger persistence against a real Cassandra container.
 *
 * Skipped where Docker is unavailable or SKIP_DB_TESTS is set.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@DisabledIfEnvironmentVariable(named = "SKIP_DB_TESTS", matches = "true")
@ContextConfiguration(initializers = CassandraContainerInitializer.class)
class CassandraKeyValueStoreIntegrationTest {

    @Autowired
    private KeyValueStore store;

    @Autowired
    private AuditLedger ledger;

    @Autowired
    private KeyValueRepository repository;

    @Test
    void cassandraBackend_shouldBeSelected() {
        assertInstanceOf(CassandraKeyValueStore.class, store);
    }

    @Test
    void setGetRemove_shouldRoundTrip() {
        String key = "it-kv:" + UUID.randomUUID();

        store.set(key, "{\"a\":1}");
        assertEquals("{\"a\":1}", store.get(key).orElseThrow());

        store.set(key, "{\"a\":2}");
        assertEquals("{\"a\":2}", store.get(key).orElseThrow());

        store.remove(key);
        assertTrue(store.get(key).isEmpty());
    }

    @Test
    void auditChain_shouldBeReadBackFromCassandra() {
        String messageId = "it-" + UUID.randomUUID();
        ledger.appendEvent(messageId, AuditEventType.IMPORTED, AuditActor.SYSTEM, "Message imported");
        ledger.appendEvent(messageId, AuditEventType.VERIFIED_ACCEPTED, AuditActor.SYSTEM, "Message accepted");

        ledger.load();

        assertEquals(2, ledger.getEvents(messageId).size());
        assertTrue(ledger.verifyChainIntegrity(messageId));
    }

    @Test
    void repository_shouldPersistEntryColumns() {
        String key = "it-repo:" + UUID.randomUUID();
        repository.save(new KeyValueEntry(key, "[]", 1_700_000_000_000L)).block();

        StepVerifier.create(repository.findById(key))
                .assertNext(found -> {
                    assertEquals("[]", found.getValue());
                    assertEquals(1_700_000_000_000L, found.getUpdatedAt());
                })
                .verifyComplete();

        repository.deleteById(key).block();
        StepVerifier.create(repository.findById(key)).verifyComplete();
    }
}
