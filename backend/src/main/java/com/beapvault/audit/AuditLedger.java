package com.beapvault.audit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.beapvault.crypto.ContentHasher;
import com.beapvault.storage.JsonDocumentStore;
import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Append-only, per-message, hash-chained audit log.
 *
 * <p><b>Chain contract:</b> the first event of a message has {@code prevEventHash == null};
 * every later event carries the previous event's {@code eventHash}; each {@code eventHash}
 * is the SHA-256 of the canonical JSON of all other fields of the event.
 * {@link #verifyChainIntegrity(String)} recomputes every hash and link.
 *
 * <p><b>Concurrency:</b> appends for one message are serialized by a per-message lock, so
 * two concurrent appends can never both link to the same predecessor. Reads return
 * immutable snapshots and never block on writers.
 *
 * <p><b>Durability:</b> each append writes the whole chain through to the key-value store
 * under {@code beap-audit-store:<messageId>} before the in-memory view is updated. A failed
 * write raises {@link AuditLedgerException} and leaves the chain as it was.
 */
@Service
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    static final String STORE_PREFIX = "beap-audit-store:";
    private static final TypeReference<List<AuditEvent>> EVENT_LIST = new TypeReference<>() {};

    private final JsonDocumentStore documents;
    private final ContentHasher hasher;
    private final Clock clock;

    private final ConcurrentHashMap<String, List<AuditEvent>> chains = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public AuditLedger(JsonDocumentStore documents, ContentHasher hasher, Clock clock) {
        this.documents = documents;
        this.hasher = hasher;
        this.clock = clock;
    }

    public AuditEvent appendEvent(String messageId, AuditEventType type, AuditActor actor, String summary) {
        return appendEvent(messageId, type, actor, summary, AuditRefs.none(), null);
    }

    public AuditEvent appendEvent(String messageId, AuditEventType type, AuditActor actor, String summary,
                                  AuditRefs refs, AuditMetadata metadata) {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(actor, "actor");

        ReentrantLock lock = locks.computeIfAbsent(messageId, id -> new ReentrantLock());
        lock.lock();
        try {
            List<AuditEvent> existing = eventsOf(messageId);
            String prevEventHash = existing.isEmpty() ? null : existing.get(existing.size() - 1).eventHash();

            AuditEvent unsigned = new AuditEvent(newEventId(), messageId, type, clock.millis(), actor, summary,
                    refs == null ? AuditRefs.none() : refs, prevEventHash, null, metadata);
            AuditEvent event = unsigned.withEventHash(computeEventHash(unsigned));

            List<AuditEvent> appended = new ArrayList<>(existing);
            appended.add(event);
            List<AuditEvent> snapshot = List.copyOf(appended);

            persist(messageId, snapshot);
            chains.put(messageId, snapshot);
            log.debug("Appended {} event {} to chain of {} ({} events)", type, event.eventId(), messageId, snapshot.size());
            return event;
        } finally {
            lock.unlock();
        }
    }

    /** Events of a message in append order; empty if none. */
    public List<AuditEvent> getEvents(String messageId) {
        return eventsOf(messageId);
    }

    public List<AuditEvent> getEventsOfType(String messageId, AuditEventType type) {
        return eventsOf(messageId).stream()
                .filter(e -> e.type() == type)
                .toList();
    }

    public Optional<AuditEvent> getLastEvent(String messageId) {
        List<AuditEvent> events = eventsOf(messageId);
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    public Optional<AuditChain> getChain(String messageId) {
        List<AuditEvent> events = eventsOf(messageId);
        return events.isEmpty() ? Optional.empty() : Optional.of(AuditChain.of(messageId, events));
    }

    public boolean verifyChainIntegrity(String messageId) {
        boolean valid = verifyChain(eventsOf(messageId));
        if (!valid) {
            log.warn("Audit chain integrity check failed for message {}", messageId);
        }
        return valid;
    }

    /**
     * Checks that {@code events} form a valid chain from its first event on. An empty
     * list is a valid chain.
     */
    public boolean verifyChain(List<AuditEvent> events) {
        String expectedPrev = null;
        for (AuditEvent event : events) {
            if (!Objects.equals(event.prevEventHash(), expectedPrev)) {
                return false;
            }
            if (!computeEventHash(event).equals(event.eventHash())) {
                return false;
            }
            expectedPrev = event.eventHash();
        }
        return true;
    }

    /** Drops cached chains; the next read of each message reloads it from storage. */
    public void load() {
        chains.clear();
    }

    /** Forgets all in-memory state. Persisted chains are untouched. */
    public void reset() {
        chains.clear();
        locks.clear();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private List<AuditEvent> eventsOf(String messageId) {
        return chains.computeIfAbsent(messageId, this::loadChain);
    }

    private List<AuditEvent> loadChain(String messageId) {
        try {
            return documents.read(STORE_PREFIX + messageId, EVENT_LIST)
                    .map(List::copyOf)
                    .orElse(List.of());
        } catch (RuntimeException e) {
            throw new AuditLedgerException("Failed to load audit chain for message " + messageId, e);
        }
    }

    private void persist(String messageId, List<AuditEvent> events) {
        try {
            documents.write(STORE_PREFIX + messageId, events);
        } catch (RuntimeException e) {
            log.error("Failed to persist audit chain for message {}", messageId, e);
            throw new AuditLedgerException("Failed to persist audit event for message " + messageId, e);
        }
    }

    String computeEventHash(AuditEvent event) {
        return hasher.hashOf(new HashedFields(event.eventId(), event.messageId(), event.type(), event.timestamp(),
                event.actor(), event.summary(), event.refs(), event.prevEventHash(), event.metadata()));
    }

    private static String newEventId() {
        return "evt_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /** Every field of an event except its own hash. */
    private record HashedFields(
            String eventId,
            String messageId,
            AuditEventType type,
            long timestamp,
            AuditActor actor,
            String summary,
            AuditRefs refs,
            String prevEventHash,
            AuditMetadata metadata) {
    }
}
