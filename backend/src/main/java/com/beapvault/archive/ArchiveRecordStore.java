package com.beapvault.archive;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.beapvault.storage.JsonDocumentStore;

/**
 * Archive records by message id, persisted under {@code beap-archive-records:<messageId>}.
 * A record, once written, is never replaced; it is only withdrawn when the
 * {@code archived} event for it could not be logged.
 */
@Component
public class ArchiveRecordStore {

    static final String STORE_PREFIX = "beap-archive-records:";

    private final JsonDocumentStore documents;
    private final ConcurrentHashMap<String, Optional<ArchiveRecord>> cache = new ConcurrentHashMap<>();

    public ArchiveRecordStore(JsonDocumentStore documents) {
        this.documents = documents;
    }

    /**
     * Stores {@code record} unless the message already has one.
     *
     * @return {@code false} if a record existed
     */
    public synchronized boolean saveIfAbsent(ArchiveRecord record) {
        if (get(record.messageId()).isPresent()) {
            return false;
        }
        documents.write(STORE_PREFIX + record.messageId(), record);
        cache.put(record.messageId(), Optional.of(record));
        return true;
    }

    /** Withdraws a record whose archive could not be logged. */
    synchronized void discard(String messageId) {
        documents.remove(STORE_PREFIX + messageId);
        cache.put(messageId, Optional.empty());
    }

    public Optional<ArchiveRecord> get(String messageId) {
        return cache.computeIfAbsent(messageId, id -> documents.read(STORE_PREFIX + id, ArchiveRecord.class));
    }

    public boolean isArchived(String messageId) {
        return get(messageId).isPresent();
    }

    /** Drops the cache; records are re-read from storage on demand. */
    public void load() {
        cache.clear();
    }

    public void reset() {
        cache.clear();
    }
}
