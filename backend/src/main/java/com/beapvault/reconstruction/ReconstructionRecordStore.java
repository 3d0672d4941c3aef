package com.beapvault.reconstruction;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.beapvault.storage.JsonDocumentStore;

/**
 * Latest {@link ReconstructionRecord} per message, persisted under
 * {@code beap-reconstruction-store:<messageId>} and cached in memory.
 */
@Component
public class ReconstructionRecordStore {

    static final String STORE_PREFIX = "beap-reconstruction-store:";

    private final JsonDocumentStore documents;
    private final ConcurrentHashMap<String, Optional<ReconstructionRecord>> cache = new ConcurrentHashMap<>();

    public ReconstructionRecordStore(JsonDocumentStore documents) {
        this.documents = documents;
    }

    public void save(ReconstructionRecord record) {
        documents.write(STORE_PREFIX + record.messageId(), record);
        cache.put(record.messageId(), Optional.of(record));
    }

    public Optional<ReconstructionRecord> get(String messageId) {
        return cache.computeIfAbsent(messageId,
                id -> documents.read(STORE_PREFIX + id, ReconstructionRecord.class));
    }

    public ReconstructionState getState(String messageId) {
        return get(messageId).map(ReconstructionRecord::state).orElse(ReconstructionState.NONE);
    }

    /** Drops the cache; records are re-read from storage on demand. */
    public void load() {
        cache.clear();
    }

    public void reset() {
        cache.clear();
    }
}
