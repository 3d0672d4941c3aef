package com.beapvault.audit;

import java.util.List;

/** Derived view of a message's chain; recomputed on every read. */
public record AuditChain(
        String messageId,
        List<AuditEvent> events,
        String headHash,
        int eventCount,
        long createdAt,
        long lastEventAt) {

    static AuditChain of(String messageId, List<AuditEvent> events) {
        AuditEvent first = events.get(0);
        AuditEvent last = events.get(events.size() - 1);
        return new AuditChain(messageId, events, last.eventHash(), events.size(), first.timestamp(), last.timestamp());
    }
}
