package com.beapvault.audit;

/**
 * One link of a per-message hash chain. {@code eventHash} covers every other field,
 * {@code prevEventHash} included, so altering any past event breaks every later link.
 */
public record AuditEvent(
        String eventId,
        String messageId,
        AuditEventType type,
        long timestamp,
        AuditActor actor,
        String summary,
        AuditRefs refs,
        String prevEventHash,
        String eventHash,
        AuditMetadata metadata) {

    AuditEvent withEventHash(String hash) {
        return new AuditEvent(eventId, messageId, type, timestamp, actor, summary, refs, prevEventHash, hash, metadata);
    }
}
