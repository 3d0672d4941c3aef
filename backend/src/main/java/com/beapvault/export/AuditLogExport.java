package com.beapvault.export;

import java.util.List;

import com.beapvault.audit.AuditEvent;

/**
 * Self-verifying export of a message's full audit chain.
 *
 * <p>{@code chainVerification} is computed over every stored event, export records
 * included. {@code exportHash} is the SHA-256 of the canonical JSON of {@code version},
 * {@code messageId}, the events up to the last one that is not an export record, that
 * event's hash and the verification outcome. Neither {@code exportedAt} nor trailing
 * export records are covered, so exporting an unchanged chain twice yields the same hash.
 */
public record AuditLogExport(
        String version,
        long exportedAt,
        String messageId,
        List<AuditEvent> events,
        ChainVerification chainVerification,
        String exportHash) {
}
