package com.beapvault.archive;

import java.util.List;

import com.beapvault.audit.AuditActor;
import com.beapvault.evaluation.EnvelopeSummary;
import com.beapvault.evaluation.RejectionReason;

/**
 * Frozen, hash-bound snapshot of a message at the moment it was archived.
 * {@code auditChainHash} is the ledger head just before the {@code archived} event.
 */
public record ArchiveRecord(
        String messageId,
        long archivedAt,
        AuditActor archivedBy,
        MessageSnapshot messageSnapshot,
        EnvelopeRef envelopeRef,
        CapsuleRef capsuleRef,
        ReconstructionRef reconstructionRef,
        List<String> ingressEventIds,
        List<String> dispatchEventIds,
        String auditChainHash,
        RejectionReason rejectionReason) {

    public ArchiveRecord {
        ingressEventIds = ingressEventIds == null ? List.of() : List.copyOf(ingressEventIds);
        dispatchEventIds = dispatchEventIds == null ? List.of() : List.copyOf(dispatchEventIds);
    }

    public record MessageSnapshot(
            String title,
            String status,
            String direction,
            String deliveryMethod,
            long timestamp,
            String fingerprint,
            String fingerprintFull,
            String senderName,
            String channelSite) {
    }

    public record EnvelopeRef(String envelopeHash, EnvelopeSummary summary) {
    }

    public record CapsuleRef(String capsuleHash, String semanticTextHash, int attachmentCount) {
    }

    public record ReconstructionRef(String reconstructionHash, List<String> semanticTextHashes, List<String> rasterHashes) {
        public ReconstructionRef {
            semanticTextHashes = semanticTextHashes == null ? List.of() : List.copyOf(semanticTextHashes);
            rasterHashes = rasterHashes == null ? List.of() : List.copyOf(rasterHashes);
        }
    }
}
