package com.beapvault.audit;

import java.util.List;

/**
 * Cryptographic references an audit event binds to. Every field is optional; absent
 * fields are left out of the hashed form.
 */
public record AuditRefs(
        String envelopeHash,
        String capsuleHash,
        List<String> artefactHashes,
        String ingressEventId,
        String dispatchEventId,
        String reconstructionHash,
        String exportHash,
        List<String> relatedMessageIds) {

    public AuditRefs {
        artefactHashes = artefactHashes == null ? null : List.copyOf(artefactHashes);
        relatedMessageIds = relatedMessageIds == null ? null : List.copyOf(relatedMessageIds);
    }

    public static AuditRefs none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String envelopeHash;
        private String capsuleHash;
        private List<String> artefactHashes;
        private String ingressEventId;
        private String dispatchEventId;
        private String reconstructionHash;
        private String exportHash;
        private List<String> relatedMessageIds;

        private Builder() {}

        public Builder envelopeHash(String envelopeHash) { this.envelopeHash = envelopeHash; return this; }
        public Builder capsuleHash(String capsuleHash) { this.capsuleHash = capsuleHash; return this; }
        public Builder artefactHashes(List<String> artefactHashes) { this.artefactHashes = artefactHashes; return this; }
        public Builder ingressEventId(String ingressEventId) { this.ingressEventId = ingressEventId; return this; }
        public Builder dispatchEventId(String dispatchEventId) { this.dispatchEventId = dispatchEventId; return this; }
        public Builder reconstructionHash(String reconstructionHash) { this.reconstructionHash = reconstructionHash; return this; }
        public Builder exportHash(String exportHash) { this.exportHash = exportHash; return this; }
        public Builder relatedMessageIds(List<String> relatedMessageIds) { this.relatedMessageIds = relatedMessageIds; return this; }

        public AuditRefs build() {
            return new AuditRefs(envelopeHash, capsuleHash, artefactHashes, ingressEventId, dispatchEventId,
                    reconstructionHash, exportHash, relatedMessageIds);
        }
    }
}
