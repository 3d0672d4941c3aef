package com.beapvault.audit;

/**
 * Structured, versioned context attached to an audit event. Free-form keys are not
 * allowed: anything worth recording gets a field here and a schema version bump.
 */
public record AuditMetadata(
        int schemaVersion,
        String rejectionCode,
        String failedStep,
        Integer attachmentCount,
        Long durationMs,
        String deliveryMethod,
        String note) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String rejectionCode;
        private String failedStep;
        private Integer attachmentCount;
        private Long durationMs;
        private String deliveryMethod;
        private String note;

        private Builder() {}

        public Builder rejectionCode(String rejectionCode) { this.rejectionCode = rejectionCode; return this; }
        public Builder failedStep(String failedStep) { this.failedStep = failedStep; return this; }
        public Builder attachmentCount(Integer attachmentCount) { this.attachmentCount = attachmentCount; return this; }
        public Builder durationMs(Long durationMs) { this.durationMs = durationMs; return this; }
        public Builder deliveryMethod(String deliveryMethod) { this.deliveryMethod = deliveryMethod; return this; }
        public Builder note(String note) { this.note = note; return this; }

        public AuditMetadata build() {
            return new AuditMetadata(CURRENT_SCHEMA_VERSION, rejectionCode, failedStep, attachmentCount,
                    durationMs, deliveryMethod, note);
        }
    }
}
