package com.beapvault.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AuditEventType {
    @JsonProperty("imported") IMPORTED,
    @JsonProperty("verified.accepted") VERIFIED_ACCEPTED,
    @JsonProperty("verified.rejected") VERIFIED_REJECTED,
    @JsonProperty("envelope.generated") ENVELOPE_GENERATED,
    @JsonProperty("builder.applied") BUILDER_APPLIED,
    @JsonProperty("dispatched") DISPATCHED,
    @JsonProperty("delivery.confirmed") DELIVERY_CONFIRMED,
    @JsonProperty("delivery.failed") DELIVERY_FAILED,
    @JsonProperty("reconstructed.started") RECONSTRUCTED_STARTED,
    @JsonProperty("reconstructed.completed") RECONSTRUCTED_COMPLETED,
    @JsonProperty("reconstructed.failed") RECONSTRUCTED_FAILED,
    @JsonProperty("archived") ARCHIVED,
    @JsonProperty("exported.audit") EXPORTED_AUDIT,
    @JsonProperty("exported.proof") EXPORTED_PROOF;

    /** Events that only record an export of the chain itself. */
    public boolean isExport() {
        return this == EXPORTED_AUDIT || this == EXPORTED_PROOF;
    }
}
