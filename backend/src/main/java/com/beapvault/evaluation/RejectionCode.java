package com.beapvault.evaluation;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed taxonomy of evaluation rejections. Every code is raised from exactly one
 * {@link EvaluationStep}, except {@link #EVALUATION_ERROR}, which reports the step
 * that was running when the unexpected failure happened.
 */
public enum RejectionCode {
    @JsonProperty("envelope_missing") ENVELOPE_MISSING,
    @JsonProperty("envelope_hash_missing") ENVELOPE_HASH_MISSING,
    @JsonProperty("envelope_hash_invalid") ENVELOPE_HASH_INVALID,
    @JsonProperty("signature_invalid") SIGNATURE_INVALID,
    @JsonProperty("signature_missing") SIGNATURE_MISSING,
    @JsonProperty("envelope_expired") ENVELOPE_EXPIRED,
    @JsonProperty("ingress_missing") INGRESS_MISSING,
    @JsonProperty("egress_missing") EGRESS_MISSING,
    @JsonProperty("provider_not_configured") PROVIDER_NOT_CONFIGURED,
    @JsonProperty("egress_not_allowed_by_wrguard") EGRESS_NOT_ALLOWED_BY_WRGUARD,
    @JsonProperty("ingress_not_allowed_by_wrguard") INGRESS_NOT_ALLOWED_BY_WRGUARD,
    @JsonProperty("handshake_not_found") HANDSHAKE_NOT_FOUND,
    @JsonProperty("evaluation_error") EVALUATION_ERROR;

    /** Wire form, e.g. {@code egress_missing}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
