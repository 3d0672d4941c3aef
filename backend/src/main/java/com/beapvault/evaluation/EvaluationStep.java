package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EvaluationStep {
    @JsonProperty("envelope_verification") ENVELOPE_VERIFICATION,
    @JsonProperty("boundary_check") BOUNDARY_CHECK,
    @JsonProperty("wrguard_intersection") WRGUARD_INTERSECTION;

    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
