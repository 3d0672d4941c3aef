package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum VerificationStatus {
    @JsonProperty("pending_verification") PENDING_VERIFICATION,
    @JsonProperty("verifying") VERIFYING,
    @JsonProperty("accepted") ACCEPTED,
    @JsonProperty("rejected") REJECTED
}
