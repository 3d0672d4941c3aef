package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ExpiryStatus {
    @JsonProperty("valid") VALID,
    @JsonProperty("expired") EXPIRED,
    @JsonProperty("no_expiry") NO_EXPIRY
}
