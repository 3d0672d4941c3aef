package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SignatureStatus {
    @JsonProperty("valid") VALID,
    @JsonProperty("invalid") INVALID,
    @JsonProperty("missing") MISSING,
    @JsonProperty("unknown") UNKNOWN
}
