package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EvaluationStatus {
    @JsonProperty("accepted") ACCEPTED,
    @JsonProperty("rejected") REJECTED
}
