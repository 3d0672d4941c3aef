package com.beapvault.reconstruction;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ReconstructionState {
    @JsonProperty("none") NONE,
    @JsonProperty("running") RUNNING,
    @JsonProperty("done") DONE,
    @JsonProperty("failed") FAILED
}
