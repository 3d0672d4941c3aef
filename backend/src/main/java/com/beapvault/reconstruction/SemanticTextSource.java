package com.beapvault.reconstruction;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SemanticTextSource {
    @JsonProperty("tika") TIKA,
    @JsonProperty("none") NONE
}
