package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IngressType {
    @JsonProperty("session") SESSION,
    @JsonProperty("allowlist") ALLOWLIST,
    @JsonProperty("handshake") HANDSHAKE,
    @JsonProperty("public") PUBLIC
}
