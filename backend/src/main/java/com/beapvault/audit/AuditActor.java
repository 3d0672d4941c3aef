package com.beapvault.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AuditActor {
    @JsonProperty("system") SYSTEM,
    @JsonProperty("user") USER
}
