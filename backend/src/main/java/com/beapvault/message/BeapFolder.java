package com.beapvault.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BeapFolder {
    @JsonProperty("inbox") INBOX,
    @JsonProperty("outbox") OUTBOX,
    @JsonProperty("archived") ARCHIVED,
    @JsonProperty("rejected") REJECTED
}
