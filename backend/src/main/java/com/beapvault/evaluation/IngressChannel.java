package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IngressChannel {
    @JsonProperty("email") EMAIL("Email"),
    @JsonProperty("messenger") MESSENGER("Messenger"),
    @JsonProperty("download") DOWNLOAD("Download"),
    @JsonProperty("chat") CHAT("Chat"),
    @JsonProperty("unknown") UNKNOWN("Unknown");

    private final String displayName;

    IngressChannel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
