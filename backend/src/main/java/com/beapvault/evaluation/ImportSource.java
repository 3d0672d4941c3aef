package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ImportSource {
    @JsonProperty("email") EMAIL,
    @JsonProperty("file") FILE,
    @JsonProperty("clipboard") CLIPBOARD,
    @JsonProperty("chat") CHAT
}
