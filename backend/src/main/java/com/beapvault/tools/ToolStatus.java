package com.beapvault.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ToolStatus {
    @JsonProperty("installed") INSTALLED,
    @JsonProperty("not_installed") NOT_INSTALLED,
    @JsonProperty("error") ERROR
}
