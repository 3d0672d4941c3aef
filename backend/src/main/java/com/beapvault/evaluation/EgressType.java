package com.beapvault.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EgressType {
    @JsonProperty("web") WEB,
    @JsonProperty("email") EMAIL,
    @JsonProperty("file") FILE,
    @JsonProperty("api") API,
    @JsonProperty("none") NONE
}
