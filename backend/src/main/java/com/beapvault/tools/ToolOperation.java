package com.beapvault.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ToolOperation {
    @JsonProperty("parse") PARSE,
    @JsonProperty("rasterize") RASTERIZE
}
