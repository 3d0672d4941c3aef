package com.beapvault.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ToolCategory {
    @JsonProperty("parser") PARSER,
    @JsonProperty("rasterizer") RASTERIZER
}
