package com.beapvault.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RasterFormat {
    @JsonProperty("webp") WEBP,
    @JsonProperty("png") PNG
}
