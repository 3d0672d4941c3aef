package com.beapvault.export;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BundleFileType {
    @JsonProperty("manifest") MANIFEST,
    @JsonProperty("envelope") ENVELOPE,
    @JsonProperty("semantic_text") SEMANTIC_TEXT,
    @JsonProperty("raster") RASTER,
    @JsonProperty("rejection_reason") REJECTION_REASON,
    @JsonProperty("audit_log") AUDIT_LOG
}
