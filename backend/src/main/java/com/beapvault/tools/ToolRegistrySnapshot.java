package com.beapvault.tools;

import java.util.Map;

/** Persisted form of the registry. */
public record ToolRegistrySnapshot(
        Map<String, BundledTool> tools,
        String registryVersion,
        long lastVerified,
        boolean allVerified) {

    public ToolRegistrySnapshot {
        tools = tools == null ? Map.of() : Map.copyOf(tools);
    }
}
