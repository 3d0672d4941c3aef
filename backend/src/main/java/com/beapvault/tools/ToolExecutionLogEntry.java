package com.beapvault.tools;

/**
 * Attestation of a single tool invocation: which exact tool build touched which request.
 */
public record ToolExecutionLogEntry(
        long timestamp,
        String toolId,
        String toolVersion,
        String toolHash,
        String requestId,
        ToolOperation operation,
        boolean success,
        boolean timedOut,
        long durationMs,
        String error) {
}
