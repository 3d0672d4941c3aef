package com.beapvault.tools;

import java.util.List;

public record ToolDiagnosticReport(
        long generatedAt,
        String registryVersion,
        List<ToolDiagnosticInfo> tools,
        boolean allVerified,
        long lastVerified,
        List<ToolExecutionLogEntry> recentExecutions) {
}
