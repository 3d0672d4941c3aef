package com.beapvault.tools;

public record ToolDiagnosticInfo(
        String id,
        String name,
        String version,
        String hash,
        String licenseId,
        ToolStatus status,
        long installedAt) {

    static ToolDiagnosticInfo of(BundledTool tool) {
        return new ToolDiagnosticInfo(tool.id(), tool.name(), tool.version(), tool.hash(),
                tool.license().identifier().spdxId(), tool.status(), tool.installedAt());
    }
}
