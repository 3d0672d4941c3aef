package com.beapvault.reconstruction;

import java.time.Duration;

import com.beapvault.tools.BundledTool;
import com.beapvault.tools.ToolOperation;

public record ToolExecutionRequest(
        BundledTool tool,
        ToolOperation operation,
        String inputRef,
        String inputMimeType,
        Duration timeout,
        int memoryLimitMb,
        String requestId) {
}
