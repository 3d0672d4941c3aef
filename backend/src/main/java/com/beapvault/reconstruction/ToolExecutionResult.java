package com.beapvault.reconstruction;

public record ToolExecutionResult(
        boolean success,
        Integer exitCode,
        String stdout,
        String stderr,
        String error,
        boolean timedOut,
        long durationMs) {

    public static ToolExecutionResult succeeded(String stdout, String stderr, long durationMs) {
        return new ToolExecutionResult(true, 0, stdout, stderr, null, false, durationMs);
    }

    public static ToolExecutionResult failed(Integer exitCode, String stderr, String error, long durationMs) {
        return new ToolExecutionResult(false, exitCode, "", stderr, error, false, durationMs);
    }

    public static ToolExecutionResult timedOut(long durationMs) {
        return new ToolExecutionResult(false, null, "", "", "Tool execution timed out", true, durationMs);
    }
}
