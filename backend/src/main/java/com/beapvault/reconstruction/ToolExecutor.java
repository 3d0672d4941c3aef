package com.beapvault.reconstruction;

/**
 * Runs one bundled tool invocation in isolation from the vault process.
 *
 * <p>Implementations report every tool failure, including a timeout, through the
 * returned {@link ToolExecutionResult} and do not throw for them.
 */
public interface ToolExecutor {

    ToolExecutionResult execute(ToolExecutionRequest request);
}
