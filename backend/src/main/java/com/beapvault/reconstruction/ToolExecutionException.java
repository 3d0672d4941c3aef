package com.beapvault.reconstruction;

/** A tool produced output the pipeline could not interpret. */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
