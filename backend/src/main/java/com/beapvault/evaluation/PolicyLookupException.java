package com.beapvault.evaluation;

/**
 * The local policy store did not answer in time or failed. Evaluation turns this
 * into an {@code evaluation_error} rejection.
 */
public class PolicyLookupException extends RuntimeException {

    public PolicyLookupException(String message) {
        super(message);
    }

    public PolicyLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
