package com.beapvault.audit;

/**
 * The ledger could not durably record an event. This is the one failure the vault
 * never degrades around: callers must let it propagate.
 */
public class AuditLedgerException extends RuntimeException {

    public AuditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
