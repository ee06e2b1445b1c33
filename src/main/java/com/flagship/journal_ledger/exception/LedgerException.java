package com.flagship.journal_ledger.exception;

/**
 * Base type for every failure the ledger reports to its callers.
 *
 * Subclasses fall into four categories, each with its own retry contract:
 * <ul>
 *   <li>{@link LedgerValidationException} - the request is malformed, fix the input</li>
 *   <li>{@link LedgerConcurrencyException} - lock contention, safe to retry with backoff</li>
 *   <li>{@link LedgerStateException} - the entry is in the wrong state, do not retry</li>
 *   <li>{@link ChartOfAccountsIntegrityException} - configuration is broken, do not retry</li>
 * </ul>
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code, used in API error bodies and metric tags.
     */
    public abstract String getErrorCode();

    public boolean isRetryable() {
        return false;
    }
}
