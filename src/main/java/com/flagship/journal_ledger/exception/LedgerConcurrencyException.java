package com.flagship.journal_ledger.exception;

/**
 * A lock could not be obtained in time. The transaction was rolled back and
 * the operation can be retried as a whole.
 */
public abstract class LedgerConcurrencyException extends LedgerException {

    protected LedgerConcurrencyException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
