package com.flagship.journal_ledger.exception;

public class SourceContentionException extends LedgerConcurrencyException {

    public SourceContentionException(String source, Throwable cause) {
        super("Timed out waiting for another posting of the same source: " + source, cause);
    }

    @Override
    public String getErrorCode() {
        return "SOURCE_CONTENTION";
    }
}
