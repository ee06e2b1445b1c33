package com.flagship.journal_ledger.exception;

public class SequenceContentionException extends LedgerConcurrencyException {

    public SequenceContentionException(String prefix, Throwable cause) {
        super("Timed out waiting for entry number counter: prefix=" + prefix, cause);
    }

    @Override
    public String getErrorCode() {
        return "SEQUENCE_CONTENTION";
    }
}
