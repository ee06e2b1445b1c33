package com.flagship.journal_ledger.exception;

public class PeriodContentionException extends LedgerConcurrencyException {

    public PeriodContentionException(String period, Throwable cause) {
        super("Timed out waiting for accounting period " + period, cause);
    }

    @Override
    public String getErrorCode() {
        return "PERIOD_CONTENTION";
    }
}
