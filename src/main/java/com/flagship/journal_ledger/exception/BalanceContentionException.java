package com.flagship.journal_ledger.exception;

public class BalanceContentionException extends LedgerConcurrencyException {

    public BalanceContentionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "BALANCE_CONTENTION";
    }
}
