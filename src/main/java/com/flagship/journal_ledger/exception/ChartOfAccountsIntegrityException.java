package com.flagship.journal_ledger.exception;

/**
 * An account the ledger depends on is missing, inactive or not postable.
 *
 * Raised by the source adapters when a fixed chart-of-accounts code cannot be
 * resolved. This is a configuration problem; retrying will not help.
 */
public class ChartOfAccountsIntegrityException extends LedgerException {

    private final String accountCode;

    public ChartOfAccountsIntegrityException(String accountCode, String message) {
        super(message);
        this.accountCode = accountCode;
    }

    public String getAccountCode() {
        return accountCode;
    }

    @Override
    public String getErrorCode() {
        return "CHART_OF_ACCOUNTS_INTEGRITY";
    }
}
