package com.flagship.journal_ledger.exception;

import com.flagship.journal_ledger.journal.ValidationResult;

import java.util.List;

/**
 * The submitted entry violates a bookkeeping rule. Nothing was written.
 */
public class LedgerValidationException extends LedgerException {

    private final transient ValidationResult result;

    public LedgerValidationException(ValidationResult result) {
        super("Journal entry rejected: " + String.join("; ", result.getViolations()));
        this.result = result;
    }

    public LedgerValidationException(String message) {
        super(message);
        this.result = null;
    }

    public List<String> getViolations() {
        return result != null ? result.getViolations() : List.of(getMessage());
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_FAILED";
    }
}
