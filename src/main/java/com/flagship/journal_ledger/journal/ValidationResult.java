package com.flagship.journal_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of {@link LedgerValidator#validate}. Valid when there are no violations.
 */
@Value
public class ValidationResult {
    List<String> violations;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    public boolean isValid() {
        return violations.isEmpty();
    }
}
