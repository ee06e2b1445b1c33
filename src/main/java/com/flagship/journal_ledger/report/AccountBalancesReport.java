package com.flagship.journal_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Balances of every account as of a date, ordered by account code.
 *
 * {@code totalDebits} and {@code totalCredits} sum the postable accounts only
 * and are equal whenever the journal is in balance.
 */
@Value
public class AccountBalancesReport {
    LocalDate asOf;
    List<AccountBalanceLine> accounts;
    BigDecimal totalDebits;
    BigDecimal totalCredits;

    public boolean isBalanced() {
        return totalDebits.compareTo(totalCredits) == 0;
    }
}
