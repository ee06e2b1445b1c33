package com.flagship.journal_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Materialized balance compared with the balance derived from the journal.
 */
@Value
public class BalanceRecomputation {
    UUID accountId;
    String accountCode;
    BigDecimal storedBalance;
    BigDecimal journalBalance;
    boolean healed;

    public BigDecimal getDrift() {
        return storedBalance.subtract(journalBalance);
    }

    public boolean hasDrift() {
        return storedBalance.compareTo(journalBalance) != 0;
    }
}
