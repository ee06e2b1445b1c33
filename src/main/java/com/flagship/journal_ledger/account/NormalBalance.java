package com.flagship.journal_ledger.account;

import java.math.BigDecimal;

/**
 * The side on which an account's balance naturally increases.
 */
public enum NormalBalance {
    DEBIT,
    CREDIT;

    /**
     * Converts a debit/credit pair into the signed change of a balance kept on this side.
     */
    public BigDecimal signedDelta(BigDecimal debit, BigDecimal credit) {
        BigDecimal d = debit != null ? debit : BigDecimal.ZERO;
        BigDecimal c = credit != null ? credit : BigDecimal.ZERO;
        return this == DEBIT ? d.subtract(c) : c.subtract(d);
    }
}
