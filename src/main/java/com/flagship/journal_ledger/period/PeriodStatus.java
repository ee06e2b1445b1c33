package com.flagship.journal_ledger.period;

/**
 * OPEN accepts postings. CLOSED does not, but can be reopened. LOCKED is final.
 */
public enum PeriodStatus {
    OPEN,
    CLOSED,
    LOCKED;

    public boolean acceptsPostings() {
        return this == OPEN;
    }
}
