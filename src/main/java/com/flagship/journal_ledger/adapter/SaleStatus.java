package com.flagship.journal_ledger.adapter;

public enum SaleStatus {
    DRAFT,
    CONFIRMED,
    INVOICED,
    PAID,
    CANCELLED;

    /**
     * Only invoiced or paid sales are recognized as revenue.
     */
    public boolean isJournaled() {
        return this == INVOICED || this == PAID;
    }
}
