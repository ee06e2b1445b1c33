package com.flagship.journal_ledger.journal;

/**
 * Origin of a journal entry.
 */
public enum SourceType {
    SALES,
    PURCHASE,
    PAYMENT,
    MANUAL,
    CLOSING,
    ADJUSTMENT,
    REVERSAL
}
